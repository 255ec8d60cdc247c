package com.crypto.connector.exchanges.binance;

import com.crypto.connector.common.auth.RequestSigner;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.impl.BaseExchangeClient;
import com.crypto.connector.common.exchange.impl.ClientSettings;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.OperationNotSupportedException;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderResult;
import com.crypto.connector.common.model.OrderSide;
import com.crypto.connector.common.model.OrderSnapshot;
import com.crypto.connector.common.model.OrderStatus;
import com.crypto.connector.common.model.OrderType;
import com.crypto.connector.common.model.Ticker;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binance.US spot client. Order handles are {@code SYMBOL:orderId} since the exchange
 * needs both to look an order up.
 */
@Slf4j
public class BinanceClient extends BaseExchangeClient {
    public static final String PROD_URL = "https://api.binance.us";
    public static final String SANDBOX_URL = "https://testnet.binance.vision";

    public BinanceClient(ExchangeConnectionConfig config, String baseUrl, RequestSigner signer, ClientSettings settings) {
        super("binance", config, baseUrl, signer, settings);
    }

    public static String defaultBaseUrl(ExchangeEnv env) {
        return env == ExchangeEnv.SANDBOX ? SANDBOX_URL : PROD_URL;
    }

    @Override
    public List<Balance> getBalance() {
        JsonNode account = get("/api/v3/account", "", true);
        List<Balance> balances = new ArrayList<>();
        for (JsonNode node : account.path("balances")) {
            Balance balance = new Balance(node.path("asset").asText(),
                    decimal(node.path("free")), decimal(node.path("locked")));
            if (!balance.isZero()) {
                balances.add(balance);
            }
        }
        return balances;
    }

    @Override
    public Ticker getTicker(String symbol) {
        if (StringUtils.isBlank(symbol)) {
            throw new CredentialValidationException("Symbol is required");
        }
        String pair = symbol.toUpperCase();
        JsonNode data = get("/api/v3/ticker/24hr", form(Map.of("symbol", pair)), false);
        long closeTime = data.path("closeTime").asLong(0);
        return new Ticker(pair,
                decimal(data.path("lastPrice")),
                decimal(data.path("priceChangePercent")),
                decimal(data.path("highPrice")),
                decimal(data.path("lowPrice")),
                decimal(data.path("volume")),
                closeTime > 0 ? Instant.ofEpochMilli(closeTime) : settings.clock.instant());
    }

    @Override
    public OrderResult createOrder(OrderRequest request) {
        request.validate();
        String symbol = request.symbol.toUpperCase();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("side", request.side.name());
        params.put("type", orderType(request.type));
        if (request.type == OrderType.LIMIT || request.type == OrderType.STOP_LIMIT) {
            params.put("timeInForce", "GTC");
        }
        params.put("quantity", plain(request.quantity));
        if (request.type.requiresPrice()) {
            params.put("price", plain(request.price));
        }
        if (request.type.requiresStopPrice()) {
            params.put("stopPrice", plain(request.stopPrice));
        }
        JsonNode json = send(HttpMethod.POST, "/api/v3/order", form(params), "", MediaType.APPLICATION_JSON, true);
        String orderId = text(json, "orderId");
        if (StringUtils.isBlank(orderId)) {
            throw new ExchangeApiException(name, 200, null, "Order response has no orderId");
        }
        LOG.info("binance order placed symbol={} orderId={} status={}", symbol, orderId, text(json, "status"));
        return new OrderResult(handle(symbol, orderId), text(json, "status"),
                decimal(json.path("executedQty")), text(json, "clientOrderId"));
    }

    @Override
    public OrderResult cancelOrder(String orderId) {
        String[] ref = parseHandle(orderId);
        JsonNode json = send(HttpMethod.DELETE, "/api/v3/order",
                form(orderParams(ref)), "", MediaType.APPLICATION_JSON, true);
        return new OrderResult(orderId, text(json, "status"), decimal(json.path("executedQty")), null);
    }

    @Override
    public OrderSnapshot getOrderStatus(String orderId) {
        String[] ref = parseHandle(orderId);
        JsonNode json = get("/api/v3/order", form(orderParams(ref)), true);
        String raw = StringUtils.defaultString(text(json, "status"));
        String side = text(json, "side");
        return new OrderSnapshot(orderId, ref[0],
                StringUtils.isBlank(side) ? null : OrderSide.from(side),
                normalizeStatus(raw), raw,
                decimal(json.path("origQty")),
                decimal(json.path("executedQty")),
                decimal(json.path("price")));
    }

    static OrderStatus normalizeStatus(String raw) {
        return switch (raw.toUpperCase()) {
            // A pending cancel can still fill, so it stays live until the exchange confirms.
            case "NEW", "PENDING_CANCEL" -> OrderStatus.OPEN;
            case "PARTIALLY_FILLED" -> OrderStatus.PARTIALLY_FILLED;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELED" -> OrderStatus.CANCELLED;
            case "REJECTED" -> OrderStatus.REJECTED;
            case "EXPIRED", "EXPIRED_IN_MATCH" -> OrderStatus.EXPIRED;
            default -> OrderStatus.PENDING;
        };
    }

    @Override
    protected void checkPayload(JsonNode json) {
        JsonNode code = json.get("code");
        if (code != null && code.isNumber() && code.asInt() < 0) {
            throw new ExchangeApiException(name, 200, code.asText(), text(json, "msg"));
        }
    }

    static String handle(String symbol, String orderId) {
        return symbol + ":" + orderId;
    }

    static String[] parseHandle(String handle) {
        if (StringUtils.isBlank(handle)) {
            throw new CredentialValidationException("Order id is required");
        }
        int idx = handle.indexOf(':');
        if (idx <= 0 || idx == handle.length() - 1) {
            throw new CredentialValidationException("Binance order id must look like SYMBOL:orderId");
        }
        return new String[]{handle.substring(0, idx).toUpperCase(), handle.substring(idx + 1)};
    }

    private static Map<String, String> orderParams(String[] ref) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", ref[0]);
        params.put("orderId", ref[1]);
        return params;
    }

    private static String orderType(OrderType type) {
        return switch (type) {
            case MARKET -> "MARKET";
            case LIMIT -> "LIMIT";
            case STOP_LOSS -> "STOP_LOSS";
            case STOP_LIMIT -> "STOP_LOSS_LIMIT";
            case TRAILING_STOP -> throw new OperationNotSupportedException("Binance.US does not support trailing stop orders");
        };
    }
}

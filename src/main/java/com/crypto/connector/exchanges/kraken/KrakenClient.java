package com.crypto.connector.exchanges.kraken;

import com.crypto.connector.common.auth.RequestSigner;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.impl.BaseExchangeClient;
import com.crypto.connector.common.exchange.impl.ClientSettings;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderResult;
import com.crypto.connector.common.model.OrderSide;
import com.crypto.connector.common.model.OrderSnapshot;
import com.crypto.connector.common.model.OrderStatus;
import com.crypto.connector.common.model.Ticker;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class KrakenClient extends BaseExchangeClient {
    public static final String PROD_URL = "https://api.kraken.com";
    public static final String SANDBOX_URL = "https://api.demo-futures.kraken.com";

    private static final String PRIVATE_PREFIX = "/0/private/";

    public KrakenClient(ExchangeConnectionConfig config, String baseUrl, RequestSigner signer, ClientSettings settings) {
        super("kraken", config, baseUrl, signer, settings);
    }

    public static String defaultBaseUrl(ExchangeEnv env) {
        return env == ExchangeEnv.SANDBOX ? SANDBOX_URL : PROD_URL;
    }

    @Override
    public List<Balance> getBalance() {
        JsonNode result = privateCall("Balance", Map.of()).path("result");
        List<Balance> balances = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = result.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            BigDecimal amount = decimal(entry.getValue());
            if (amount.signum() != 0) {
                balances.add(new Balance(entry.getKey(), amount, BigDecimal.ZERO));
            }
        }
        return balances;
    }

    @Override
    public Ticker getTicker(String symbol) {
        if (StringUtils.isBlank(symbol)) {
            throw new CredentialValidationException("Symbol is required");
        }
        JsonNode result = get("/0/public/Ticker", form(Map.of("pair", symbol.toUpperCase())), false).path("result");
        Iterator<JsonNode> pairs = result.elements();
        if (!pairs.hasNext()) {
            throw new ExchangeApiException(name, 200, null, "No ticker returned for " + symbol);
        }
        JsonNode data = pairs.next();
        BigDecimal last = decimal(data.path("c").path(0));
        BigDecimal open = decimal(data.path("o"));
        BigDecimal change = open.signum() == 0
                ? BigDecimal.ZERO
                : last.subtract(open).multiply(BigDecimal.valueOf(100)).divide(open, 4, RoundingMode.HALF_UP);
        return new Ticker(symbol.toUpperCase(), last, change,
                decimal(data.path("h").path(1)),
                decimal(data.path("l").path(1)),
                decimal(data.path("v").path(1)),
                settings.clock.instant());
    }

    @Override
    public OrderResult createOrder(OrderRequest request) {
        request.validate();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("pair", request.symbol.toUpperCase());
        params.put("type", request.side.id());
        params.put("ordertype", orderType(request));
        params.put("volume", plain(request.quantity));
        switch (request.type) {
            case LIMIT -> params.put("price", plain(request.price));
            case STOP_LOSS, TRAILING_STOP -> params.put("price", plain(request.stopPrice));
            case STOP_LIMIT -> {
                params.put("price", plain(request.stopPrice));
                params.put("price2", plain(request.price));
            }
            default -> {
            }
        }
        JsonNode result = privateCall("AddOrder", params).path("result");
        JsonNode txid = result.path("txid");
        String orderId = txid.isArray() && txid.size() > 0 ? txid.get(0).asText() : null;
        if (StringUtils.isBlank(orderId)) {
            throw new ExchangeApiException(name, 200, null, "AddOrder returned no txid");
        }
        String description = result.path("descr").path("order").asText("");
        LOG.info("kraken order placed txid={} {}", orderId, description);
        return new OrderResult(orderId, "open", description);
    }

    @Override
    public OrderResult cancelOrder(String orderId) {
        requireOrderId(orderId);
        JsonNode result = privateCall("CancelOrder", Map.of("txid", orderId)).path("result");
        int count = result.path("count").asInt(0);
        return new OrderResult(orderId, count > 0 ? "canceled" : "unchanged", "count=" + count);
    }

    @Override
    public OrderSnapshot getOrderStatus(String orderId) {
        requireOrderId(orderId);
        JsonNode order = privateCall("QueryOrders", Map.of("txid", orderId)).path("result").path(orderId);
        if (order.isMissingNode()) {
            throw new ExchangeApiException(name, 200, null, "Unknown order " + orderId);
        }
        String raw = order.path("status").asText("");
        BigDecimal filled = decimal(order.path("vol_exec"));
        JsonNode descr = order.path("descr");
        String type = descr.path("type").asText("");
        return new OrderSnapshot(orderId,
                descr.path("pair").asText(null),
                type.isEmpty() ? null : OrderSide.from(type),
                normalizeStatus(raw, filled),
                raw,
                decimal(order.path("vol")),
                filled,
                decimal(descr.path("price")));
    }

    static OrderStatus normalizeStatus(String raw, BigDecimal filled) {
        return switch (raw.toLowerCase()) {
            case "pending", "open" -> filled.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            case "closed" -> OrderStatus.FILLED;
            case "canceled", "cancelled" -> OrderStatus.CANCELLED;
            case "expired" -> OrderStatus.EXPIRED;
            default -> OrderStatus.PENDING;
        };
    }

    @Override
    protected void checkPayload(JsonNode json) {
        List<String> errors = errors(json);
        if (!errors.isEmpty()) {
            throw new ExchangeApiException(name, 200, errors.get(0), String.join(", ", errors));
        }
    }

    @Override
    protected ExchangeApiException apiError(int status, JsonNode body, String rawBody) {
        List<String> errors = errors(body);
        if (errors.isEmpty()) {
            return super.apiError(status, body, rawBody);
        }
        return new ExchangeApiException(name, status, errors.get(0), String.join(", ", errors));
    }

    private JsonNode privateCall(String method, Map<String, String> params) {
        return send(HttpMethod.POST, PRIVATE_PREFIX + method, "", form(params),
                MediaType.APPLICATION_FORM_URLENCODED, true);
    }

    private static List<String> errors(JsonNode json) {
        List<String> errors = new ArrayList<>();
        JsonNode node = json == null ? null : json.get("error");
        if (node != null && node.isArray()) {
            node.forEach(e -> errors.add(e.asText()));
        }
        return errors;
    }

    private static String orderType(OrderRequest request) {
        return switch (request.type) {
            case MARKET -> "market";
            case LIMIT -> "limit";
            case STOP_LOSS -> "stop-loss";
            case STOP_LIMIT -> "stop-loss-limit";
            case TRAILING_STOP -> "trailing-stop";
        };
    }

    private static void requireOrderId(String orderId) {
        if (StringUtils.isBlank(orderId)) {
            throw new CredentialValidationException("Order id is required");
        }
    }
}

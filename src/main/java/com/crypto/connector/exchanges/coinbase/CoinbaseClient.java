package com.crypto.connector.exchanges.coinbase;

import com.crypto.connector.common.auth.RequestSigner;
import com.crypto.connector.common.exchange.CoinbaseApiFamily;
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
import com.crypto.connector.common.model.Ticker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
public class CoinbaseClient extends BaseExchangeClient {
    private static final Pattern PATH_SEGMENT = Pattern.compile("[A-Za-z0-9._:-]+");

    private final CoinbaseMode mode;
    private final CoinbaseApiFamily family;

    public CoinbaseClient(ExchangeConnectionConfig config, CoinbaseMode mode, String baseUrl, RequestSigner signer,
                          ClientSettings settings) {
        super("coinbase", config, baseUrl, signer, settings);
        this.mode = mode;
        this.family = CoinbaseApiFamily.from(config.apiFamily);
    }

    public CoinbaseMode mode() {
        return mode;
    }

    @Override
    public List<Balance> getBalance() {
        return switch (mode) {
            case EXCHANGE -> exchangeBalances();
            case ADVANCED_TRADE -> advancedBalances();
            case BASIC -> retailBalances();
        };
    }

    @Override
    public Ticker getTicker(String symbol) {
        if (StringUtils.isBlank(symbol)) {
            throw new CredentialValidationException("Symbol is required");
        }
        String productId = symbol.trim().toUpperCase().replace('/', '-');
        requirePathSegment(productId, "symbol");
        return switch (mode) {
            case EXCHANGE -> exchangeTicker(productId);
            case ADVANCED_TRADE -> advancedTicker(productId);
            case BASIC -> retailTicker(productId);
        };
    }

    @Override
    public OrderResult createOrder(OrderRequest request) {
        request.validate();
        return switch (mode) {
            case EXCHANGE -> exchangeCreateOrder(request);
            case ADVANCED_TRADE -> advancedCreateOrder(request);
            case BASIC -> throw unsupportedOrders();
        };
    }

    @Override
    public OrderResult cancelOrder(String orderId) {
        requireOrderId(orderId);
        switch (mode) {
            case EXCHANGE -> {
                send(HttpMethod.DELETE, "/orders/" + orderId, "", "", MediaType.APPLICATION_JSON, true);
                return new OrderResult(orderId, "cancelled", null);
            }
            case ADVANCED_TRADE -> {
                ObjectNode body = mapper.createObjectNode();
                body.putArray("order_ids").add(orderId);
                JsonNode json = send(HttpMethod.POST, "/orders/batch_cancel", "", body.toString(),
                        MediaType.APPLICATION_JSON, true);
                JsonNode result = json.path("results").path(0);
                if (!result.path("success").asBoolean(false)) {
                    throw new ExchangeApiException(name, 200, text(result, "failure_reason"),
                            "Cancel failed for order " + orderId);
                }
                return new OrderResult(orderId, "cancelled", null);
            }
            default -> throw unsupportedOrders();
        }
    }

    @Override
    public OrderSnapshot getOrderStatus(String orderId) {
        requireOrderId(orderId);
        return switch (mode) {
            case EXCHANGE -> exchangeOrderStatus(orderId);
            case ADVANCED_TRADE -> advancedOrderStatus(orderId);
            case BASIC -> throw unsupportedOrders();
        };
    }

    // Exchange dialect

    private List<Balance> exchangeBalances() {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode account : get("/accounts", "", true)) {
            addIfNonZero(balances, new Balance(account.path("currency").asText(),
                    decimal(account.path("available")), decimal(account.path("hold"))));
        }
        return balances;
    }

    private Ticker exchangeTicker(String productId) {
        JsonNode ticker = get("/products/" + productId + "/ticker", "", false);
        JsonNode stats = get("/products/" + productId + "/stats", "", false);
        BigDecimal last = decimal(ticker.path("price"));
        return new Ticker(productId, last,
                percentChange(decimal(stats.path("open")), last),
                decimal(stats.path("high")),
                decimal(stats.path("low")),
                decimal(stats.path("volume")),
                instant(text(ticker, "time")));
    }

    private OrderResult exchangeCreateOrder(OrderRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("product_id", request.symbol.toUpperCase());
        body.put("side", request.side.id());
        body.put("size", plain(request.quantity));
        switch (request.type) {
            case MARKET -> body.put("type", "market");
            case LIMIT -> {
                body.put("type", "limit");
                body.put("price", plain(request.price));
                body.put("time_in_force", "GTC");
            }
            case STOP_LOSS -> {
                body.put("type", "market");
                body.put("stop", request.side == OrderSide.SELL ? "loss" : "entry");
                body.put("stop_price", plain(request.stopPrice));
            }
            case STOP_LIMIT -> {
                body.put("type", "limit");
                body.put("price", plain(request.price));
                body.put("stop", request.side == OrderSide.SELL ? "loss" : "entry");
                body.put("stop_price", plain(request.stopPrice));
            }
            case TRAILING_STOP -> throw new OperationNotSupportedException(
                    "Coinbase Exchange does not support trailing stop orders");
        }
        JsonNode json = send(HttpMethod.POST, "/orders", "", body.toString(), MediaType.APPLICATION_JSON, true);
        String orderId = text(json, "id");
        if (StringUtils.isBlank(orderId)) {
            throw new ExchangeApiException(name, 200, null, "Order response has no id");
        }
        return new OrderResult(orderId, text(json, "status"), decimal(json.path("filled_size")), null);
    }

    private OrderSnapshot exchangeOrderStatus(String orderId) {
        JsonNode json = get("/orders/" + orderId, "", true);
        String raw = StringUtils.defaultString(text(json, "status"));
        String doneReason = text(json, "done_reason");
        return new OrderSnapshot(orderId, text(json, "product_id"), side(text(json, "side")),
                exchangeStatus(raw, doneReason, decimal(json.path("filled_size"))), raw,
                decimal(json.path("size")), decimal(json.path("filled_size")), decimal(json.path("price")));
    }

    static OrderStatus exchangeStatus(String raw, String doneReason, BigDecimal filled) {
        return switch (raw.toLowerCase()) {
            case "pending", "received" -> OrderStatus.OPEN;
            case "open", "active" -> filled.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            case "done", "settled" -> "canceled".equalsIgnoreCase(doneReason) || "cancelled".equalsIgnoreCase(doneReason)
                    ? OrderStatus.CANCELLED : OrderStatus.FILLED;
            case "rejected" -> OrderStatus.REJECTED;
            default -> OrderStatus.PENDING;
        };
    }

    // Advanced Trade dialect

    private List<Balance> advancedBalances() {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode account : get("/accounts", "limit=250", true).path("accounts")) {
            addIfNonZero(balances, new Balance(account.path("currency").asText(),
                    decimal(account.path("available_balance").path("value")),
                    decimal(account.path("hold").path("value"))));
        }
        return balances;
    }

    private Ticker advancedTicker(String productId) {
        JsonNode product = get("/products/" + productId, "", true);
        return new Ticker(productId,
                decimal(product.path("price")),
                decimal(product.path("price_percentage_change_24h")),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                decimal(product.path("volume_24h")),
                settings.clock.instant());
    }

    private OrderResult advancedCreateOrder(OrderRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("client_order_id", UUID.randomUUID().toString());
        body.put("product_id", request.symbol.toUpperCase());
        body.put("side", request.side.name());
        ObjectNode configuration = body.putObject("order_configuration");
        switch (request.type) {
            case MARKET -> configuration.putObject("market_market_ioc")
                    .put("base_size", plain(request.quantity));
            case LIMIT -> configuration.putObject("limit_limit_gtc")
                    .put("base_size", plain(request.quantity))
                    .put("limit_price", plain(request.price))
                    .put("post_only", false);
            case STOP_LIMIT -> configuration.putObject("stop_limit_stop_limit_gtc")
                    .put("base_size", plain(request.quantity))
                    .put("limit_price", plain(request.price))
                    .put("stop_price", plain(request.stopPrice))
                    .put("stop_direction", request.side == OrderSide.SELL
                            ? "STOP_DIRECTION_STOP_DOWN" : "STOP_DIRECTION_STOP_UP");
            default -> throw new OperationNotSupportedException(
                    "Coinbase Advanced Trade does not support " + request.type.id() + " orders");
        }
        JsonNode json = send(HttpMethod.POST, "/orders", "", body.toString(), MediaType.APPLICATION_JSON, true);
        String orderId = firstText(json.path("success_response"), "order_id");
        if (StringUtils.isBlank(orderId)) {
            orderId = text(json, "order_id");
        }
        if (StringUtils.isBlank(orderId)) {
            throw new ExchangeApiException(name, 200, null, "Order response has no order_id");
        }
        return new OrderResult(orderId, "OPEN", null);
    }

    private OrderSnapshot advancedOrderStatus(String orderId) {
        JsonNode order = get("/orders/historical/" + orderId, "", true).path("order");
        String raw = StringUtils.defaultString(text(order, "status"));
        BigDecimal filled = decimal(order.path("filled_size"));
        JsonNode limitPrice = order.findValue("limit_price");
        BigDecimal price = decimal(order.path("average_filled_price"));
        if (price.signum() == 0 && limitPrice != null) {
            price = decimal(limitPrice);
        }
        return new OrderSnapshot(orderId, text(order, "product_id"), side(text(order, "side")),
                advancedStatus(raw, filled), raw,
                decimal(order.findValue("base_size")), filled, price);
    }

    static OrderStatus advancedStatus(String raw, BigDecimal filled) {
        return switch (raw.toUpperCase()) {
            // Accepted but not yet on the book, or cancel requested but not confirmed.
            case "PENDING", "QUEUED", "OPEN", "CANCEL_QUEUED" ->
                    filled.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELLED" -> OrderStatus.CANCELLED;
            case "EXPIRED" -> OrderStatus.EXPIRED;
            case "FAILED" -> OrderStatus.REJECTED;
            default -> OrderStatus.PENDING;
        };
    }

    // Retail v2

    private List<Balance> retailBalances() {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode account : get("/v2/accounts", "", true).path("data")) {
            JsonNode balance = account.path("balance");
            String currency = text(balance, "currency");
            if (StringUtils.isBlank(currency)) {
                currency = account.path("currency").path("code").asText();
            }
            addIfNonZero(balances, new Balance(currency, decimal(balance.path("amount")), BigDecimal.ZERO));
        }
        return balances;
    }

    private Ticker retailTicker(String productId) {
        JsonNode data = get("/v2/prices/" + productId + "/spot", "", false).path("data");
        return new Ticker(productId, decimal(data.path("amount")), BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, settings.clock.instant());
    }

    @Override
    protected void checkPayload(JsonNode json) {
        JsonNode success = json.get("success");
        if (success != null && success.isBoolean() && !success.asBoolean()) {
            JsonNode error = json.path("error_response");
            String code = firstText(error, "error", "preview_failure_reason");
            String message = firstText(error, "message", "error_details");
            if (message == null) {
                message = firstText(json, "failure_reason");
            }
            throw new ExchangeApiException(name, 200, code, message);
        }
    }

    @Override
    protected ExchangeApiException apiError(int status, JsonNode body, String rawBody) {
        JsonNode errors = body.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            JsonNode first = errors.get(0);
            return new ExchangeApiException(name, status, text(first, "id"), text(first, "message"));
        }
        return super.apiError(status, body, rawBody);
    }

    private OperationNotSupportedException unsupportedOrders() {
        return new OperationNotSupportedException("Order placement is not supported for " + family.label());
    }

    private static void addIfNonZero(List<Balance> balances, Balance balance) {
        if (!balance.isZero()) {
            balances.add(balance);
        }
    }

    private static BigDecimal percentChange(BigDecimal open, BigDecimal last) {
        if (open.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return last.subtract(open).multiply(BigDecimal.valueOf(100)).divide(open, 4, RoundingMode.HALF_UP);
    }

    private Instant instant(String value) {
        if (StringUtils.isBlank(value)) {
            return settings.clock.instant();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return settings.clock.instant();
        }
    }

    private static OrderSide side(String value) {
        return StringUtils.isBlank(value) ? null : OrderSide.from(value);
    }

    private static void requireOrderId(String orderId) {
        if (StringUtils.isBlank(orderId)) {
            throw new CredentialValidationException("Order id is required");
        }
        requirePathSegment(orderId, "order id");
    }

    // Ids go into the request path unencoded.
    private static void requirePathSegment(String value, String what) {
        if (!PATH_SEGMENT.matcher(value).matches()) {
            throw new CredentialValidationException("Invalid " + what + ": " + StringUtils.abbreviate(value, 64));
        }
    }
}

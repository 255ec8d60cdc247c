package com.crypto.connector.exchanges.coinbase;

import com.crypto.connector.common.auth.CdpJwtSigner;
import com.crypto.connector.common.auth.CoinbaseHmacSigner;
import com.crypto.connector.common.auth.NoAuthSigner;
import com.crypto.connector.common.auth.RequestSigner;
import com.crypto.connector.common.exchange.CoinbaseApiFamily;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.Credentials;
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
import com.crypto.connector.support.StubHttp;
import com.crypto.connector.support.TestKeys;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinbaseClientTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String ADVANCED_URL = CoinbaseApiConfig.ADVANCED_PROD.restBaseUrl();

    private final StubHttp http = new StubHttp();
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> jwtUris = new ArrayList<>();

    private CoinbaseClient client(String family, CoinbaseMode mode, String baseUrl, RequestSigner signer) {
        ExchangeConnectionConfig config = new ExchangeConnectionConfig("cb", ExchangeProvider.COINBASE, family,
                ExchangeEnv.PROD, new Credentials("key", "secret", "pass"));
        return new CoinbaseClient(config, mode, baseUrl, signer, http.settings(CLOCK));
    }

    private CoinbaseClient exchange() {
        return client("exchange", CoinbaseMode.EXCHANGE, CoinbaseApiConfig.EXCHANGE_PROD.restBaseUrl(),
                new CoinbaseHmacSigner("exchange-key", TestKeys.base64Secret(), "passphrase", CLOCK));
    }

    private CoinbaseClient advanced() {
        return client("advanced_trade", CoinbaseMode.ADVANCED_TRADE, ADVANCED_URL,
                new CdpJwtSigner(TestKeys.CDP_KEY_NAME, "pem", (keyName, pem, uri) -> {
                    jwtUris.add(uri);
                    return "jwt-token";
                }));
    }

    private JsonNode lastJson() throws Exception {
        return mapper.readTree(http.lastBody());
    }

    @Test
    void exchangeBalancesUseHmacHeaders() {
        http.respond(200, "[{\"currency\":\"USD\",\"available\":\"250.00\",\"hold\":\"50.00\"},"
                + "{\"currency\":\"ETH\",\"available\":\"0\",\"hold\":\"0\"}]");

        List<Balance> balances = exchange().getBalance();

        assertThat(balances).hasSize(1);
        assertThat(balances.get(0).total).isEqualByComparingTo("300");
        assertThat(http.lastRequest().url().toString()).isEqualTo("https://api.exchange.coinbase.com/accounts");
        assertThat(http.lastRequest().headers().getFirst("CB-ACCESS-KEY")).isEqualTo("exchange-key");
        assertThat(http.lastRequest().headers().getFirst("CB-ACCESS-TIMESTAMP")).isEqualTo("1714557600");
        assertThat(http.lastRequest().headers().getFirst("CB-ACCESS-PASSPHRASE")).isEqualTo("passphrase");
    }

    @Test
    void exchangeTickerCombinesTickerAndStats() {
        http.respond(200, "{\"price\":\"110\",\"time\":\"2024-05-01T09:59:00Z\"}")
                .respond(200, "{\"open\":\"100\",\"high\":\"120\",\"low\":\"95\",\"volume\":\"42\"}");

        Ticker ticker = exchange().getTicker("btc/usd");

        assertThat(http.requests).extracting(r -> r.url().getPath())
                .containsExactly("/products/BTC-USD/ticker", "/products/BTC-USD/stats");
        assertThat(ticker.symbol).isEqualTo("BTC-USD");
        assertThat(ticker.change24h).isEqualByComparingTo("10");
        assertThat(ticker.high24h).isEqualByComparingTo("120");
        assertThat(ticker.timestamp).isEqualTo(Instant.parse("2024-05-01T09:59:00Z"));
    }

    @Test
    void exchangeStopLossSellIsMarketWithLossStop() throws Exception {
        http.respond(200, "{\"id\":\"d0c5340b-6d6c-49d9-b567-48c4bfca13d2\",\"status\":\"pending\",\"filled_size\":\"0\"}");

        OrderResult result = exchange().createOrder(new OrderRequest("BTC-USD", OrderSide.SELL, OrderType.STOP_LOSS,
                new BigDecimal("0.01"), null, new BigDecimal("25000")));

        assertThat(result.orderId).isEqualTo("d0c5340b-6d6c-49d9-b567-48c4bfca13d2");
        JsonNode body = lastJson();
        assertThat(body.path("type").asText()).isEqualTo("market");
        assertThat(body.path("stop").asText()).isEqualTo("loss");
        assertThat(body.path("stop_price").asText()).isEqualTo("25000");
        assertThat(http.lastRequest().headers().getFirst("CB-ACCESS-SIGN")).isNotBlank();
    }

    @Test
    void exchangeDoneOrdersUseDoneReason() {
        assertThat(CoinbaseClient.exchangeStatus("done", "canceled", BigDecimal.ZERO)).isEqualTo(OrderStatus.CANCELLED);
        assertThat(CoinbaseClient.exchangeStatus("done", "filled", BigDecimal.ONE)).isEqualTo(OrderStatus.FILLED);
        assertThat(CoinbaseClient.exchangeStatus("open", null, new BigDecimal("0.1")))
                .isEqualTo(OrderStatus.PARTIALLY_FILLED);
    }

    @Test
    void acceptedAndCancelRequestedOrdersStayLive() {
        assertThat(CoinbaseClient.exchangeStatus("pending", null, BigDecimal.ZERO)).isEqualTo(OrderStatus.OPEN);
        assertThat(CoinbaseClient.exchangeStatus("received", null, BigDecimal.ZERO)).isEqualTo(OrderStatus.OPEN);
        assertThat(CoinbaseClient.advancedStatus("PENDING", BigDecimal.ZERO)).isEqualTo(OrderStatus.OPEN);
        assertThat(CoinbaseClient.advancedStatus("QUEUED", BigDecimal.ZERO)).isEqualTo(OrderStatus.OPEN);
        assertThat(CoinbaseClient.advancedStatus("CANCEL_QUEUED", BigDecimal.ZERO)).isEqualTo(OrderStatus.OPEN);
        assertThat(CoinbaseClient.advancedStatus("CANCEL_QUEUED", new BigDecimal("0.3")))
                .isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(CoinbaseClient.advancedStatus("CANCELLED", BigDecimal.ZERO)).isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    void idsThatCannotBePathSegmentsAreRejectedBeforeSending() {
        assertThatThrownBy(() -> exchange().getOrderStatus("abc def"))
                .isInstanceOf(CredentialValidationException.class)
                .hasMessage("Invalid order id: abc def");
        assertThatThrownBy(() -> advanced().cancelOrder("../accounts"))
                .isInstanceOf(CredentialValidationException.class);
        assertThatThrownBy(() -> advanced().getTicker("BTC USD"))
                .isInstanceOf(CredentialValidationException.class)
                .hasMessage("Invalid symbol: BTC USD");
        assertThat(http.requests).isEmpty();
    }

    @Test
    void advancedBalancesAreJwtSignedAgainstBrokeragePath() {
        http.respond(200, "{\"accounts\":[{\"currency\":\"BTC\",\"available_balance\":{\"value\":\"0.5\"},"
                + "\"hold\":{\"value\":\"0.1\"}}],\"has_next\":false}");

        List<Balance> balances = advanced().getBalance();

        assertThat(balances.get(0).available).isEqualByComparingTo("0.5");
        assertThat(balances.get(0).locked).isEqualByComparingTo("0.1");
        assertThat(http.lastRequest().url().toString())
                .isEqualTo("https://api.coinbase.com/api/v3/brokerage/accounts?limit=250");
        assertThat(http.lastRequest().headers().getFirst("Authorization")).isEqualTo("Bearer jwt-token");
        assertThat(jwtUris).containsExactly("GET api.coinbase.com/api/v3/brokerage/accounts");
    }

    @Test
    void advancedLimitOrderUsesOrderConfiguration() throws Exception {
        http.respond(200, "{\"success\":true,\"success_response\":{\"order_id\":\"11111-00000-000000\"}}");

        OrderResult result = advanced().createOrder(OrderRequest.limit("BTC-USD", OrderSide.BUY,
                new BigDecimal("0.001"), new BigDecimal("30000")));

        assertThat(result.orderId).isEqualTo("11111-00000-000000");
        JsonNode body = lastJson();
        assertThat(body.path("side").asText()).isEqualTo("BUY");
        assertThat(body.path("client_order_id").asText()).isNotBlank();
        JsonNode limit = body.path("order_configuration").path("limit_limit_gtc");
        assertThat(limit.path("base_size").asText()).isEqualTo("0.001");
        assertThat(limit.path("limit_price").asText()).isEqualTo("30000");
    }

    @Test
    void advancedRejectionInBodyBecomesApiError() {
        http.respond(200, "{\"success\":false,\"failure_reason\":\"UNKNOWN_FAILURE_REASON\","
                + "\"error_response\":{\"error\":\"INSUFFICIENT_FUND\",\"message\":\"Insufficient balance in source account\"}}");

        assertThatThrownBy(() -> advanced().createOrder(OrderRequest.market("BTC-USD", OrderSide.BUY, BigDecimal.ONE)))
                .isInstanceOfSatisfying(ExchangeApiException.class, e -> {
                    assertThat(e.getProviderCode()).isEqualTo("INSUFFICIENT_FUND");
                    assertThat(e.getProviderMessage()).isEqualTo("Insufficient balance in source account");
                });
    }

    @Test
    void advancedTrailingStopIsUnsupported() {
        assertThatThrownBy(() -> advanced().createOrder(new OrderRequest("BTC-USD", OrderSide.SELL,
                OrderType.TRAILING_STOP, BigDecimal.ONE, null, BigDecimal.TEN)))
                .isInstanceOf(OperationNotSupportedException.class);
    }

    @Test
    void advancedCancelGoesThroughBatchEndpoint() throws Exception {
        http.respond(200, "{\"results\":[{\"success\":true,\"order_id\":\"abc\"}]}");

        assertThat(advanced().cancelOrder("abc").status).isEqualTo("cancelled");
        assertThat(http.lastRequest().method()).isEqualTo(HttpMethod.POST);
        assertThat(http.lastRequest().url().getPath()).isEqualTo("/api/v3/brokerage/orders/batch_cancel");
        assertThat(lastJson().path("order_ids").get(0).asText()).isEqualTo("abc");
    }

    @Test
    void advancedCancelFailureIsReported() {
        http.respond(200, "{\"results\":[{\"success\":false,\"failure_reason\":\"UNKNOWN_CANCEL_ORDER\",\"order_id\":\"abc\"}]}");

        assertThatThrownBy(() -> advanced().cancelOrder("abc"))
                .isInstanceOfSatisfying(ExchangeApiException.class,
                        e -> assertThat(e.getProviderCode()).isEqualTo("UNKNOWN_CANCEL_ORDER"));
    }

    @Test
    void advancedOrderStatusReadsHistoricalOrder() {
        http.respond(200, "{\"order\":{\"order_id\":\"abc\",\"product_id\":\"BTC-USD\",\"side\":\"SELL\",\"status\":\"OPEN\","
                + "\"filled_size\":\"0.2\",\"average_filled_price\":\"0\",\"order_configuration\":{\"limit_limit_gtc\":"
                + "{\"base_size\":\"1\",\"limit_price\":\"31000\"}}}}");

        OrderSnapshot snapshot = advanced().getOrderStatus("abc");

        assertThat(http.lastRequest().url().getPath()).isEqualTo("/api/v3/brokerage/orders/historical/abc");
        assertThat(snapshot.status).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(snapshot.quantity).isEqualByComparingTo("1");
        assertThat(snapshot.price).isEqualByComparingTo("31000");
        assertThat(snapshot.side).isEqualTo(OrderSide.SELL);
    }

    @Test
    void basicModeReadsRetailBalancesAndPrices() {
        CoinbaseClient app = client("app", CoinbaseMode.BASIC, CoinbaseApiConfig.RETAIL_BASE_URL, new NoAuthSigner());
        http.respond(200, "{\"data\":[{\"balance\":{\"amount\":\"1.5\",\"currency\":\"ETH\"}}]}")
                .respond(200, "{\"data\":{\"amount\":\"3100.12\",\"base\":\"ETH\",\"currency\":\"USD\"}}");

        assertThat(app.getBalance()).extracting(b -> b.currency).containsExactly("ETH");
        Ticker ticker = app.getTicker("ETH-USD");

        assertThat(http.lastRequest().url().getPath()).isEqualTo("/v2/prices/ETH-USD/spot");
        assertThat(ticker.lastPrice).isEqualByComparingTo("3100.12");
    }

    @Test
    void basicModeRefusesOrders() {
        CoinbaseClient wallet = client("server_wallet", CoinbaseMode.BASIC, CoinbaseApiConfig.RETAIL_BASE_URL,
                new NoAuthSigner());

        assertThatThrownBy(() -> wallet.createOrder(OrderRequest.market("ETH-USD", OrderSide.BUY, BigDecimal.ONE)))
                .isInstanceOf(OperationNotSupportedException.class)
                .hasMessage("Order placement is not supported for Coinbase Server Wallet");
        assertThat(http.requests).isEmpty();
    }

    @Test
    void retailErrorsArrayIsParsed() {
        CoinbaseClient app = client("app", CoinbaseMode.BASIC, CoinbaseApiConfig.RETAIL_BASE_URL, new NoAuthSigner());
        http.respond(401, "{\"errors\":[{\"id\":\"invalid_token\",\"message\":\"The access token is invalid\"}]}");

        assertThatThrownBy(app::getBalance)
                .isInstanceOfSatisfying(ExchangeApiException.class, e -> {
                    assertThat(e.getHttpStatus()).isEqualTo(401);
                    assertThat(e.getProviderCode()).isEqualTo("invalid_token");
                });
    }

    @Test
    void familiesMapToModes() {
        assertThat(CoinbaseMode.forFamily(CoinbaseApiFamily.TRADE_API))
                .isEqualTo(CoinbaseMode.BASIC);
    }
}

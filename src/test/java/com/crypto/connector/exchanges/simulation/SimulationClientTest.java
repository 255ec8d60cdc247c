package com.crypto.connector.exchanges.simulation;

import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderResult;
import com.crypto.connector.common.model.OrderSide;
import com.crypto.connector.common.model.OrderStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationClientTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private SimulationClient client(Map<String, String> metadata) {
        return new SimulationClient(new ExchangeConnectionConfig("paper", ExchangeProvider.SIMULATION, "paper",
                ExchangeEnv.SANDBOX, Credentials.empty(), metadata), CLOCK);
    }

    private SimulationClient funded() {
        return client(Map.of("balance.usd", "1000", "balance.BTC", "0.5", "price.btc/usd", "20000"));
    }

    private static Balance balance(List<Balance> balances, String currency) {
        return balances.stream().filter(b -> b.currency.equals(currency)).findFirst().orElseThrow();
    }

    @Test
    void defaultsToTenThousandUsd() {
        List<Balance> balances = client(Map.of()).getBalance();

        assertThat(balances).hasSize(1);
        assertThat(balances.get(0).currency).isEqualTo("USD");
        assertThat(balances.get(0).available).isEqualByComparingTo("10000");
    }

    @Test
    void marketBuyFillsAtReferencePrice() {
        SimulationClient sim = funded();

        OrderResult result = sim.createOrder(OrderRequest.market("BTC-USD", OrderSide.BUY, new BigDecimal("0.01")));

        assertThat(result.orderId).isEqualTo("sim-1");
        assertThat(result.status).isEqualTo("FILLED");
        List<Balance> balances = sim.getBalance();
        assertThat(balance(balances, "USD").available).isEqualByComparingTo("800");
        assertThat(balance(balances, "BTC").available).isEqualByComparingTo("0.51");
        assertThat(sim.getOrderStatus("sim-1").status).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    void marketOrderNeedsFunds() {
        assertThatThrownBy(() -> funded().createOrder(OrderRequest.market("BTC-USD", OrderSide.BUY, BigDecimal.ONE)))
                .isInstanceOfSatisfying(ExchangeApiException.class,
                        e -> assertThat(e.getProviderCode()).isEqualTo("INSUFFICIENT_FUNDS"));
    }

    @Test
    void restingLimitOrderLocksQuoteFunds() {
        SimulationClient sim = funded();

        OrderResult result = sim.createOrder(OrderRequest.limit("BTC-USD", OrderSide.BUY, new BigDecimal("0.02"),
                new BigDecimal("19000")));

        assertThat(result.status).isEqualTo("OPEN");
        Balance usd = balance(sim.getBalance(), "USD");
        assertThat(usd.available).isEqualByComparingTo("620");
        assertThat(usd.locked).isEqualByComparingTo("380");
        assertThat(usd.total).isEqualByComparingTo("1000");
    }

    @Test
    void marketOrderCannotSpendFundsHeldByRestingOrders() {
        SimulationClient sim = funded();
        sim.createOrder(OrderRequest.limit("BTC-USD", OrderSide.BUY, new BigDecimal("0.04"), new BigDecimal("20000")));

        assertThatThrownBy(() -> sim.createOrder(OrderRequest.market("BTC-USD", OrderSide.BUY, new BigDecimal("0.02"))))
                .isInstanceOfSatisfying(ExchangeApiException.class, e -> {
                    assertThat(e.getProviderCode()).isEqualTo("INSUFFICIENT_FUNDS");
                    assertThat(e.getUserMessage()).contains("200");
                });
        Balance usd = balance(sim.getBalance(), "USD");
        assertThat(usd.available).isEqualByComparingTo("200");
        assertThat(usd.locked).isEqualByComparingTo("800");
    }

    @Test
    void restingOrderNeedsFreeFunds() {
        SimulationClient sim = funded();

        assertThatThrownBy(() -> sim.createOrder(OrderRequest.limit("BTC-USD", OrderSide.BUY, BigDecimal.ONE,
                new BigDecimal("19000"))))
                .isInstanceOfSatisfying(ExchangeApiException.class,
                        e -> assertThat(e.getProviderCode()).isEqualTo("INSUFFICIENT_FUNDS"));
        sim.createOrder(OrderRequest.limit("BTC-USD", OrderSide.SELL, new BigDecimal("0.4"), new BigDecimal("25000")));
        assertThatThrownBy(() -> sim.createOrder(OrderRequest.limit("BTC-USD", OrderSide.SELL, new BigDecimal("0.2"),
                new BigDecimal("26000"))))
                .isInstanceOfSatisfying(ExchangeApiException.class,
                        e -> assertThat(e.getProviderCode()).isEqualTo("INSUFFICIENT_FUNDS"));
        assertThat(sim.getOrderStatus("sim-1").status).isEqualTo(OrderStatus.OPEN);
        assertThat(balance(sim.getBalance(), "USD").locked).isEqualByComparingTo("0");
    }

    @Test
    void cancelReleasesLockAndOnlyWorksOnce() {
        SimulationClient sim = funded();
        String id = sim.createOrder(OrderRequest.limit("BTC-USD", OrderSide.SELL, new BigDecimal("0.1"),
                new BigDecimal("25000"))).orderId;

        assertThat(sim.cancelOrder(id).status).isEqualTo("CANCELLED");
        assertThat(balance(sim.getBalance(), "BTC").locked).isEqualByComparingTo("0");
        assertThatThrownBy(() -> sim.cancelOrder(id))
                .isInstanceOfSatisfying(ExchangeApiException.class,
                        e -> assertThat(e.getProviderCode()).isEqualTo("ORDER_NOT_OPEN"));
        assertThatThrownBy(() -> sim.cancelOrder("sim-99"))
                .isInstanceOfSatisfying(ExchangeApiException.class,
                        e -> assertThat(e.getProviderCode()).isEqualTo("UNKNOWN_ORDER"));
    }

    @Test
    void tickerNeedsAReferencePrice() {
        assertThat(funded().getTicker("btc-usd").lastPrice).isEqualByComparingTo("20000");
        assertThatThrownBy(() -> funded().getTicker("ETH-USD"))
                .isInstanceOfSatisfying(ExchangeApiException.class, e -> {
                    assertThat(e.getHttpStatus()).isEqualTo(404);
                    assertThat(e.getProviderCode()).isEqualTo("UNKNOWN_SYMBOL");
                });
    }

    @Test
    void symbolsMustNameBothCurrencies() {
        assertThatThrownBy(() -> funded().createOrder(OrderRequest.market("BTCUSD", OrderSide.BUY, BigDecimal.ONE)))
                .isInstanceOf(CredentialValidationException.class);
    }

    @Test
    void alwaysReachable() {
        SimulationClient sim = funded();

        assertThat(sim.testConnection()).isTrue();
        assertThat(sim.capabilities().tradeSpot).isTrue();
        assertThat(sim.baseUrl()).isEqualTo(SimulationClient.BASE_URL);
    }
}

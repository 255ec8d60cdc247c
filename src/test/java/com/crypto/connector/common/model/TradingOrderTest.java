package com.crypto.connector.common.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradingOrderTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TradingOrder newOrder() {
        return new TradingOrder("ord-1", "kraken-main",
                OrderRequest.limit("XBTUSD", OrderSide.BUY, new BigDecimal("1.0"), new BigDecimal("30000")), T0);
    }

    @Test
    void startsPendingAndOpensWithExchangeId() {
        TradingOrder order = newOrder();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);

        order.markOpen("OABC-123", T0.plusSeconds(1));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(order.getExchangeOrderId()).isEqualTo("OABC-123");
        assertThat(order.getUpdatedAt()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    void cannotOpenWithoutExchangeId() {
        assertThatThrownBy(() -> newOrder().markOpen(" ", T0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void partialFillsOnlyMoveForward() {
        TradingOrder order = newOrder();
        order.markOpen("OABC-123", T0);

        order.applyRemote(OrderStatus.PARTIALLY_FILLED, new BigDecimal("0.4"), T0.plusSeconds(2));
        order.applyRemote(OrderStatus.OPEN, new BigDecimal("0.3"), T0.plusSeconds(3));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(order.getFilledQty()).isEqualByComparingTo("0.4");

        order.applyRemote(OrderStatus.FILLED, new BigDecimal("1.0"), T0.plusSeconds(4));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(order.getFilledQty()).isEqualByComparingTo("1.0");
    }

    @Test
    void terminalStatesAreFinal() {
        TradingOrder order = newOrder();
        order.markOpen("OABC-123", T0);
        order.markCancelled(T0.plusSeconds(1));

        assertThatThrownBy(() -> order.applyRemote(OrderStatus.FILLED, BigDecimal.ONE, T0.plusSeconds(2)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cancelled -> filled");
        order.applyRemote(OrderStatus.CANCELLED, BigDecimal.ZERO, T0.plusSeconds(3));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
    }

    @Test
    void rejectionKeepsReason() {
        TradingOrder order = newOrder();

        order.markRejected("EOrder:Insufficient funds", T0);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.REJECTED);
        assertThat(order.toString()).contains("rejected").contains("reason=EOrder:Insufficient funds");
    }
}

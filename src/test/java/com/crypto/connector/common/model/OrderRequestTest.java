package com.crypto.connector.common.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderRequestTest {

    @Test
    void marketOrderNeedsNoPrice() {
        assertThatCode(() -> OrderRequest.market("BTC-USD", OrderSide.SELL, new BigDecimal("0.01")).validate())
                .doesNotThrowAnyException();
    }

    @Test
    void quantityMustBePositive() {
        assertThatThrownBy(() -> OrderRequest.market("BTC-USD", OrderSide.BUY, BigDecimal.ZERO).validate())
                .isInstanceOf(CredentialValidationException.class)
                .hasMessage("Order quantity must be positive");
    }

    @Test
    void limitNeedsPrice() {
        assertThatThrownBy(() -> new OrderRequest("BTC-USD", OrderSide.BUY, OrderType.LIMIT, BigDecimal.ONE, null, null)
                .validate())
                .hasMessage("Price is required for limit orders");
    }

    @Test
    void stopLimitNeedsBothPrices() {
        assertThatThrownBy(() -> new OrderRequest("BTC-USD", OrderSide.SELL, OrderType.STOP_LIMIT, BigDecimal.ONE,
                new BigDecimal("100"), null).validate())
                .hasMessage("Stop price is required for stop_limit orders");
    }

    @Test
    void symbolIsRequired() {
        assertThatThrownBy(() -> OrderRequest.market(" ", OrderSide.BUY, BigDecimal.ONE).validate())
                .hasMessage("Order symbol is required");
    }
}

package com.crypto.connector.common.model;

import java.math.BigDecimal;

public class OrderResult {
    public final String orderId;
    public final String status;
    public final BigDecimal filledQty;
    public final String message;

    public OrderResult(String orderId, String status, BigDecimal filledQty, String message) {
        this.orderId = orderId;
        this.status = status;
        this.filledQty = filledQty;
        this.message = message;
    }

    public OrderResult(String orderId, String status, String message) {
        this(orderId, status, null, message);
    }
}

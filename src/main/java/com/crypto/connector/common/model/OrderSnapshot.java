package com.crypto.connector.common.model;

import java.math.BigDecimal;

/**
 * Remote view of an order with the provider status normalized.
 */
public class OrderSnapshot {
    public final String orderId;
    public final String symbol;
    public final OrderSide side;
    public final OrderStatus status;
    public final String rawStatus;
    public final BigDecimal quantity;
    public final BigDecimal filledQty;
    public final BigDecimal price;

    public OrderSnapshot(String orderId, String symbol, OrderSide side, OrderStatus status, String rawStatus,
                         BigDecimal quantity, BigDecimal filledQty, BigDecimal price) {
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.status = status;
        this.rawStatus = rawStatus;
        this.quantity = quantity;
        this.filledQty = filledQty;
        this.price = price;
    }
}

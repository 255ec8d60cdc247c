package com.crypto.connector.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Local mirror of an order placed through a connection. Status only moves forward;
 * terminal states are final.
 */
public class TradingOrder {
    private final String id;
    private final String connectionId;
    private final String symbol;
    private final OrderSide side;
    private final OrderType type;
    private final BigDecimal quantity;
    private final BigDecimal price;
    private final BigDecimal stopPrice;
    private final Instant createdAt;

    private String exchangeOrderId;
    private OrderStatus status;
    private BigDecimal filledQty = BigDecimal.ZERO;
    private String failureReason;
    private Instant updatedAt;

    public TradingOrder(String id, String connectionId, OrderRequest request, Instant createdAt) {
        this.id = id;
        this.connectionId = connectionId;
        this.symbol = request.symbol;
        this.side = request.side;
        this.type = request.type;
        this.quantity = request.quantity;
        this.price = request.price;
        this.stopPrice = request.stopPrice;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = OrderStatus.PENDING;
    }

    public synchronized void markOpen(String exchangeOrderId, Instant at) {
        if (exchangeOrderId == null || exchangeOrderId.isBlank()) {
            throw new IllegalStateException("Order " + id + " cannot open without an exchange order id");
        }
        transition(OrderStatus.OPEN, at);
        this.exchangeOrderId = exchangeOrderId;
    }

    public synchronized void markRejected(String reason, Instant at) {
        transition(OrderStatus.REJECTED, at);
        this.failureReason = reason;
    }

    public synchronized void markCancelled(Instant at) {
        transition(OrderStatus.CANCELLED, at);
    }

    /**
     * Applies a status reported by the exchange. Re-reporting the current status only updates the fill.
     */
    public synchronized void applyRemote(OrderStatus remote, BigDecimal remoteFilledQty, Instant at) {
        if (remote == null) {
            return;
        }
        if (remote == status && remote != OrderStatus.PARTIALLY_FILLED) {
            updateFill(remoteFilledQty, at);
            return;
        }
        if (remote == OrderStatus.PENDING || (remote == OrderStatus.OPEN && status == OrderStatus.PARTIALLY_FILLED)) {
            updateFill(remoteFilledQty, at);
            return;
        }
        transition(remote, at);
        updateFill(remoteFilledQty, at);
    }

    private void updateFill(BigDecimal remoteFilledQty, Instant at) {
        if (remoteFilledQty != null && remoteFilledQty.compareTo(filledQty) > 0) {
            this.filledQty = remoteFilledQty;
            this.updatedAt = at;
        }
    }

    private void transition(OrderStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal order transition " + status.id() + " -> " + next.id()
                    + " for order " + id);
        }
        this.status = next;
        this.updatedAt = at;
    }

    public String getId() {
        return id;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public OrderType getType() {
        return type;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getStopPrice() {
        return stopPrice;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized String getExchangeOrderId() {
        return exchangeOrderId;
    }

    public synchronized OrderStatus getStatus() {
        return status;
    }

    public synchronized BigDecimal getFilledQty() {
        return filledQty;
    }

    public synchronized String getFailureReason() {
        return failureReason;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(' ').append(status.id())
                .append(' ').append(side.id()).append(' ').append(type.id())
                .append(' ').append(quantity.toPlainString()).append(' ').append(symbol);
        if (price != null) {
            sb.append(" @ ").append(price.toPlainString());
        }
        if (exchangeOrderId != null) {
            sb.append(" exchangeId=").append(exchangeOrderId);
        }
        if (filledQty.signum() > 0) {
            sb.append(" filled=").append(filledQty.toPlainString());
        }
        if (failureReason != null) {
            sb.append(" reason=").append(failureReason);
        }
        return sb.toString();
    }
}

package com.crypto.connector.common.model;

import java.math.BigDecimal;

/**
 * Provider-neutral order shape. Each client translates it into its native fields.
 */
public class OrderRequest {
    public final String symbol;
    public final OrderSide side;
    public final OrderType type;
    public final BigDecimal quantity;
    public final BigDecimal price;
    public final BigDecimal stopPrice;

    public OrderRequest(String symbol, OrderSide side, OrderType type, BigDecimal quantity,
                        BigDecimal price, BigDecimal stopPrice) {
        this.symbol = symbol;
        this.side = side;
        this.type = type;
        this.quantity = quantity;
        this.price = price;
        this.stopPrice = stopPrice;
    }

    public static OrderRequest market(String symbol, OrderSide side, BigDecimal quantity) {
        return new OrderRequest(symbol, side, OrderType.MARKET, quantity, null, null);
    }

    public static OrderRequest limit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        return new OrderRequest(symbol, side, OrderType.LIMIT, quantity, price, null);
    }

    public void validate() {
        if (symbol == null || symbol.isBlank()) {
            throw new CredentialValidationException("Order symbol is required");
        }
        if (side == null || type == null) {
            throw new CredentialValidationException("Order side and type are required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new CredentialValidationException("Order quantity must be positive");
        }
        if (type.requiresPrice() && (price == null || price.signum() <= 0)) {
            throw new CredentialValidationException("Price is required for " + type.id() + " orders");
        }
        if (type.requiresStopPrice() && (stopPrice == null || stopPrice.signum() <= 0)) {
            throw new CredentialValidationException("Stop price is required for " + type.id() + " orders");
        }
    }
}

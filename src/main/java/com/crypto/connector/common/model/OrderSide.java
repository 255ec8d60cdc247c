package com.crypto.connector.common.model;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OrderSide from(String value) {
        if (value == null || value.isBlank()) {
            throw new CredentialValidationException("Order side is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "buy", "b" -> BUY;
            case "sell", "s" -> SELL;
            default -> throw new CredentialValidationException("Unsupported order side: " + value);
        };
    }
}

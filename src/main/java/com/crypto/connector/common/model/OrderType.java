package com.crypto.connector.common.model;

import java.util.Locale;

public enum OrderType {
    MARKET("market"),
    LIMIT("limit"),
    STOP_LOSS("stop_loss"),
    STOP_LIMIT("stop_limit"),
    TRAILING_STOP("trailing_stop");

    private final String id;

    OrderType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP_LOSS || this == STOP_LIMIT || this == TRAILING_STOP;
    }

    public static OrderType from(String value) {
        if (value == null || value.isBlank()) {
            throw new CredentialValidationException("Order type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (OrderType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new CredentialValidationException("Unsupported order type: " + value);
    }
}

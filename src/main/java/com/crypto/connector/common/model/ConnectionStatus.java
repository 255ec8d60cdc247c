package com.crypto.connector.common.model;

import java.util.Locale;

public enum ConnectionStatus {
    CONNECTED,
    PENDING_OAUTH,
    ERROR,
    DISABLED;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.CredentialValidationException;

import java.util.Locale;

public enum ExchangeProvider {
    COINBASE("coinbase", "Coinbase", CoinbaseApiFamily.ADVANCED_TRADE.id()),
    BINANCE("binance", "Binance.US", "us"),
    KRAKEN("kraken", "Kraken", "standard"),
    SIMULATION("simulation", "Simulation", "paper");

    private final String id;
    private final String displayName;
    private final String defaultFamily;

    ExchangeProvider(String id, String displayName, String defaultFamily) {
        this.id = id;
        this.displayName = displayName;
        this.defaultFamily = defaultFamily;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String defaultFamily() {
        return defaultFamily;
    }

    /**
     * Canonical family id for this provider; blank means the provider default.
     */
    public String normalizeFamily(String apiFamily) {
        if (apiFamily == null || apiFamily.isBlank()) {
            return defaultFamily;
        }
        if (this == COINBASE) {
            return CoinbaseApiFamily.from(apiFamily).id();
        }
        return apiFamily.trim().toLowerCase(Locale.ROOT);
    }

    public static ExchangeProvider from(String value) {
        if (value == null || value.isBlank()) {
            throw new CredentialValidationException("Provider is required");
        }
        String normalized = canonical(value);
        for (ExchangeProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return provider;
            }
        }
        if ("binanceus".equals(normalized)) {
            return BINANCE;
        }
        if ("paper".equals(normalized)) {
            return SIMULATION;
        }
        throw new CredentialValidationException("Unsupported provider: " + value);
    }

    static String canonical(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim().replace("\uFEFF", "");
        return trimmed.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}

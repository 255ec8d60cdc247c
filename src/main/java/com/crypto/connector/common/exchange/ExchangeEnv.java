package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.CredentialValidationException;

import java.util.Locale;

public enum ExchangeEnv {
    PROD,
    SANDBOX;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExchangeEnv from(String value) {
        if (value == null || value.isBlank()) {
            return PROD;
        }
        return switch (ExchangeProvider.canonical(value)) {
            case "prod", "production", "live", "mainnet" -> PROD;
            case "sandbox", "testnet", "test", "demo" -> SANDBOX;
            default -> throw new CredentialValidationException("Unsupported environment: " + value);
        };
    }

    public static ExchangeEnv fromTestnet(boolean isTestnet) {
        return isTestnet ? SANDBOX : PROD;
    }
}

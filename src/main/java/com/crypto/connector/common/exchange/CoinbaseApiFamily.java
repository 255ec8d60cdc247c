package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.CredentialValidationException;

public enum CoinbaseApiFamily {
    APP("app", "Coinbase App"),
    ADVANCED_TRADE("advanced_trade", "Coinbase Advanced Trade"),
    EXCHANGE("exchange", "Coinbase Exchange"),
    SERVER_WALLET("server_wallet", "Coinbase Server Wallet"),
    TRADE_API("trade_api", "Coinbase Trade API");

    private final String id;
    private final String label;

    CoinbaseApiFamily(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static CoinbaseApiFamily from(String value) {
        if (value == null || value.isBlank()) {
            return ADVANCED_TRADE;
        }
        String normalized = ExchangeProvider.canonical(value);
        for (CoinbaseApiFamily family : values()) {
            if (ExchangeProvider.canonical(family.id).equals(normalized)) {
                return family;
            }
        }
        return switch (normalized) {
            case "advanced", "advancedtradeapi" -> ADVANCED_TRADE;
            case "pro", "exchangeapi", "prime" -> EXCHANGE;
            case "tradeapionchain", "onchain" -> TRADE_API;
            case "wallet", "serverwallets" -> SERVER_WALLET;
            default -> throw new CredentialValidationException("Unsupported Coinbase API family: " + value);
        };
    }
}

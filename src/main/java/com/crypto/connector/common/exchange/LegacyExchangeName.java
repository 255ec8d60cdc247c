package com.crypto.connector.common.exchange;

import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import org.apache.commons.lang3.StringUtils;

/**
 * Flat exchange names used by older callers, each mapped onto its canonical
 * provider and API family.
 */
public enum LegacyExchangeName {
    KRAKEN("kraken", ExchangeProvider.KRAKEN, "standard"),
    BINANCE_US("binance_us", ExchangeProvider.BINANCE, "us"),
    COINBASE("coinbase", ExchangeProvider.COINBASE, CoinbaseApiFamily.ADVANCED_TRADE.id()),
    COINBASE_PRO("coinbase_pro", ExchangeProvider.COINBASE, CoinbaseApiFamily.ADVANCED_TRADE.id()),
    COINBASE_ADVANCED_TRADE("coinbase_advanced_trade", ExchangeProvider.COINBASE, CoinbaseApiFamily.ADVANCED_TRADE.id()),
    COINBASE_EXCHANGE("coinbase_exchange", ExchangeProvider.COINBASE, CoinbaseApiFamily.EXCHANGE.id()),
    COINBASE_APP("coinbase_app", ExchangeProvider.COINBASE, CoinbaseApiFamily.APP.id()),
    COINBASE_SERVER_WALLET("coinbase_server_wallet", ExchangeProvider.COINBASE, CoinbaseApiFamily.SERVER_WALLET.id()),
    COINBASE_TRADE_API("coinbase_trade_api", ExchangeProvider.COINBASE, CoinbaseApiFamily.TRADE_API.id());

    private final String id;
    private final ExchangeProvider provider;
    private final String apiFamily;

    LegacyExchangeName(String id, ExchangeProvider provider, String apiFamily) {
        this.id = id;
        this.provider = provider;
        this.apiFamily = apiFamily;
    }

    public String id() {
        return id;
    }

    public ExchangeProvider provider() {
        return provider;
    }

    public String apiFamily() {
        return apiFamily;
    }

    public static LegacyExchangeName from(String value) {
        if (value == null || value.isBlank()) {
            throw new CredentialValidationException("Exchange name is required");
        }
        String normalized = ExchangeProvider.canonical(value);
        for (LegacyExchangeName name : values()) {
            if (ExchangeProvider.canonical(name.id).equals(normalized)) {
                return name;
            }
        }
        if ("binance".equals(normalized) || "binanceus".equals(normalized)) {
            return BINANCE_US;
        }
        throw new CredentialValidationException("Unsupported exchange: " + value);
    }

    /**
     * Reverse mapping used when a canonical connection has to be reported under its flat name.
     * The first declared name wins, so advanced trade reports as plain {@code coinbase}.
     */
    public static LegacyExchangeName of(ExchangeProvider provider, String apiFamily) {
        String family = provider.normalizeFamily(apiFamily);
        for (LegacyExchangeName name : values()) {
            if (name.provider == provider && name.apiFamily.equals(family)) {
                return name;
            }
        }
        return null;
    }

    /**
     * Builds the canonical connection for this flat name. An explicit family only overrides
     * the mapped one for Coinbase names.
     */
    public ExchangeConnectionConfig toConfig(Credentials credentials, boolean isTestnet, String coinbaseApiFamily) {
        String family = provider == ExchangeProvider.COINBASE && StringUtils.isNotBlank(coinbaseApiFamily)
                ? coinbaseApiFamily
                : apiFamily;
        return new ExchangeConnectionConfig(id, provider, family, ExchangeEnv.fromTestnet(isTestnet), credentials);
    }
}

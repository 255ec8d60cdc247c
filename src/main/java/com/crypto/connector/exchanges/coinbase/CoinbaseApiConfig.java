package com.crypto.connector.exchanges.coinbase;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.exchange.CoinbaseApiFamily;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.model.CredentialValidationException;

/**
 * Known Coinbase API surfaces, one per family and environment. Pairs missing from this
 * table have no configuration and cannot be connected.
 */
public enum CoinbaseApiConfig {
    APP_PROD("coinbase-app-prod", CoinbaseApiFamily.APP, ExchangeEnv.PROD,
            "Coinbase App (Retail)", "https://api.coinbase.com", AuthType.OAUTH),
    ADVANCED_PROD("coinbase-advanced-prod", CoinbaseApiFamily.ADVANCED_TRADE, ExchangeEnv.PROD,
            "Coinbase Advanced Trade", "https://api.coinbase.com/api/v3/brokerage", AuthType.JWT_SERVICE),
    EXCHANGE_PROD("coinbase-exchange-prod", CoinbaseApiFamily.EXCHANGE, ExchangeEnv.PROD,
            "Coinbase Exchange (Institutional)", "https://api.exchange.coinbase.com", AuthType.API_KEY),
    SERVER_WALLET_PROD("coinbase-server-wallet-prod", CoinbaseApiFamily.SERVER_WALLET, ExchangeEnv.PROD,
            "Coinbase Server Wallet v2", "https://api.cdp.coinbase.com/server/wallets", AuthType.JWT_SERVICE),
    TRADE_API_PROD("coinbase-trade-api-prod", CoinbaseApiFamily.TRADE_API, ExchangeEnv.PROD,
            "Coinbase Trade API (Onchain Swaps)", "https://api.cdp.coinbase.com/trade", AuthType.JWT_SERVICE),
    ADVANCED_SANDBOX("coinbase-advanced-sandbox", CoinbaseApiFamily.ADVANCED_TRADE, ExchangeEnv.SANDBOX,
            "Coinbase Advanced Trade (Sandbox)", "https://api-public.sandbox.pro.coinbase.com", AuthType.JWT_SERVICE),
    EXCHANGE_SANDBOX("coinbase-exchange-sandbox", CoinbaseApiFamily.EXCHANGE, ExchangeEnv.SANDBOX,
            "Coinbase Exchange (Sandbox)", "https://api-public.sandbox.exchange.coinbase.com", AuthType.API_KEY);

    /** Retail v2 surface used for balances and spot prices by the families without their own. */
    public static final String RETAIL_BASE_URL = "https://api.coinbase.com";

    private final String id;
    private final CoinbaseApiFamily family;
    private final ExchangeEnv env;
    private final String label;
    private final String restBaseUrl;
    private final AuthType authType;

    CoinbaseApiConfig(String id, CoinbaseApiFamily family, ExchangeEnv env, String label, String restBaseUrl,
                      AuthType authType) {
        this.id = id;
        this.family = family;
        this.env = env;
        this.label = label;
        this.restBaseUrl = restBaseUrl;
        this.authType = authType;
    }

    public String id() {
        return id;
    }

    public CoinbaseApiFamily family() {
        return family;
    }

    public ExchangeEnv env() {
        return env;
    }

    public String label() {
        return label;
    }

    public String restBaseUrl() {
        return restBaseUrl;
    }

    public AuthType authType() {
        return authType;
    }

    public static CoinbaseApiConfig find(CoinbaseApiFamily family, ExchangeEnv env) {
        for (CoinbaseApiConfig config : values()) {
            if (config.family == family && config.env == env) {
                return config;
            }
        }
        return null;
    }

    public static CoinbaseApiConfig require(CoinbaseApiFamily family, ExchangeEnv env) {
        CoinbaseApiConfig config = find(family, env);
        if (config == null) {
            throw new CredentialValidationException("No Coinbase configuration for " + family.id() + " / " + env.id());
        }
        return config;
    }
}

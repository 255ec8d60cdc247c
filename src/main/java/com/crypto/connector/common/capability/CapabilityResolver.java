package com.crypto.connector.common.capability;

import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Capabilities;

import java.util.Map;

/**
 * Static capability matrix keyed by provider and API family. The environment never
 * changes the answer; unknown combinations get read-only access.
 */
public final class CapabilityResolver {
    private static final Map<String, Capabilities> TABLE = Map.of(
            "coinbase/app", new Capabilities(true, false, false, true, false),
            "coinbase/advanced_trade", new Capabilities(true, true, true, false, false),
            "coinbase/exchange", new Capabilities(true, true, true, false, false),
            "coinbase/server_wallet", new Capabilities(true, false, false, true, true),
            "coinbase/trade_api", new Capabilities(false, false, false, true, true),
            "binance/us", new Capabilities(true, true, false, true, false),
            "kraken/standard", new Capabilities(true, true, true, true, false),
            "simulation/paper", new Capabilities(true, true, true, false, false)
    );

    private CapabilityResolver() {
    }

    public static Capabilities resolve(ExchangeProvider provider, String apiFamily, ExchangeEnv env) {
        if (provider == null) {
            return Capabilities.readOnly();
        }
        String family;
        try {
            family = provider.normalizeFamily(apiFamily);
        } catch (RuntimeException e) {
            return Capabilities.readOnly();
        }
        return TABLE.getOrDefault(provider.id() + "/" + family, Capabilities.readOnly());
    }
}

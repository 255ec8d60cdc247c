package com.crypto.connector.common.exchange;

import com.crypto.connector.common.auth.AuthStrategies;
import com.crypto.connector.common.auth.RequestSigner;
import com.crypto.connector.common.exchange.impl.ClientSettings;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.properties.AppProperties;
import com.crypto.connector.exchanges.binance.BinanceClient;
import com.crypto.connector.exchanges.coinbase.CoinbaseApiConfig;
import com.crypto.connector.exchanges.coinbase.CoinbaseClient;
import com.crypto.connector.exchanges.coinbase.CoinbaseMode;
import com.crypto.connector.exchanges.kraken.KrakenClient;
import com.crypto.connector.exchanges.simulation.SimulationClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Builds one client per connection. Base URLs come from the built-in table unless
 * {@code app.endpoints.<endpoint-id>.base-url} overrides them.
 */
@Slf4j
public class ExchangeClientFactory {
    private final ClientSettings settings;
    private final AuthStrategies authStrategies;
    private final Map<String, AppProperties.EndpointConfig> endpoints;

    public ExchangeClientFactory(ClientSettings settings, AuthStrategies authStrategies,
                                 Map<String, AppProperties.EndpointConfig> endpoints) {
        this.settings = settings;
        this.authStrategies = authStrategies;
        this.endpoints = endpoints == null ? Map.of() : endpoints;
    }

    public ExchangeClient build(ExchangeConnectionConfig config) {
        RequestSigner signer = authStrategies.signerFor(config);
        return switch (config.provider) {
            case KRAKEN -> new KrakenClient(config,
                    resolveBaseUrl(endpointId(config), KrakenClient.defaultBaseUrl(config.env)), signer, settings);
            case BINANCE -> new BinanceClient(config,
                    resolveBaseUrl(endpointId(config), BinanceClient.defaultBaseUrl(config.env)), signer, settings);
            case COINBASE -> buildCoinbase(config, signer);
            case SIMULATION -> new SimulationClient(config, settings.clock);
        };
    }

    /**
     * Flat-name entry point for older callers; resolves to the same client as the canonical form.
     */
    public ExchangeClient build(String exchangeName, Credentials credentials, boolean isTestnet,
                                String coinbaseApiFamily) {
        return build(LegacyExchangeName.from(exchangeName).toConfig(credentials, isTestnet, coinbaseApiFamily));
    }

    static String endpointId(ExchangeConnectionConfig config) {
        if (config.provider == ExchangeProvider.COINBASE) {
            CoinbaseApiConfig apiConfig = CoinbaseApiConfig.find(CoinbaseApiFamily.from(config.apiFamily), config.env);
            if (apiConfig != null) {
                return apiConfig.id();
            }
        }
        return config.provider.id() + "-" + config.apiFamily.replace('_', '-') + "-" + config.env.id();
    }

    private ExchangeClient buildCoinbase(ExchangeConnectionConfig config, RequestSigner signer) {
        CoinbaseApiFamily family = CoinbaseApiFamily.from(config.apiFamily);
        CoinbaseApiConfig apiConfig = CoinbaseApiConfig.require(family, config.env);
        CoinbaseMode mode = CoinbaseMode.forFamily(family);
        String defaultUrl = mode == CoinbaseMode.BASIC ? CoinbaseApiConfig.RETAIL_BASE_URL : apiConfig.restBaseUrl();
        return new CoinbaseClient(config, mode, resolveBaseUrl(apiConfig.id(), defaultUrl), signer, settings);
    }

    private String resolveBaseUrl(String endpointId, String defaultUrl) {
        AppProperties.EndpointConfig override = endpoints.get(endpointId);
        if (override != null && StringUtils.isNotBlank(override.getBaseUrl())) {
            LOG.debug("endpoint {} overridden to {}", endpointId, override.getBaseUrl());
            return override.getBaseUrl();
        }
        return defaultUrl;
    }
}

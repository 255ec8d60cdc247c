package com.crypto.connector.common.model;

import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to build one client for one connection. Immutable; the API family is
 * stored in canonical form, defaulting to the provider's family when absent.
 */
public class ExchangeConnectionConfig {
    public final String id;
    public final ExchangeProvider provider;
    public final String apiFamily;
    public final ExchangeEnv env;
    public final Credentials credentials;
    public final Map<String, String> metadata;

    public ExchangeConnectionConfig(String id, ExchangeProvider provider, String apiFamily, ExchangeEnv env,
                                    Credentials credentials, Map<String, String> metadata) {
        if (provider == null) {
            throw new CredentialValidationException("Provider is required");
        }
        this.id = id;
        this.provider = provider;
        this.apiFamily = provider.normalizeFamily(apiFamily);
        this.env = env == null ? ExchangeEnv.PROD : env;
        this.credentials = credentials == null ? Credentials.empty() : credentials;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ExchangeConnectionConfig(String id, ExchangeProvider provider, String apiFamily, ExchangeEnv env,
                                    Credentials credentials) {
        this(id, provider, apiFamily, env, credentials, Map.of());
    }

    public String metadata(String key) {
        return metadata.get(key);
    }

    @Override
    public String toString() {
        return "ExchangeConnectionConfig[id=" + id + ", provider=" + provider.id() + ", apiFamily=" + apiFamily
                + ", env=" + env.id() + "]";
    }
}

package com.crypto.connector.common.model;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Input for creating or testing a connection. {@code authType} may be left null to take the
 * template's. {@code apiKey} may hold a pasted JSON key file instead of a bare key.
 */
@Builder
public class ConnectionRequest {
    public final String id;
    public final String label;
    public final ExchangeProvider provider;
    public final String apiFamily;
    public final ExchangeEnv env;
    public final AuthType authType;
    public final String apiKey;
    public final String apiSecret;
    public final String apiPassphrase;
    public final String oauthRedirectUri;
    public final List<String> oauthScopes;
    public final Map<String, String> metadata;

    public ExchangeEnv envOrDefault() {
        return env == null ? ExchangeEnv.PROD : env;
    }

    @Override
    public String toString() {
        return "ConnectionRequest[id=" + id + ", provider=" + (provider == null ? null : provider.id())
                + ", apiFamily=" + apiFamily + ", env=" + envOrDefault().id() + "]";
    }
}

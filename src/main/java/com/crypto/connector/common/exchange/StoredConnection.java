package com.crypto.connector.common.exchange;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.model.ConnectionStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of a connection. Credential fields hold codec output, never plaintext.
 */
public class StoredConnection {
    public final String id;
    public final String label;
    public final ExchangeProvider provider;
    public final String apiFamily;
    public final ExchangeEnv env;
    public final AuthType authType;
    public final ConnectionStatus status;
    public final String encodedApiKey;
    public final String encodedApiSecret;
    public final String encodedPassphrase;
    public final Map<String, String> metadata;
    public final String oauthUrl;
    public final Instant createdAt;

    public StoredConnection(String id, String label, ExchangeProvider provider, String apiFamily, ExchangeEnv env,
                            AuthType authType, ConnectionStatus status, String encodedApiKey,
                            String encodedApiSecret, String encodedPassphrase, Map<String, String> metadata,
                            String oauthUrl, Instant createdAt) {
        this.id = id;
        this.label = label;
        this.provider = provider;
        this.apiFamily = provider.normalizeFamily(apiFamily);
        this.env = env;
        this.authType = authType;
        this.status = status;
        this.encodedApiKey = encodedApiKey;
        this.encodedApiSecret = encodedApiSecret;
        this.encodedPassphrase = encodedPassphrase;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.oauthUrl = oauthUrl;
        this.createdAt = createdAt;
    }

    public StoredConnection withStatus(ConnectionStatus newStatus) {
        return new StoredConnection(id, label, provider, apiFamily, env, authType, newStatus, encodedApiKey,
                encodedApiSecret, encodedPassphrase, metadata, oauthUrl, createdAt);
    }
}

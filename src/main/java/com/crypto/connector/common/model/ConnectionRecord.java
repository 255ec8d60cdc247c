package com.crypto.connector.common.model;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;

/**
 * Caller-facing view of a stored connection. Carries no secret material.
 */
public class ConnectionRecord {
    public final String id;
    public final String label;
    public final ExchangeProvider provider;
    public final String apiFamily;
    public final ExchangeEnv env;
    public final AuthType authType;
    public final ConnectionStatus status;
    public final Capabilities capabilities;
    public final String oauthUrl;
    public final String message;

    public ConnectionRecord(String id, String label, ExchangeProvider provider, String apiFamily, ExchangeEnv env,
                            AuthType authType, ConnectionStatus status, Capabilities capabilities,
                            String oauthUrl, String message) {
        this.id = id;
        this.label = label;
        this.provider = provider;
        this.apiFamily = apiFamily;
        this.env = env;
        this.authType = authType;
        this.status = status;
        this.capabilities = capabilities;
        this.oauthUrl = oauthUrl;
        this.message = message;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(" [").append(status.id()).append("] ")
                .append(provider.id()).append('/').append(apiFamily).append('/').append(env.id())
                .append(" auth=").append(authType.id());
        if (label != null && !label.isBlank()) {
            sb.append(" label=").append(label);
        }
        if (oauthUrl != null) {
            sb.append(" authorize=").append(oauthUrl);
        }
        return sb.toString();
    }
}

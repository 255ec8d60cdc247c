package com.crypto.connector.common.capability;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.Capabilities;

import java.util.List;

public class ConnectionTemplate {
    public final ExchangeProvider provider;
    public final String apiFamily;
    public final String label;
    public final List<ExchangeEnv> envs;
    public final AuthType authType;
    public final List<String> requiredFields;
    public final Capabilities capabilities;

    public ConnectionTemplate(ExchangeProvider provider, String apiFamily, String label, List<ExchangeEnv> envs,
                              AuthType authType, List<String> requiredFields, Capabilities capabilities) {
        this.provider = provider;
        this.apiFamily = apiFamily;
        this.label = label;
        this.envs = List.copyOf(envs);
        this.authType = authType;
        this.requiredFields = List.copyOf(requiredFields);
        this.capabilities = capabilities;
    }

    public boolean supports(ExchangeEnv env) {
        return envs.contains(env);
    }
}

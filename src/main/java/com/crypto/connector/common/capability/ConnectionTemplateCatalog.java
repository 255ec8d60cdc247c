package com.crypto.connector.common.capability;

import com.crypto.connector.common.auth.AuthStrategies;
import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.exchange.CoinbaseApiFamily;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.exchanges.coinbase.CoinbaseApiConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Connectable (provider, family) combinations with the environments, auth type and
 * credential fields each one expects.
 */
public class ConnectionTemplateCatalog {
    private final List<ConnectionTemplate> templates;

    public ConnectionTemplateCatalog() {
        this.templates = List.copyOf(build());
    }

    public List<ConnectionTemplate> templates() {
        return templates;
    }

    public Optional<ConnectionTemplate> find(ExchangeProvider provider, String apiFamily) {
        String family = provider.normalizeFamily(apiFamily);
        return templates.stream()
                .filter(t -> t.provider == provider && t.apiFamily.equals(family))
                .findFirst();
    }

    public ConnectionTemplate require(ExchangeProvider provider, String apiFamily, ExchangeEnv env) {
        ConnectionTemplate template = find(provider, apiFamily)
                .orElseThrow(() -> new CredentialValidationException(
                        "Unsupported provider/family: " + provider.id() + "/" + apiFamily));
        if (!template.supports(env)) {
            throw new CredentialValidationException(
                    template.label + " is not available in " + env.id());
        }
        return template;
    }

    public static List<String> requiredFields(ExchangeProvider provider, String apiFamily, AuthType authType) {
        return switch (authType) {
            case JWT_SERVICE -> List.of("jwtKeyName", "jwtPrivateKey");
            case OAUTH, NONE -> List.of();
            case API_KEY -> provider == ExchangeProvider.COINBASE
                    && CoinbaseApiFamily.from(apiFamily) == CoinbaseApiFamily.EXCHANGE
                    ? List.of("apiKey", "apiSecret", "apiPassphrase")
                    : List.of("apiKey", "apiSecret");
        };
    }

    private static List<ConnectionTemplate> build() {
        List<ConnectionTemplate> out = new ArrayList<>();
        for (CoinbaseApiFamily family : CoinbaseApiFamily.values()) {
            List<ExchangeEnv> envs = new ArrayList<>();
            for (ExchangeEnv env : ExchangeEnv.values()) {
                if (CoinbaseApiConfig.find(family, env) != null) {
                    envs.add(env);
                }
            }
            if (!envs.isEmpty()) {
                out.add(template(ExchangeProvider.COINBASE, family.id(), family.label(), envs));
            }
        }
        List<ExchangeEnv> both = List.of(ExchangeEnv.PROD, ExchangeEnv.SANDBOX);
        out.add(template(ExchangeProvider.BINANCE, "us", "Binance.US", both));
        out.add(template(ExchangeProvider.KRAKEN, "standard", "Kraken", both));
        out.add(template(ExchangeProvider.SIMULATION, "paper", "Paper Trading", List.of(ExchangeEnv.SANDBOX)));
        return out;
    }

    private static ConnectionTemplate template(ExchangeProvider provider, String family, String label,
                                               List<ExchangeEnv> envs) {
        AuthType authType = AuthStrategies.authType(provider, family);
        return new ConnectionTemplate(provider, family, label, envs, authType,
                requiredFields(provider, family, authType),
                CapabilityResolver.resolve(provider, family, envs.get(0)));
    }
}

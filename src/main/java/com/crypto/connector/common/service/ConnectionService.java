package com.crypto.connector.common.service;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.auth.OAuthSigner;
import com.crypto.connector.common.capability.CapabilityResolver;
import com.crypto.connector.common.capability.ConnectionTemplate;
import com.crypto.connector.common.capability.ConnectionTemplateCatalog;
import com.crypto.connector.common.exchange.ConnectionRegistry;
import com.crypto.connector.common.exchange.ExchangeClient;
import com.crypto.connector.common.exchange.ExchangeClientFactory;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.exchange.StoredConnection;
import com.crypto.connector.common.model.ConnectionRecord;
import com.crypto.connector.common.model.ConnectionRequest;
import com.crypto.connector.common.model.ConnectionStatus;
import com.crypto.connector.common.model.ConnectionTestResult;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.ExchangeException;
import com.crypto.connector.common.properties.AppProperties;
import com.crypto.connector.common.properties.ConnectionsProperties;
import com.crypto.connector.common.security.CredentialCodec;
import com.crypto.connector.common.validation.CredentialJsonParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates, stores and resolves connections. Key-based connections are only stored after a
 * successful test; credentials are stored through the {@link CredentialCodec}.
 */
@Slf4j
public class ConnectionService {
    static final String OAUTH_REDIRECT_KEY = "oauthRedirectUri";
    static final String OAUTH_SCOPES_KEY = "oauthScopes";

    private final ConnectionTemplateCatalog catalog;
    private final ConnectionTester tester;
    private final CredentialCodec codec;
    private final ConnectionRegistry registry;
    private final ExchangeClientFactory factory;
    private final Map<String, AppProperties.OAuthConfig> oauth;
    private final Clock clock;
    // Paper accounts keep their balances and orders only in memory, so one client per connection.
    private final Map<String, ExchangeClient> simulations = new ConcurrentHashMap<>();

    public ConnectionService(ConnectionTemplateCatalog catalog, ConnectionTester tester, CredentialCodec codec,
                             ConnectionRegistry registry, ExchangeClientFactory factory,
                             Map<String, AppProperties.OAuthConfig> oauth, Clock clock) {
        this.catalog = catalog;
        this.tester = tester;
        this.codec = codec;
        this.registry = registry;
        this.factory = factory;
        this.oauth = oauth == null ? Map.of() : oauth;
        this.clock = clock;
    }

    public ConnectionRecord connect(ConnectionRequest request) {
        if (request.provider == null) {
            throw new CredentialValidationException("Provider is required");
        }
        ExchangeEnv env = request.envOrDefault();
        ConnectionTemplate template = catalog.require(request.provider, request.apiFamily, env);
        AuthType authType = request.authType == null ? template.authType : request.authType;
        if (authType != template.authType) {
            throw new CredentialValidationException("Auth type " + authType.id() + " is not valid for "
                    + template.label + "; expected " + template.authType.id());
        }
        String id = StringUtils.isBlank(request.id) ? UUID.randomUUID().toString() : request.id.trim();
        if (registry.find(id).isPresent()) {
            throw new CredentialValidationException("Connection " + id + " already exists");
        }
        return switch (authType) {
            case API_KEY, JWT_SERVICE -> connectWithKeys(id, request, template, env);
            case OAUTH -> connectOAuth(id, request, template, env);
            case NONE -> store(id, request, template, env, ConnectionStatus.CONNECTED, Credentials.empty(),
                    request.metadata, null, "Simulation ready");
        };
    }

    /**
     * Runs the connection test for a stored connection.
     */
    public ConnectionTestResult test(String id) {
        StoredConnection stored = registry.require(id);
        if (stored.authType == AuthType.NONE || stored.authType == AuthType.OAUTH) {
            boolean ok = client(id).testConnection();
            return ok ? new ConnectionTestResult(true, "Connected to " + stored.provider.displayName(), List.of(), null)
                    : ConnectionTestResult.failure(ConnectionTester.CONNECT_FAILED, List.of());
        }
        Credentials credentials = decode(stored);
        ConnectionTestResult result = tester.test(ConnectionRequest.builder()
                .id(stored.id)
                .provider(stored.provider)
                .apiFamily(stored.apiFamily)
                .env(stored.env)
                .apiKey(credentials.apiKey)
                .apiSecret(credentials.apiSecret)
                .apiPassphrase(credentials.apiPassphrase)
                .metadata(stored.metadata)
                .build());
        registry.save(stored.withStatus(result.success ? ConnectionStatus.CONNECTED : ConnectionStatus.ERROR));
        return result;
    }

    public List<ConnectionRecord> list() {
        return registry.list().stream().map(this::toRecord).toList();
    }

    public Optional<ConnectionRecord> get(String id) {
        return registry.find(id).map(this::toRecord);
    }

    public boolean disconnect(String id) {
        boolean removed = registry.remove(id);
        simulations.remove(id);
        if (removed) {
            LOG.info("connection {} removed", id);
        }
        return removed;
    }

    /**
     * Builds a live client for a stored connection.
     */
    public ExchangeClient client(String id) {
        StoredConnection stored = registry.require(id);
        if (stored.status == ConnectionStatus.DISABLED) {
            throw new ExchangeException("Connection " + id + " is disabled");
        }
        if (stored.provider == ExchangeProvider.SIMULATION) {
            return simulations.computeIfAbsent(id, key -> factory.build(config(stored)));
        }
        return factory.build(config(stored));
    }

    private ExchangeConnectionConfig config(StoredConnection stored) {
        return new ExchangeConnectionConfig(stored.id, stored.provider, stored.apiFamily, stored.env,
                decode(stored), stored.metadata);
    }

    public ConnectionRecord completeOAuth(String id, String authorizationCode) {
        StoredConnection stored = registry.require(id);
        if (stored.authType != AuthType.OAUTH) {
            throw new CredentialValidationException("Connection " + id + " does not use OAuth");
        }
        OAuthSigner.exchangeAuthorizationCode(authorizationCode);
        return toRecord(stored);
    }

    /**
     * Loads configured connections without testing them.
     */
    public int restore(ConnectionsProperties properties) {
        if (properties == null || properties.getEntries() == null) {
            return 0;
        }
        int count = 0;
        for (Map.Entry<String, ConnectionsProperties.ConnectionEntry> e : properties.getEntries().entrySet()) {
            ConnectionsProperties.ConnectionEntry entry = e.getValue();
            try {
                ExchangeProvider provider = ExchangeProvider.from(entry.getProvider());
                ExchangeEnv env = ExchangeEnv.from(entry.getEnv());
                ConnectionTemplate template = catalog.require(provider, entry.getApiFamily(), env);
                Credentials credentials = new Credentials(entry.getApiKey(), entry.getApiSecret(),
                        entry.getApiPassphrase());
                ConnectionStatus status = template.authType == AuthType.OAUTH
                        && StringUtils.isBlank(entry.getMetadata().get(OAuthSigner.ACCESS_TOKEN_KEY))
                        ? ConnectionStatus.PENDING_OAUTH
                        : ConnectionStatus.CONNECTED;
                ConnectionRequest request = ConnectionRequest.builder()
                        .id(e.getKey())
                        .label(entry.getLabel())
                        .provider(provider)
                        .apiFamily(template.apiFamily)
                        .env(env)
                        .build();
                store(e.getKey(), request, template, env, status, credentials, entry.getMetadata(), null,
                        "Restored from configuration");
                count++;
            } catch (ExchangeException ex) {
                LOG.warn("skipping configured connection {}: {}", e.getKey(), ex.getUserMessage());
            }
        }
        return count;
    }

    private ConnectionRecord connectWithKeys(String id, ConnectionRequest request, ConnectionTemplate template,
                                             ExchangeEnv env) {
        if (StringUtils.isBlank(request.apiKey)
                || (StringUtils.isBlank(request.apiSecret) && !CredentialJsonParser.looksLikeJson(request.apiKey))) {
            throw new CredentialValidationException("API key and secret are required for " + template.label);
        }
        ConnectionTestResult result = tester.test(request);
        if (!result.success) {
            LOG.warn("connection {} not stored: {}", id, result.message);
            return new ConnectionRecord(id, request.label, template.provider, template.apiFamily, env,
                    template.authType, ConnectionStatus.ERROR, template.capabilities, null,
                    withWarnings(result.message, result.warnings));
        }
        return store(id, request, template, env, ConnectionStatus.CONNECTED, result.credentials, request.metadata,
                null, withWarnings(result.message, result.warnings));
    }

    private ConnectionRecord connectOAuth(String id, ConnectionRequest request, ConnectionTemplate template,
                                          ExchangeEnv env) {
        AppProperties.OAuthConfig config = oauth.get(template.provider.id());
        if (config == null || StringUtils.isBlank(config.getAuthorizeUrl())) {
            throw new CredentialValidationException("OAuth is not configured for " + template.provider.displayName());
        }
        String redirectUri = StringUtils.defaultIfBlank(request.oauthRedirectUri, config.getRedirectUri());
        if (StringUtils.isBlank(redirectUri)) {
            throw new CredentialValidationException("OAuth redirect URI is required");
        }
        List<String> scopes = request.oauthScopes == null || request.oauthScopes.isEmpty()
                ? config.getDefaultScopes()
                : request.oauthScopes;
        String url = OAuthSigner.authorizationUrl(config.getAuthorizeUrl(), config.getClientId(), redirectUri,
                scopes, id);
        Map<String, String> metadata = new LinkedHashMap<>(request.metadata == null ? Map.of() : request.metadata);
        metadata.put(OAUTH_REDIRECT_KEY, redirectUri);
        metadata.put(OAUTH_SCOPES_KEY, String.join(" ", scopes));
        return store(id, request, template, env, ConnectionStatus.PENDING_OAUTH, Credentials.empty(), metadata, url,
                "Authorize access in the browser to finish connecting");
    }

    private ConnectionRecord store(String id, ConnectionRequest request, ConnectionTemplate template, ExchangeEnv env,
                                   ConnectionStatus status, Credentials credentials, Map<String, String> metadata,
                                   String oauthUrl, String message) {
        StoredConnection stored = new StoredConnection(id, request.label, template.provider, template.apiFamily, env,
                template.authType, status, codec.encode(credentials.apiKey), codec.encode(credentials.apiSecret),
                codec.encode(credentials.apiPassphrase), metadata, oauthUrl, clock.instant());
        registry.save(stored);
        simulations.remove(id);
        LOG.info("connection {} stored: {}/{}/{} status={}", id, template.provider.id(), template.apiFamily,
                env.id(), status.id());
        return toRecord(stored, message);
    }

    private Credentials decode(StoredConnection stored) {
        return new Credentials(codec.decode(stored.encodedApiKey), codec.decode(stored.encodedApiSecret),
                codec.decode(stored.encodedPassphrase));
    }

    private ConnectionRecord toRecord(StoredConnection stored) {
        return toRecord(stored, null);
    }

    private ConnectionRecord toRecord(StoredConnection stored, String message) {
        return new ConnectionRecord(stored.id, stored.label, stored.provider, stored.apiFamily, stored.env,
                stored.authType, stored.status,
                CapabilityResolver.resolve(stored.provider, stored.apiFamily, stored.env),
                stored.oauthUrl, message);
    }

    private static String withWarnings(String message, List<String> warnings) {
        if (warnings == null || warnings.isEmpty()) {
            return message;
        }
        return message + " (" + String.join("; ", warnings) + ")";
    }
}

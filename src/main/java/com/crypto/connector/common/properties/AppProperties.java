package com.crypto.connector.common.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
@Validated
public class AppProperties {
    @Valid
    private HttpConfig http = new HttpConfig();
    @Valid
    private RetryConfig retry = new RetryConfig();
    private Map<String, @Valid EndpointConfig> endpoints = new HashMap<>();
    private CredentialsConfig credentials = new CredentialsConfig();
    private Map<String, OAuthConfig> oauth = new HashMap<>();
    private ReplConfig repl = new ReplConfig();

    public static class HttpConfig {
        @NotNull
        private Duration timeout = Duration.ofSeconds(15);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class RetryConfig {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }
    }

    public static class EndpointConfig {
        @NotBlank
        private String baseUrl;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class CredentialsConfig {
        private String key;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    public static class OAuthConfig {
        private String authorizeUrl;
        private String clientId;
        private String redirectUri;
        private List<String> defaultScopes = new ArrayList<>();

        public String getAuthorizeUrl() {
            return authorizeUrl;
        }

        public void setAuthorizeUrl(String authorizeUrl) {
            this.authorizeUrl = authorizeUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getRedirectUri() {
            return redirectUri;
        }

        public void setRedirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
        }

        public List<String> getDefaultScopes() {
            return defaultScopes;
        }

        public void setDefaultScopes(List<String> defaultScopes) {
            this.defaultScopes = defaultScopes;
        }
    }

    public static class ReplConfig {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public HttpConfig getHttp() {
        return http;
    }

    public void setHttp(HttpConfig http) {
        this.http = http;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry;
    }

    public Map<String, EndpointConfig> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(Map<String, EndpointConfig> endpoints) {
        this.endpoints = endpoints;
    }

    public CredentialsConfig getCredentials() {
        return credentials;
    }

    public void setCredentials(CredentialsConfig credentials) {
        this.credentials = credentials;
    }

    public Map<String, OAuthConfig> getOauth() {
        return oauth;
    }

    public void setOauth(Map<String, OAuthConfig> oauth) {
        this.oauth = oauth;
    }

    public ReplConfig getRepl() {
        return repl;
    }

    public void setRepl(ReplConfig repl) {
        this.repl = repl;
    }
}

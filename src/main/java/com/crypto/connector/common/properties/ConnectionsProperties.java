package com.crypto.connector.common.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connections declared in configuration, keyed by connection id. Loaded at startup
 * without a network test.
 */
@ConfigurationProperties(prefix = "connections")
@Validated
public class ConnectionsProperties {
    private Map<String, @Valid ConnectionEntry> entries = new LinkedHashMap<>();

    public static class ConnectionEntry {
        @NotBlank
        private String provider;
        private String apiFamily;
        private String env = "prod";
        private String label;
        private String apiKey;
        private String apiSecret;
        private String apiPassphrase;
        private Map<String, String> metadata = new LinkedHashMap<>();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getApiFamily() {
            return apiFamily;
        }

        public void setApiFamily(String apiFamily) {
            this.apiFamily = apiFamily;
        }

        public String getEnv() {
            return env;
        }

        public void setEnv(String env) {
            this.env = env;
        }

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiSecret() {
            return apiSecret;
        }

        public void setApiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
        }

        public String getApiPassphrase() {
            return apiPassphrase;
        }

        public void setApiPassphrase(String apiPassphrase) {
            this.apiPassphrase = apiPassphrase;
        }

        public Map<String, String> getMetadata() {
            return metadata;
        }

        public void setMetadata(Map<String, String> metadata) {
            this.metadata = metadata;
        }
    }

    public Map<String, ConnectionEntry> getEntries() {
        return entries;
    }

    public void setEntries(Map<String, ConnectionEntry> entries) {
        this.entries = entries;
    }
}

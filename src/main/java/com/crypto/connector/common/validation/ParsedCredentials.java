package com.crypto.connector.common.validation;

import java.util.List;

public class ParsedCredentials {
    public final String apiKey;
    public final String apiSecret;
    public final String apiPassphrase;
    public final List<String> warnings;

    public ParsedCredentials(String apiKey, String apiSecret, String apiPassphrase, List<String> warnings) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.apiPassphrase = apiPassphrase;
        this.warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return apiKey.isEmpty() && apiSecret.isEmpty();
    }
}

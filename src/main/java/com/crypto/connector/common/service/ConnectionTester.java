package com.crypto.connector.common.service;

import com.crypto.connector.common.exchange.ExchangeClient;
import com.crypto.connector.common.exchange.ExchangeClientFactory;
import com.crypto.connector.common.model.ConnectionRequest;
import com.crypto.connector.common.model.ConnectionTestResult;
import com.crypto.connector.common.model.Credentials;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.ExchangeException;
import com.crypto.connector.common.util.LogSanitizer;
import com.crypto.connector.common.validation.CredentialFormatValidator;
import com.crypto.connector.common.validation.CredentialJsonParser;
import com.crypto.connector.common.validation.ParsedCredentials;
import com.crypto.connector.common.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates credentials locally, then probes the exchange with a read-only call.
 * Returns the sanitized credentials on success; never throws for bad input.
 */
@Slf4j
public class ConnectionTester {
    static final String CONNECT_FAILED = "Failed to connect to exchange. Please check your credentials.";

    private final ExchangeClientFactory factory;
    private final CredentialFormatValidator validator;
    private final CredentialJsonParser jsonParser;

    public ConnectionTester(ExchangeClientFactory factory, CredentialFormatValidator validator,
                            CredentialJsonParser jsonParser) {
        this.factory = factory;
        this.validator = validator;
        this.jsonParser = jsonParser;
    }

    public ConnectionTestResult test(ConnectionRequest request) {
        List<String> warnings = new ArrayList<>();
        Credentials raw = new Credentials(request.apiKey, request.apiSecret, request.apiPassphrase);
        String pasted = CredentialJsonParser.looksLikeJson(request.apiKey) ? request.apiKey
                : CredentialJsonParser.looksLikeJson(request.apiSecret) ? request.apiSecret : null;
        if (pasted != null) {
            Optional<ParsedCredentials> parsed = jsonParser.parse(pasted);
            if (parsed.isEmpty() || parsed.get().isEmpty()) {
                parsed.ifPresent(p -> warnings.addAll(p.warnings));
                return ConnectionTestResult.failure("Pasted JSON does not contain API credentials", warnings);
            }
            ParsedCredentials credentials = parsed.get();
            warnings.addAll(credentials.warnings);
            raw = new Credentials(credentials.apiKey, credentials.apiSecret,
                    StringUtils.defaultIfBlank(credentials.apiPassphrase, request.apiPassphrase));
        }

        ValidationResult validation = validator.validate(request.provider, request.apiFamily, raw);
        warnings.addAll(validation.warnings);
        if (!validation.valid) {
            return ConnectionTestResult.failure(validation.error, warnings);
        }

        ExchangeConnectionConfig config = new ExchangeConnectionConfig("test-" + UUID.randomUUID(),
                request.provider, request.apiFamily, request.envOrDefault(), validation.sanitized, request.metadata);
        ExchangeClient client;
        try {
            client = factory.build(config);
        } catch (ExchangeException e) {
            return ConnectionTestResult.failure(e.getUserMessage(), warnings);
        }
        if (!client.testConnection()) {
            LOG.warn("connection test failed for {}", config);
            return ConnectionTestResult.failure(CONNECT_FAILED, warnings);
        }
        LOG.info("connection test passed for {}", LogSanitizer.sanitize(config.toString()));
        return new ConnectionTestResult(true, "Connected to " + client.name(), warnings, validation.sanitized);
    }
}

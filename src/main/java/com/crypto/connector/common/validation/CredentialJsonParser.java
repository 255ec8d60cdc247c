package com.crypto.connector.common.validation;

import com.crypto.connector.common.auth.PemKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes credential files pasted whole into a key field: CDP key downloads
 * ({@code name} + {@code privateKey}), AWS credential files, and flat key/secret objects.
 */
public class CredentialJsonParser {
    static final String MODERN_FORMAT_WARNING =
            "Extracted modern API key format (name + privateKey). This is the new format.";
    static final String PEM_FORMAT_WARNING =
            "Extracted credentials with PEM-encoded private key. Please verify this is for an exchange.";
    static final String AWS_WARNING =
            "This appears to be an AWS credentials file, not an exchange API key. Exchange API keys have a different format.";
    static final String LEGACY_WARNING = "Extracted credentials from JSON. Please verify they are correct.";

    private final ObjectMapper mapper;

    public CredentialJsonParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static boolean looksLikeJson(String content) {
        if (content == null) {
            return false;
        }
        String trimmed = content.trim();
        return trimmed.startsWith("{") && trimmed.endsWith("}") && trimmed.contains("\"");
    }

    public Optional<ParsedCredentials> parse(String content) {
        if (!looksLikeJson(content)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(content.trim());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        String name = text(root, "name");
        String privateKey = text(root, "privateKey");
        if (!name.isEmpty() && !privateKey.isEmpty()) {
            if (isCdpKeyName(name)) {
                return Optional.of(new ParsedCredentials(CredentialSanitizer.sanitizeApiKey(name),
                        CredentialSanitizer.sanitizePrivateKey(privateKey), null, List.of(MODERN_FORMAT_WARNING)));
            }
            if (PemKeys.isPem(privateKey)) {
                return Optional.of(new ParsedCredentials(CredentialSanitizer.sanitizeApiKey(name),
                        CredentialSanitizer.sanitizePrivateKey(privateKey), null, List.of(PEM_FORMAT_WARNING)));
            }
        }

        if (root.hasNonNull("AccessKeyId") || root.hasNonNull("SecretAccessKey") || root.hasNonNull("aws_access_key_id")) {
            return Optional.of(new ParsedCredentials("", "", null, List.of(AWS_WARNING)));
        }

        String apiKey = first(root, "apiKey", "api_key", "key", "accessKey");
        String apiSecret = first(root, "apiSecret", "api_secret", "secret", "secretKey");
        String passphrase = first(root, "apiPassphrase", "api_passphrase", "passphrase");
        if (!apiKey.isEmpty() && !apiSecret.isEmpty()) {
            return Optional.of(new ParsedCredentials(CredentialSanitizer.sanitizeApiKey(apiKey),
                    CredentialSanitizer.sanitizeSecret(apiSecret),
                    CredentialSanitizer.sanitizePassphrase(passphrase),
                    List.of(LEGACY_WARNING)));
        }
        return Optional.empty();
    }

    public static boolean isCdpKeyName(String value) {
        return value != null && value.contains("organizations/") && value.contains("apiKeys/");
    }

    private static String first(JsonNode root, String... fields) {
        for (String field : fields) {
            String value = text(root, field);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() || !node.isValueNode() ? "" : node.asText();
    }
}

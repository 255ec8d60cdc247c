package com.crypto.connector.common.validation;

import com.crypto.connector.common.auth.PemKeys;

public final class CredentialSanitizer {
    private CredentialSanitizer() {
    }

    /**
     * Trims, strips one pair of surrounding quotes, drops line breaks and tabs, and collapses runs of
     * whitespace to a single space.
     */
    public static String sanitizeApiKey(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        return stripQuotes(key.trim())
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Keeps PEM structure intact: normalizes line endings and expands literal {@code \n} sequences.
     */
    public static String sanitizePrivateKey(String privateKey) {
        if (privateKey == null || privateKey.isEmpty()) {
            return "";
        }
        return stripQuotes(privateKey.trim())
                .replace("\r\n", "\n")
                .replace("\r", "\n")
                .replaceAll("\n+$", "")
                .replace("\\n", "\n")
                .trim();
    }

    public static String sanitizeSecret(String secret) {
        return PemKeys.isPem(secret) ? sanitizePrivateKey(secret) : sanitizeApiKey(secret);
    }

    public static String sanitizePassphrase(String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            return null;
        }
        return sanitizeApiKey(passphrase);
    }

    private static String stripQuotes(String value) {
        return value.replaceAll("^[\"']|[\"']$", "");
    }
}

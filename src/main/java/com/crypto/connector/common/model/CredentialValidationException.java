package com.crypto.connector.common.model;

/**
 * Raised before any network call when input is malformed, incomplete or names an
 * unsupported provider / family / auth combination.
 */
public class CredentialValidationException extends ExchangeException {
    public CredentialValidationException(String userMessage) {
        super(userMessage);
    }

    public CredentialValidationException(String userMessage, Throwable cause) {
        super(userMessage, cause);
    }
}

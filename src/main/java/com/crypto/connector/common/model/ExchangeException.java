package com.crypto.connector.common.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Root of every connector failure. The user message is safe to show and to log: it never
 * carries credentials, signatures or raw response bodies.
 *
 * <ul>
 *     <li>{@link CredentialValidationException}: rejected before any network call</li>
 *     <li>{@link ExchangeApiException}: the provider answered with an error</li>
 *     <li>{@link ExchangeConnectivityException}: no usable answer (I/O, timeout)</li>
 *     <li>{@link OperationNotSupportedException}: capability not granted or not implemented</li>
 * </ul>
 */
public class ExchangeException extends RuntimeException {
    static final String DEFAULT_MESSAGE = "Exchange request failed";

    private final String userMessage;

    public ExchangeException(String userMessage) {
        this(userMessage, null);
    }

    public ExchangeException(String userMessage, Throwable cause) {
        super(StringUtils.defaultIfBlank(userMessage, DEFAULT_MESSAGE), cause);
        this.userMessage = StringUtils.defaultIfBlank(userMessage, DEFAULT_MESSAGE);
    }

    public String getUserMessage() {
        return userMessage;
    }
}

package com.crypto.connector.common.model;

public class ExchangeConnectivityException extends ExchangeException {
    public ExchangeConnectivityException(String userMessage, Throwable cause) {
        super(userMessage, cause);
    }
}

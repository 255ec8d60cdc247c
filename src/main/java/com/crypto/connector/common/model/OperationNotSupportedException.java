package com.crypto.connector.common.model;

public class OperationNotSupportedException extends ExchangeException {
    public OperationNotSupportedException(String userMessage) {
        super(userMessage);
    }
}

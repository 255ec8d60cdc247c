package com.crypto.connector.common.model;

/**
 * The provider answered but rejected the request. Carries the provider's own code and
 * message so callers can surface them unchanged.
 */
public class ExchangeApiException extends ExchangeException {
    private final String provider;
    private final int httpStatus;
    private final String providerCode;
    private final String providerMessage;

    public ExchangeApiException(String provider, int httpStatus, String providerCode, String providerMessage) {
        super(format(provider, httpStatus, providerCode, providerMessage));
        this.provider = provider;
        this.httpStatus = httpStatus;
        this.providerCode = providerCode;
        this.providerMessage = providerMessage;
    }

    public String getProvider() {
        return provider;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getProviderCode() {
        return providerCode;
    }

    public String getProviderMessage() {
        return providerMessage;
    }

    public boolean isRetryable() {
        return httpStatus == 429 || httpStatus >= 500;
    }

    private static String format(String provider, int httpStatus, String code, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(provider).append(" API error");
        if (httpStatus > 0) {
            sb.append(": HTTP ").append(httpStatus);
        }
        if (code != null && !code.isBlank()) {
            sb.append(" code=").append(code);
        }
        if (message != null && !message.isBlank()) {
            sb.append(" msg=").append(message);
        }
        return sb.toString();
    }
}

package com.crypto.connector.common.model;

/**
 * Secret material for one connection. Never printed.
 */
public class Credentials {
    public final String apiKey;
    public final String apiSecret;
    public final String apiPassphrase;

    public Credentials(String apiKey, String apiSecret, String apiPassphrase) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.apiPassphrase = apiPassphrase;
    }

    public static Credentials empty() {
        return new Credentials("", "", null);
    }

    public boolean hasPassphrase() {
        return apiPassphrase != null && !apiPassphrase.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[apiKey=***, apiSecret=***, apiPassphrase=" + (hasPassphrase() ? "***" : "none") + "]";
    }
}

package com.crypto.connector.common.model;

import java.util.List;

public class ConnectionTestResult {
    public final boolean success;
    public final String message;
    public final List<String> warnings;
    public final Credentials credentials;

    public ConnectionTestResult(boolean success, String message, List<String> warnings, Credentials credentials) {
        this.success = success;
        this.message = message;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.credentials = credentials;
    }

    public static ConnectionTestResult failure(String message, List<String> warnings) {
        return new ConnectionTestResult(false, message, warnings, null);
    }
}

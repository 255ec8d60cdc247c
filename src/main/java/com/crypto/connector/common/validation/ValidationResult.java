package com.crypto.connector.common.validation;

import com.crypto.connector.common.model.Credentials;

import java.util.List;

public class ValidationResult {
    public final boolean valid;
    public final String error;
    public final List<String> warnings;
    public final Credentials sanitized;

    private ValidationResult(boolean valid, String error, List<String> warnings, Credentials sanitized) {
        this.valid = valid;
        this.error = error;
        this.warnings = List.copyOf(warnings);
        this.sanitized = sanitized;
    }

    public static ValidationResult valid(List<String> warnings, Credentials sanitized) {
        return new ValidationResult(true, null, warnings, sanitized);
    }

    public static ValidationResult invalid(String error, List<String> warnings, Credentials sanitized) {
        return new ValidationResult(false, error, warnings, sanitized);
    }
}

package com.crypto.connector.common.model;

/**
 * Outcome of one console command. Failures caused by an exchange or by validation are
 * prefixed with {@code FAILED:}; parse errors are shown as-is.
 */
public class CommandResult {
    private static final String FAILED_PREFIX = "FAILED: ";

    public final boolean success;
    public final String message;

    public CommandResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static CommandResult success(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult failure(String message) {
        return new CommandResult(false, message);
    }

    public static CommandResult failed(String reason) {
        return new CommandResult(false, FAILED_PREFIX + reason);
    }
}

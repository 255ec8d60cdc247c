package com.crypto.connector.common.service;

/**
 * Line-oriented input for the console. {@code null} means end of input.
 */
public interface ConsolePrompt {
    String readLine(String prompt);

    /**
     * Reads a value without echoing it.
     */
    String readSecret(String prompt);

    /**
     * Reads lines until one contains {@code terminator} or the first line is a complete
     * single-line value. Used for pasted PEM blocks.
     */
    String readBlock(String prompt, String terminator);
}

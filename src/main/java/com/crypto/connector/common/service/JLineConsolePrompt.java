package com.crypto.connector.common.service;

import com.crypto.connector.common.util.ConsoleOutput;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

@Slf4j
public class JLineConsolePrompt implements ConsolePrompt {
    private static final char MASK = '*';

    private final LineReader reader;
    private final BufferedReader fallback;

    public JLineConsolePrompt() {
        Terminal terminal = buildTerminal();
        this.reader = terminal == null ? null : LineReaderBuilder.builder().terminal(terminal).build();
        this.fallback = terminal == null
                ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
                : null;
    }

    @Override
    public String readLine(String prompt) {
        if (reader == null) {
            ConsoleOutput.printGreen(prompt);
            return fallbackLine();
        }
        try {
            return reader.readLine(ConsoleOutput.green(prompt));
        } catch (EndOfFileException | UserInterruptException e) {
            return null;
        }
    }

    @Override
    public String readSecret(String prompt) {
        if (reader == null) {
            ConsoleOutput.printlnYellow("Warning: input will be visible, no interactive terminal available.");
            ConsoleOutput.printGreen(prompt);
            return fallbackLine();
        }
        try {
            return reader.readLine(ConsoleOutput.green(prompt), MASK);
        } catch (EndOfFileException | UserInterruptException e) {
            return null;
        }
    }

    @Override
    public String readBlock(String prompt, String terminator) {
        String first = readSecret(prompt);
        if (first == null || !first.contains("-----BEGIN") || first.contains(terminator)) {
            return first;
        }
        StringBuilder sb = new StringBuilder(first);
        while (true) {
            String next = reader == null ? fallbackLine() : readMasked();
            if (next == null) {
                break;
            }
            sb.append('\n').append(next);
            if (next.contains(terminator)) {
                break;
            }
        }
        return sb.toString();
    }

    private String readMasked() {
        try {
            return reader.readLine("", MASK);
        } catch (EndOfFileException | UserInterruptException e) {
            return null;
        }
    }

    private String fallbackLine() {
        try {
            return fallback.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Terminal buildTerminal() {
        try {
            return TerminalBuilder.builder()
                    .system(true)
                    .build();
        } catch (IOException | RuntimeException e) {
            LOG.warn("interactive terminal unavailable: {}", e.getMessage());
            return null;
        }
    }
}

package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;

/**
 * Commands without arguments.
 */
public class SimpleCommand implements Command {
    private final CommandType type;
    private final String raw;

    public SimpleCommand(CommandType type, String raw) {
        this.type = type;
        this.raw = raw;
    }

    @Override
    public CommandType type() {
        return type;
    }

    @Override
    public String raw() {
        return raw;
    }
}

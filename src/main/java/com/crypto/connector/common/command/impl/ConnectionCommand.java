package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;

/**
 * A command addressed at one stored connection: test, disconnect or balance.
 */
public class ConnectionCommand implements Command {
    public final String connectionId;
    private final CommandType type;
    private final String raw;

    public ConnectionCommand(CommandType type, String raw, String connectionId) {
        this.type = type;
        this.raw = raw;
        this.connectionId = connectionId;
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

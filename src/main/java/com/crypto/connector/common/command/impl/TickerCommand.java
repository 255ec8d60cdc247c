package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;

public class TickerCommand implements Command {
    public final String connectionId;
    public final String symbol;
    private final String raw;

    public TickerCommand(String raw, String connectionId, String symbol) {
        this.raw = raw;
        this.connectionId = connectionId;
        this.symbol = symbol;
    }

    @Override
    public CommandType type() {
        return CommandType.TICKER;
    }

    @Override
    public String raw() {
        return raw;
    }
}

package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;

public class ConnectCommand implements Command {
    public final String connectionId;
    public final String provider;
    public final String apiFamily;
    public final String env;
    private final String raw;

    public ConnectCommand(String raw, String connectionId, String provider, String apiFamily, String env) {
        this.raw = raw;
        this.connectionId = connectionId;
        this.provider = provider;
        this.apiFamily = apiFamily;
        this.env = env;
    }

    @Override
    public CommandType type() {
        return CommandType.CONNECT;
    }

    @Override
    public String raw() {
        return raw;
    }
}

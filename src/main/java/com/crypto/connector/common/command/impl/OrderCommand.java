package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;
import com.crypto.connector.common.model.OrderRequest;

public class OrderCommand implements Command {
    public final String connectionId;
    public final OrderRequest request;
    private final String raw;

    public OrderCommand(String raw, String connectionId, OrderRequest request) {
        this.raw = raw;
        this.connectionId = connectionId;
        this.request = request;
    }

    @Override
    public CommandType type() {
        return CommandType.ORDER;
    }

    @Override
    public String raw() {
        return raw;
    }
}

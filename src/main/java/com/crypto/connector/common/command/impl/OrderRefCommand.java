package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;

/**
 * Cancel or status lookup of a locally tracked order.
 */
public class OrderRefCommand implements Command {
    public final String orderId;
    private final CommandType type;
    private final String raw;

    public OrderRefCommand(CommandType type, String raw, String orderId) {
        this.type = type;
        this.raw = raw;
        this.orderId = orderId;
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

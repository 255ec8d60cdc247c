package com.crypto.connector.common.command;

public interface Command {
    CommandType type();

    String raw();
}

package com.crypto.connector.common.command;

public enum CommandType {
    PROVIDERS,
    CONNECTIONS,
    CONNECT,
    TEST,
    DISCONNECT,
    BALANCE,
    TICKER,
    ORDER,
    CANCEL,
    STATUS,
    ORDERS,
    HELP,
    EXIT,
    INVALID
}

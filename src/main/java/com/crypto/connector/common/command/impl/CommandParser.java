package com.crypto.connector.common.command.impl;

import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.CommandType;
import com.crypto.connector.common.model.ExchangeException;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderSide;
import com.crypto.connector.common.model.OrderType;

import java.math.BigDecimal;

public class CommandParser {
    public Command parse(String line) {
        if (line == null) {
            return new InvalidCommand("", "Empty command");
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new InvalidCommand(line, "Empty command");
        }
        String[] parts = trimmed.split("\\s+");
        String cmd = parts[0].toLowerCase();

        return switch (cmd) {
            case "providers" -> noArgs(CommandType.PROVIDERS, trimmed, parts, "providers");
            case "connections" -> noArgs(CommandType.CONNECTIONS, trimmed, parts, "connections");
            case "orders" -> noArgs(CommandType.ORDERS, trimmed, parts, "orders");
            case "connect" -> parseConnect(trimmed, parts);
            case "test" -> connection(CommandType.TEST, trimmed, parts, "test <connectionId>");
            case "disconnect" -> connection(CommandType.DISCONNECT, trimmed, parts, "disconnect <connectionId>");
            case "balance" -> connection(CommandType.BALANCE, trimmed, parts, "balance <connectionId>");
            case "ticker" -> parseTicker(trimmed, parts);
            case "order" -> parseOrder(trimmed, parts);
            case "cancel" -> orderRef(CommandType.CANCEL, trimmed, parts, "cancel <orderId>");
            case "status" -> orderRef(CommandType.STATUS, trimmed, parts, "status <orderId>");
            case "help", "?" -> new SimpleCommand(CommandType.HELP, trimmed);
            case "exit", "quit" -> new SimpleCommand(CommandType.EXIT, trimmed);
            default -> new InvalidCommand(trimmed, "Unknown command: " + parts[0]);
        };
    }

    private Command noArgs(CommandType type, String raw, String[] parts, String syntax) {
        if (parts.length != 1) {
            return new InvalidCommand(raw, "Syntax: " + syntax);
        }
        return new SimpleCommand(type, raw);
    }

    private Command connection(CommandType type, String raw, String[] parts, String syntax) {
        if (parts.length != 2) {
            return new InvalidCommand(raw, "Syntax: " + syntax);
        }
        return new ConnectionCommand(type, raw, parts[1]);
    }

    private Command orderRef(CommandType type, String raw, String[] parts, String syntax) {
        if (parts.length != 2) {
            return new InvalidCommand(raw, "Syntax: " + syntax);
        }
        return new OrderRefCommand(type, raw, parts[1]);
    }

    private Command parseConnect(String raw, String[] parts) {
        if (parts.length < 3 || parts.length > 5) {
            return new InvalidCommand(raw, "Syntax: connect <connectionId> <provider> [apiFamily] [prod|sandbox]");
        }
        String family = parts.length > 3 ? parts[3].toLowerCase() : null;
        String env = parts.length > 4 ? parts[4].toLowerCase() : null;
        return new ConnectCommand(raw, parts[1], parts[2].toLowerCase(), family, env);
    }

    private Command parseTicker(String raw, String[] parts) {
        if (parts.length != 3) {
            return new InvalidCommand(raw, "Syntax: ticker <connectionId> <symbol>");
        }
        return new TickerCommand(raw, parts[1], parts[2].toUpperCase());
    }

    private Command parseOrder(String raw, String[] parts) {
        if (parts.length < 6 || parts.length > 8) {
            return new InvalidCommand(raw,
                    "Syntax: order <connectionId> <buy|sell> <type> <symbol> <quantity> [price] [stopPrice]");
        }
        OrderSide side;
        OrderType type;
        try {
            side = OrderSide.from(parts[2]);
            type = OrderType.from(parts[3]);
        } catch (ExchangeException e) {
            return new InvalidCommand(raw, e.getUserMessage());
        }
        BigDecimal quantity = parsePositiveDecimal(parts[5]);
        if (quantity == null) {
            return new InvalidCommand(raw, "Quantity must be a positive number");
        }
        BigDecimal first = null;
        BigDecimal second = null;
        if (parts.length > 6) {
            first = parsePositiveDecimal(parts[6]);
            if (first == null) {
                return new InvalidCommand(raw, "Price must be a positive number");
            }
        }
        if (parts.length > 7) {
            second = parsePositiveDecimal(parts[7]);
            if (second == null) {
                return new InvalidCommand(raw, "Stop price must be a positive number");
            }
        }
        BigDecimal price = type.requiresPrice() ? first : null;
        BigDecimal stopPrice = type.requiresPrice() ? second : first;
        if (!type.requiresStopPrice()) {
            stopPrice = null;
        }
        OrderRequest request = new OrderRequest(parts[4].toUpperCase(), side, type, quantity, price, stopPrice);
        try {
            request.validate();
        } catch (ExchangeException e) {
            return new InvalidCommand(raw, e.getUserMessage());
        }
        return new OrderCommand(raw, parts[1], request);
    }

    private BigDecimal parsePositiveDecimal(String value) {
        try {
            BigDecimal amount = new BigDecimal(value);
            if (amount.signum() <= 0) {
                return null;
            }
            return amount;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

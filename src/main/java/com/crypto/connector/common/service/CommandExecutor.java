package com.crypto.connector.common.service;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.capability.ConnectionTemplate;
import com.crypto.connector.common.capability.ConnectionTemplateCatalog;
import com.crypto.connector.common.command.Command;
import com.crypto.connector.common.command.impl.ConnectCommand;
import com.crypto.connector.common.command.impl.ConnectionCommand;
import com.crypto.connector.common.command.impl.InvalidCommand;
import com.crypto.connector.common.command.impl.OrderCommand;
import com.crypto.connector.common.command.impl.OrderRefCommand;
import com.crypto.connector.common.command.impl.TickerCommand;
import com.crypto.connector.common.exchange.ExchangeClient;
import com.crypto.connector.common.exchange.ExchangeEnv;
import com.crypto.connector.common.exchange.ExchangeProvider;
import com.crypto.connector.common.exchange.impl.ExchangeHttpClient;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.CommandResult;
import com.crypto.connector.common.model.ConnectionRecord;
import com.crypto.connector.common.model.ConnectionRequest;
import com.crypto.connector.common.model.ConnectionStatus;
import com.crypto.connector.common.model.ConnectionTestResult;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.ExchangeException;
import com.crypto.connector.common.model.Ticker;
import com.crypto.connector.common.model.TradingOrder;
import com.crypto.connector.common.util.LogSanitizer;
import com.crypto.connector.common.validation.CredentialJsonParser;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class CommandExecutor {
    private static final String PEM_END = "-----END";

    private final ConnectionTemplateCatalog catalog;
    private final ConnectionService connectionService;
    private final OrderService orderService;
    private final ExchangeHttpClient http;
    private final ConsolePrompt prompt;

    public CommandExecutor(ConnectionTemplateCatalog catalog, ConnectionService connectionService,
                           OrderService orderService, ExchangeHttpClient http, ConsolePrompt prompt) {
        this.catalog = catalog;
        this.connectionService = connectionService;
        this.orderService = orderService;
        this.http = http;
        this.prompt = prompt;
    }

    public CommandResult execute(Command command) {
        String raw = command.raw();
        LOG.info("COMMAND: {}", LogSanitizer.sanitize(raw));
        try {
            return switch (command.type()) {
                case HELP -> CommandResult.success(helpText());
                case INVALID -> CommandResult.failure(((InvalidCommand) command).error);
                case PROVIDERS -> handleProviders();
                case CONNECTIONS -> handleConnections();
                case CONNECT -> handleConnect((ConnectCommand) command);
                case TEST -> handleTest((ConnectionCommand) command);
                case DISCONNECT -> handleDisconnect((ConnectionCommand) command);
                case BALANCE -> handleBalance((ConnectionCommand) command);
                case TICKER -> handleTicker((TickerCommand) command);
                case ORDER -> handleOrder((OrderCommand) command);
                case CANCEL -> handleCancel((OrderRefCommand) command);
                case STATUS -> handleStatus((OrderRefCommand) command);
                case ORDERS -> handleOrders();
                default -> CommandResult.failure("Unsupported command");
            };
        } catch (ExchangeException e) {
            logError(e.getUserMessage());
            return CommandResult.failed(e.getUserMessage());
        } catch (Exception e) {
            logError(e.getMessage());
            return CommandResult.failed(e.getMessage());
        }
    }

    private static void logError(String e) {
        LOG.error("FAILED: {}", LogSanitizer.sanitize(e));
    }

    private static void logSuccess(String message) {
        LOG.info("SUCCESS: {}", message);
    }

    private CommandResult handleProviders() {
        StringBuilder sb = new StringBuilder("Available connections:");
        for (ConnectionTemplate template : catalog.templates()) {
            sb.append("\n  ").append(template.provider.id()).append(' ').append(template.apiFamily)
                    .append(" - ").append(template.label)
                    .append(" envs=").append(template.envs.stream().map(ExchangeEnv::id).toList())
                    .append(" auth=").append(template.authType.id())
                    .append(" ").append(template.capabilities);
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleConnections() {
        List<ConnectionRecord> records = connectionService.list();
        if (records.isEmpty()) {
            return CommandResult.success("No connections.");
        }
        StringBuilder sb = new StringBuilder("Connections:");
        records.forEach(r -> sb.append("\n  ").append(r));
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleConnect(ConnectCommand cmd) {
        ExchangeProvider provider = ExchangeProvider.from(cmd.provider);
        ConnectionTemplate template = catalog.find(provider, cmd.apiFamily)
                .orElseThrow(() -> new CredentialValidationException(
                        "Unsupported provider/family: " + provider.id() + "/" + cmd.apiFamily));
        ExchangeEnv env = cmd.env == null ? template.envs.get(0) : ExchangeEnv.from(cmd.env);

        ConnectionRequest.ConnectionRequestBuilder request = ConnectionRequest.builder()
                .id(cmd.connectionId)
                .label(cmd.connectionId)
                .provider(provider)
                .apiFamily(template.apiFamily)
                .env(env);
        if (template.authType == AuthType.API_KEY || template.authType == AuthType.JWT_SERVICE) {
            readCredentials(template, request);
        }
        ConnectionRecord record = connectionService.connect(request.build());
        String message = record.toString() + (record.message == null ? "" : "\n" + record.message);
        if (record.status == ConnectionStatus.ERROR) {
            return CommandResult.failed(message);
        }
        logSuccess(LogSanitizer.sanitize(message));
        return CommandResult.success(message);
    }

    private void readCredentials(ConnectionTemplate template, ConnectionRequest.ConnectionRequestBuilder request) {
        boolean jwt = template.authType == AuthType.JWT_SERVICE;
        String key = prompt.readLine(jwt ? "Key name or JSON key file: " : "API key: ");
        if (key == null) {
            throw new CredentialValidationException("Input closed");
        }
        request.apiKey(key);
        if (CredentialJsonParser.looksLikeJson(key)) {
            return;
        }
        request.apiSecret(prompt.readBlock(jwt ? "Private key (PEM): " : "API secret: ", PEM_END));
        if (template.requiredFields.contains("apiPassphrase")) {
            request.apiPassphrase(prompt.readSecret("API passphrase: "));
        }
    }

    private CommandResult handleTest(ConnectionCommand cmd) {
        ConnectionTestResult result = connectionService.test(cmd.connectionId);
        StringBuilder sb = new StringBuilder(result.message);
        result.warnings.forEach(w -> sb.append("\n  warning: ").append(w));
        if (!result.success) {
            return CommandResult.failed(sb.toString());
        }
        logSuccess(result.message);
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleDisconnect(ConnectionCommand cmd) {
        if (!connectionService.disconnect(cmd.connectionId)) {
            throw new ExchangeException("Unknown connection: " + cmd.connectionId);
        }
        return CommandResult.success("Disconnected " + cmd.connectionId);
    }

    private CommandResult handleBalance(ConnectionCommand cmd) {
        ExchangeClient client = connectionService.client(cmd.connectionId);
        List<Balance> balances = http.executeWithRetry(client::getBalance);
        if (balances.isEmpty()) {
            return CommandResult.success(client.name() + ": no balances");
        }
        StringBuilder sb = new StringBuilder(client.name()).append(" balances:");
        balances.forEach(b -> sb.append("\n  ").append(b));
        logSuccess(sb.toString());
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleTicker(TickerCommand cmd) {
        ExchangeClient client = connectionService.client(cmd.connectionId);
        Ticker ticker = http.executeWithRetry(() -> client.getTicker(cmd.symbol));
        String message = String.format("%s last=%s change24h=%s%% high=%s low=%s volume=%s",
                ticker.symbol, ticker.lastPrice.toPlainString(), ticker.change24h.toPlainString(),
                ticker.high24h.toPlainString(), ticker.low24h.toPlainString(), ticker.volume24h.toPlainString());
        logSuccess(message);
        return CommandResult.success(message);
    }

    private CommandResult handleOrder(OrderCommand cmd) {
        TradingOrder order = orderService.place(cmd.connectionId, cmd.request);
        String message = "Order placed: " + order;
        logSuccess(message);
        return CommandResult.success(message);
    }

    private CommandResult handleCancel(OrderRefCommand cmd) {
        return CommandResult.success("Order cancelled: " + orderService.cancel(cmd.orderId));
    }

    private CommandResult handleStatus(OrderRefCommand cmd) {
        return CommandResult.success(orderService.refresh(cmd.orderId).toString());
    }

    private CommandResult handleOrders() {
        List<TradingOrder> orders = orderService.list();
        if (orders.isEmpty()) {
            return CommandResult.success("No orders.");
        }
        StringBuilder sb = new StringBuilder("Orders:");
        orders.forEach(o -> sb.append("\n  ").append(o));
        return CommandResult.success(sb.toString());
    }

    private String helpText() {
        return String.join("\n",
                "Commands:",
                "  providers",
                "  connections",
                "  connect <connectionId> <provider> [apiFamily] [prod|sandbox]",
                "  test <connectionId>",
                "  disconnect <connectionId>",
                "  balance <connectionId>",
                "  ticker <connectionId> <symbol>",
                "  order <connectionId> <buy|sell> <type> <symbol> <quantity> [price] [stopPrice]",
                "  cancel <orderId>",
                "  status <orderId>",
                "  orders",
                "  help",
                "  exit"
        );
    }
}

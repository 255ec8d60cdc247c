package com.crypto.connector.exchanges.simulation;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.capability.CapabilityResolver;
import com.crypto.connector.common.exchange.ExchangeClient;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.Capabilities;
import com.crypto.connector.common.model.CredentialValidationException;
import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeConnectionConfig;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderResult;
import com.crypto.connector.common.model.OrderSide;
import com.crypto.connector.common.model.OrderSnapshot;
import com.crypto.connector.common.model.OrderStatus;
import com.crypto.connector.common.model.OrderType;
import com.crypto.connector.common.model.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory paper trading account. Balances come from {@code balance.<CCY>} metadata and
 * reference prices from {@code price.<SYMBOL>}. Market orders fill at the reference price,
 * everything else rests until cancelled.
 */
@Slf4j
public class SimulationClient implements ExchangeClient {
    public static final String BASE_URL = "simulation://paper";
    public static final String BALANCE_PREFIX = "balance.";
    public static final String PRICE_PREFIX = "price.";
    static final BigDecimal DEFAULT_USD = new BigDecimal("10000");

    private final ExchangeConnectionConfig config;
    private final Clock clock;
    private final Map<String, BigDecimal> balances = new TreeMap<>();
    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();
    private final Map<String, SimulatedOrder> orders = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public SimulationClient(ExchangeConnectionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        config.metadata.forEach((key, value) -> {
            if (key.startsWith(BALANCE_PREFIX)) {
                balances.put(key.substring(BALANCE_PREFIX.length()).toUpperCase(Locale.ROOT), amount(key, value));
            } else if (key.startsWith(PRICE_PREFIX)) {
                prices.put(symbolKey(key.substring(PRICE_PREFIX.length())), amount(key, value));
            }
        });
        if (balances.isEmpty()) {
            balances.put("USD", DEFAULT_USD);
        }
    }

    @Override
    public String name() {
        return "simulation";
    }

    @Override
    public String baseUrl() {
        return BASE_URL;
    }

    @Override
    public AuthType authType() {
        return AuthType.NONE;
    }

    @Override
    public synchronized List<Balance> getBalance() {
        List<Balance> result = new ArrayList<>();
        balances.forEach((currency, amount) -> {
            BigDecimal locked = lockedIn(currency).min(amount);
            Balance balance = new Balance(currency, amount.subtract(locked), locked);
            if (!balance.isZero()) {
                result.add(balance);
            }
        });
        return result;
    }

    @Override
    public Ticker getTicker(String symbol) {
        BigDecimal price = referencePrice(symbol);
        return new Ticker(symbolKey(symbol), price, BigDecimal.ZERO, price, price, BigDecimal.ZERO, clock.instant());
    }

    @Override
    public synchronized OrderResult createOrder(OrderRequest request) {
        request.validate();
        String[] pair = splitSymbol(request.symbol);
        if (request.type == OrderType.MARKET) {
            BigDecimal price = referencePrice(request.symbol);
            settle(pair, request.side, request.quantity, price);
            String orderId = "sim-" + sequence.incrementAndGet();
            orders.put(orderId, new SimulatedOrder(request, OrderStatus.FILLED, request.quantity, price));
            LOG.info("simulation filled {} {} {} at {}", request.side.id(), request.quantity, request.symbol, price);
            return new OrderResult(orderId, OrderStatus.FILLED.name(), request.quantity, "filled at " + price);
        }
        BigDecimal limit = request.price != null ? request.price : request.stopPrice;
        if (request.side == OrderSide.BUY) {
            requireFree(pair[1], request.quantity.multiply(limit));
        } else {
            requireFree(pair[0], request.quantity);
        }
        String orderId = "sim-" + sequence.incrementAndGet();
        orders.put(orderId, new SimulatedOrder(request, OrderStatus.OPEN, BigDecimal.ZERO, limit));
        LOG.info("simulation resting {} order {} {}", request.type.id(), orderId, pair[0] + "-" + pair[1]);
        return new OrderResult(orderId, OrderStatus.OPEN.name(), BigDecimal.ZERO, null);
    }

    @Override
    public synchronized OrderResult cancelOrder(String orderId) {
        SimulatedOrder order = require(orderId);
        if (order.status != OrderStatus.OPEN) {
            throw new ExchangeApiException(name(), 400, "ORDER_NOT_OPEN", "Order " + orderId + " is " + order.status.name());
        }
        order.status = OrderStatus.CANCELLED;
        return new OrderResult(orderId, OrderStatus.CANCELLED.name(), BigDecimal.ZERO, null);
    }

    @Override
    public synchronized OrderSnapshot getOrderStatus(String orderId) {
        SimulatedOrder order = require(orderId);
        return new OrderSnapshot(orderId, order.request.symbol, order.request.side, order.status, order.status.name(),
                order.request.quantity, order.filled, order.price);
    }

    @Override
    public boolean testConnection() {
        return true;
    }

    @Override
    public Capabilities capabilities() {
        return CapabilityResolver.resolve(config.provider, config.apiFamily, config.env);
    }

    private void settle(String[] pair, OrderSide side, BigDecimal quantity, BigDecimal price) {
        String base = pair[0];
        String quote = pair[1];
        BigDecimal notional = quantity.multiply(price);
        if (side == OrderSide.BUY) {
            debit(quote, notional);
            credit(base, quantity);
        } else {
            debit(base, quantity);
            credit(quote, notional);
        }
    }

    private void debit(String currency, BigDecimal amount) {
        requireFree(currency, amount);
        balances.put(currency, balances.getOrDefault(currency, BigDecimal.ZERO).subtract(amount));
    }

    // Funds held by resting orders are not spendable.
    private void requireFree(String currency, BigDecimal amount) {
        BigDecimal free = balances.getOrDefault(currency, BigDecimal.ZERO).subtract(lockedIn(currency));
        if (free.compareTo(amount) < 0) {
            throw new ExchangeApiException(name(), 400, "INSUFFICIENT_FUNDS",
                    "Insufficient " + currency + " balance: " + free.max(BigDecimal.ZERO).toPlainString());
        }
    }

    private void credit(String currency, BigDecimal amount) {
        balances.merge(currency, amount, BigDecimal::add);
    }

    private BigDecimal lockedIn(String currency) {
        return orders.values().stream()
                .filter(o -> o.status == OrderStatus.OPEN)
                .filter(o -> currency.equals(splitSymbol(o.request.symbol)[o.request.side == OrderSide.BUY ? 1 : 0]))
                .map(o -> o.request.side == OrderSide.BUY && o.price != null
                        ? o.request.quantity.multiply(o.price)
                        : o.request.quantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal referencePrice(String symbol) {
        BigDecimal price = prices.get(symbolKey(symbol));
        if (price == null) {
            throw new ExchangeApiException(name(), 404, "UNKNOWN_SYMBOL", "No simulated price for " + symbol);
        }
        return price;
    }

    private SimulatedOrder require(String orderId) {
        SimulatedOrder order = StringUtils.isBlank(orderId) ? null : orders.get(orderId);
        if (order == null) {
            throw new ExchangeApiException(name(), 404, "UNKNOWN_ORDER", "Unknown order " + orderId);
        }
        return order;
    }

    static String symbolKey(String symbol) {
        if (StringUtils.isBlank(symbol)) {
            throw new CredentialValidationException("Symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT).replace('/', '-');
    }

    static String[] splitSymbol(String symbol) {
        String key = symbolKey(symbol);
        int idx = key.indexOf('-');
        if (idx <= 0 || idx == key.length() - 1) {
            throw new CredentialValidationException("Simulation symbols must look like BASE-QUOTE: " + symbol);
        }
        return new String[]{key.substring(0, idx), key.substring(idx + 1)};
    }

    private static BigDecimal amount(String key, String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new CredentialValidationException("Simulation setting " + key + " must be a number");
        }
    }

    private static final class SimulatedOrder {
        private final OrderRequest request;
        private final BigDecimal filled;
        private final BigDecimal price;
        private OrderStatus status;

        private SimulatedOrder(OrderRequest request, OrderStatus status, BigDecimal filled, BigDecimal price) {
            this.request = request;
            this.status = status;
            this.filled = filled;
            this.price = price;
        }
    }
}

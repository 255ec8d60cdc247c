package com.crypto.connector.common.service;

import com.crypto.connector.common.exchange.ExchangeClient;
import com.crypto.connector.common.exchange.impl.ExchangeHttpClient;
import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeException;
import com.crypto.connector.common.model.OperationNotSupportedException;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderResult;
import com.crypto.connector.common.model.OrderSnapshot;
import com.crypto.connector.common.model.TradingOrder;
import com.crypto.connector.common.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Places orders through stored connections and tracks them locally.
 */
@Slf4j
public class OrderService {
    private final ConnectionService connections;
    private final ExchangeHttpClient http;
    private final Clock clock;
    private final Map<String, TradingOrder> orders = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public OrderService(ConnectionService connections, ExchangeHttpClient http, Clock clock) {
        this.connections = connections;
        this.http = http;
        this.clock = clock;
    }

    public TradingOrder place(String connectionId, OrderRequest request) {
        request.validate();
        ExchangeClient client = connections.client(connectionId);
        if (!client.capabilities().tradeSpot) {
            throw new OperationNotSupportedException("Trading is not enabled for connection " + connectionId);
        }
        TradingOrder order = new TradingOrder("ord-" + sequence.incrementAndGet(), connectionId, request,
                clock.instant());
        orders.put(order.getId(), order);
        OrderResult result;
        try {
            result = client.createOrder(request);
        } catch (ExchangeException e) {
            order.markRejected(e.getUserMessage(), clock.instant());
            LOG.warn("order {} rejected: {}", order.getId(), LogSanitizer.sanitize(e.getUserMessage()));
            throw e;
        } catch (RuntimeException e) {
            order.markRejected(StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName()),
                    clock.instant());
            LOG.warn("order {} failed: {}", order.getId(), LogSanitizer.sanitize(e.getMessage()), e);
            throw e;
        }
        if (result == null || StringUtils.isBlank(result.orderId)) {
            order.markRejected("Exchange returned no order id", clock.instant());
            throw new ExchangeApiException(client.name(), 200, null, "Exchange returned no order id");
        }
        order.markOpen(result.orderId, clock.instant());
        LOG.info("order {} open on {} as {}", order.getId(), connectionId, result.orderId);
        return order;
    }

    public TradingOrder cancel(String orderId) {
        TradingOrder order = require(orderId);
        if (order.getStatus().isTerminal()) {
            throw new ExchangeException("Order " + orderId + " is already " + order.getStatus().id());
        }
        if (order.getExchangeOrderId() == null) {
            throw new ExchangeException("Order " + orderId + " has not reached the exchange");
        }
        connections.client(order.getConnectionId()).cancelOrder(order.getExchangeOrderId());
        order.markCancelled(clock.instant());
        LOG.info("order {} cancelled", orderId);
        return order;
    }

    /**
     * Pulls the exchange's view of the order and applies it locally. Terminal orders are left alone.
     */
    public TradingOrder refresh(String orderId) {
        TradingOrder order = require(orderId);
        if (order.getStatus().isTerminal() || order.getExchangeOrderId() == null) {
            return order;
        }
        ExchangeClient client = connections.client(order.getConnectionId());
        OrderSnapshot snapshot = http.executeWithRetry(() -> client.getOrderStatus(order.getExchangeOrderId()));
        order.applyRemote(snapshot.status, snapshot.filledQty, clock.instant());
        return order;
    }

    public Optional<TradingOrder> get(String orderId) {
        return orderId == null ? Optional.empty() : Optional.ofNullable(orders.get(orderId));
    }

    public List<TradingOrder> list() {
        List<TradingOrder> all = new ArrayList<>(orders.values());
        all.sort(Comparator.comparing(TradingOrder::getCreatedAt).thenComparing(TradingOrder::getId));
        return all;
    }

    private TradingOrder require(String orderId) {
        return get(orderId).orElseThrow(() -> new ExchangeException("Unknown order: " + orderId));
    }
}

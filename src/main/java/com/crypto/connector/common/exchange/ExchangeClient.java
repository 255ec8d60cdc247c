package com.crypto.connector.common.exchange;

import com.crypto.connector.common.auth.AuthType;
import com.crypto.connector.common.model.Balance;
import com.crypto.connector.common.model.Capabilities;
import com.crypto.connector.common.model.OrderRequest;
import com.crypto.connector.common.model.OrderResult;
import com.crypto.connector.common.model.OrderSnapshot;
import com.crypto.connector.common.model.Ticker;

import java.util.List;

public interface ExchangeClient {
    String name();

    String baseUrl();

    AuthType authType();

    /**
     * Non-zero holdings only; an empty account yields an empty list.
     */
    List<Balance> getBalance();

    Ticker getTicker(String symbol);

    OrderResult createOrder(OrderRequest request);

    OrderResult cancelOrder(String orderId);

    OrderSnapshot getOrderStatus(String orderId);

    /**
     * Cheap read-only probe. Never throws; any failure is reported as {@code false}.
     */
    boolean testConnection();

    Capabilities capabilities();
}

package com.crypto.connector.exchanges.coinbase;

import com.crypto.connector.common.exchange.CoinbaseApiFamily;

/**
 * REST dialect spoken by a Coinbase connection.
 */
public enum CoinbaseMode {
    /** Exchange (formerly Pro) API with HMAC headers. */
    EXCHANGE,
    /** Advanced Trade brokerage API under /api/v3/brokerage. */
    ADVANCED_TRADE,
    /** Retail v2 accounts and spot prices only. */
    BASIC;

    public static CoinbaseMode forFamily(CoinbaseApiFamily family) {
        return switch (family) {
            case EXCHANGE -> EXCHANGE;
            case ADVANCED_TRADE -> ADVANCED_TRADE;
            case APP, SERVER_WALLET, TRADE_API -> BASIC;
        };
    }
}

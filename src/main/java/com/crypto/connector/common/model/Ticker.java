package com.crypto.connector.common.model;

import java.math.BigDecimal;
import java.time.Instant;

public class Ticker {
    public final String symbol;
    public final BigDecimal lastPrice;
    public final BigDecimal change24h;
    public final BigDecimal high24h;
    public final BigDecimal low24h;
    public final BigDecimal volume24h;
    public final Instant timestamp;

    public Ticker(String symbol, BigDecimal lastPrice, BigDecimal change24h, BigDecimal high24h,
                  BigDecimal low24h, BigDecimal volume24h, Instant timestamp) {
        this.symbol = symbol;
        this.lastPrice = lastPrice;
        this.change24h = change24h;
        this.high24h = high24h;
        this.low24h = low24h;
        this.volume24h = volume24h;
        this.timestamp = timestamp;
    }
}

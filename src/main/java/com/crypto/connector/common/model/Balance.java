package com.crypto.connector.common.model;

import java.math.BigDecimal;

public class Balance {
    public final String currency;
    public final BigDecimal available;
    public final BigDecimal locked;
    public final BigDecimal total;

    public Balance(String currency, BigDecimal available, BigDecimal locked) {
        this.currency = currency;
        this.available = available == null ? BigDecimal.ZERO : available;
        this.locked = locked == null ? BigDecimal.ZERO : locked;
        this.total = this.available.add(this.locked);
    }

    public boolean isZero() {
        return total.signum() == 0;
    }

    @Override
    public String toString() {
        return currency + " available=" + available.toPlainString()
                + " locked=" + locked.toPlainString()
                + " total=" + total.toPlainString();
    }
}

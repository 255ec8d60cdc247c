package com.crypto.connector.common.model;

public class Capabilities {
    public final boolean read;
    public final boolean tradeSpot;
    public final boolean tradeDerivatives;
    public final boolean withdraw;
    public final boolean onchain;

    public Capabilities(boolean read, boolean tradeSpot, boolean tradeDerivatives, boolean withdraw, boolean onchain) {
        this.read = read;
        this.tradeSpot = tradeSpot;
        this.tradeDerivatives = tradeDerivatives;
        this.withdraw = withdraw;
        this.onchain = onchain;
    }

    public static Capabilities readOnly() {
        return new Capabilities(true, false, false, false, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Capabilities other)) {
            return false;
        }
        return read == other.read && tradeSpot == other.tradeSpot && tradeDerivatives == other.tradeDerivatives
                && withdraw == other.withdraw && onchain == other.onchain;
    }

    @Override
    public int hashCode() {
        int result = Boolean.hashCode(read);
        result = 31 * result + Boolean.hashCode(tradeSpot);
        result = 31 * result + Boolean.hashCode(tradeDerivatives);
        result = 31 * result + Boolean.hashCode(withdraw);
        return 31 * result + Boolean.hashCode(onchain);
    }

    @Override
    public String toString() {
        return "read=" + read + " tradeSpot=" + tradeSpot + " tradeDerivatives=" + tradeDerivatives
                + " withdraw=" + withdraw + " onchain=" + onchain;
    }
}

package com.limitbook.engine.core.model;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * +1 for BUY, -1 for SELL. Multiplied with a quantity it gives the position delta.
     */
    public long sign() {
        return this == BUY ? 1 : -1;
    }
}

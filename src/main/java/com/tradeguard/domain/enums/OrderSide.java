package com.tradeguard.domain.enums;

/**
 * Direction of an order. {@link #opposite()} gives the side that reduces a position opened on this side.
 */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL; used to turn unsigned fill quantities into signed position deltas. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}

package com.tradeguard.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of an order as tracked by {@link com.tradeguard.oms.OrderTracker}.
 *
 * <pre>
 * SUBMITTED -&gt; OPEN | REJECTED
 * OPEN      -&gt; PARTIALLY_FILLED | FILLED | CANCELLED | EXPIRED | REJECTED (no fills yet)
 * PARTIALLY_FILLED -&gt; PARTIALLY_FILLED | FILLED | CANCELLED | EXPIRED
 * </pre>
 *
 * <p>FILLED, CANCELLED, REJECTED and EXPIRED are terminal. Any transition attempted
 * from a terminal state fails loudly.
 */
public enum OrderState {
    SUBMITTED,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    private static final Set<OrderState> TERMINAL = EnumSet.of(FILLED, CANCELLED, REJECTED, EXPIRED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** True for states in which the venue may still produce fills. */
    public boolean isWorking() {
        return this == OPEN || this == PARTIALLY_FILLED;
    }
}

package com.tradeguard.event;

/**
 * Kind of order state change carried by an {@link OrderEvent}.
 */
public enum OrderEventType {
    PLACED,
    ACKNOWLEDGED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED,

    /** The order record was overwritten from the venue's view during reconciliation. */
    RECONCILED
}

package com.tradeguard.event;

/**
 * Severity of a {@link RiskEvent}. CRITICAL is reserved for conditions that stop trading
 * on their own (kill switch, failed reconciliation).
 */
public enum RiskLevel {

    /** Routine: a rejection, a daily reset, an operator action. */
    INFO,

    /** Trading is restricted but not halted. */
    WARNING,

    /** Trading halted automatically. */
    CRITICAL
}

package com.tradeguard.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A decision failed one or more pre-trade policies. */
    DECISION_REJECTED,

    /** Drawdown crossed the soft limit; only risk-reducing decisions pass. */
    DRAWDOWN_SOFT_LIMIT,

    /** Kill switch activated. Stays active until cleared manually. */
    KILL_SWITCH_TRIGGERED,

    /** Kill switch cleared by an operator. */
    KILL_SWITCH_CLEARED,

    CIRCUIT_BREAKER_ENGAGED,
    CIRCUIT_BREAKER_RELEASED,

    /** Daily counters rolled over at the UTC day boundary. */
    DAILY_RESET,

    /** Local order state could not be rebuilt from the venue. */
    RECONCILIATION_FAILED
}

package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchReason;
import lombok.Builder;
import lombok.Getter;

/**
 * A single reason a decision was rejected.
 *
 * <p>The code is machine-readable and stable ({@code max_position_size},
 * {@code kill_switch_active}, ...); the message is for humans. A violation may carry an
 * escalation, in which case the risk manager also activates the kill switch with that reason.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String MAX_POSITION_SIZE = "max_position_size";
    public static final String MAX_LEVERAGE = "max_leverage";
    public static final String DAILY_DRAWDOWN_SOFT_LIMIT = "daily_drawdown_soft_limit";
    public static final String MAX_DD_EXCEEDED = "max_dd_exceeded";
    public static final String INSUFFICIENT_MARGIN = "insufficient_margin";
    public static final String CIRCUIT_BREAKER_ENGAGED = "circuit_breaker_engaged";
    public static final String KILL_SWITCH_ACTIVE = "kill_switch_active";
    public static final String NON_POSITIVE_EQUITY = "non_positive_equity";
    public static final String NO_POSITION_TO_EXIT = "no_position_to_exit";
    public static final String NO_MARK_PRICE = "no_mark_price";
    public static final String ZERO_QUANTITY = "zero_quantity";
    public static final String VENUE_ERROR = "venue_error";

    private final String code;

    private final String message;

    /** Kill switch reason this violation escalates to, or null. */
    private final KillSwitchReason escalation;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}

package com.tradeguard.exception;

import com.tradeguard.domain.enums.OrderState;

/**
 * Raised for any transition the order state machine does not allow, including every
 * attempt to leave a terminal state.
 */
public class InvalidTransitionException extends OrderTrackingException {

    private final OrderState from;

    public InvalidTransitionException(String clientId, OrderState from, String attempted) {
        super(
                ErrorCode.INVALID_TRANSITION,
                clientId,
                "Cannot " + attempted + " order " + clientId + " in state " + from);
        this.from = from;
    }

    public OrderState getFrom() {
        return from;
    }
}

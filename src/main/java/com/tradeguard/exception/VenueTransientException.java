package com.tradeguard.exception;

/**
 * Network-class venue failure: timeout, rate limit, 5xx. Idempotent calls are retried on it;
 * order placement never is.
 */
public class VenueTransientException extends VenueException {

    public VenueTransientException(String message) {
        super(ErrorCode.VENUE_UNAVAILABLE, message, null);
    }

    public VenueTransientException(String message, Throwable cause) {
        super(ErrorCode.VENUE_UNAVAILABLE, message, cause);
    }
}

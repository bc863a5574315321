package com.tradeguard.exception;

/**
 * The venue refused a request or answered with an error that retrying will not fix
 * (bad parameters, insufficient balance, unknown symbol).
 */
public class VenueException extends BaseException {

    public VenueException(String message) {
        super(ErrorCode.VENUE_ERROR, message);
    }

    public VenueException(String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, cause);
    }

    protected VenueException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}

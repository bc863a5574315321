package com.tradeguard.exception;

public class UnknownOrderException extends OrderTrackingException {

    public UnknownOrderException(String clientId) {
        super(ErrorCode.UNKNOWN_ORDER, clientId, "No order tracked for client id: " + clientId);
    }
}

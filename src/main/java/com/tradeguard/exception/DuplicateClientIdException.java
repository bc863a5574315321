package com.tradeguard.exception;

public class DuplicateClientIdException extends OrderTrackingException {

    public DuplicateClientIdException(String clientId) {
        super(ErrorCode.DUPLICATE_CLIENT_ID, clientId, "Client order id already registered: " + clientId);
    }
}

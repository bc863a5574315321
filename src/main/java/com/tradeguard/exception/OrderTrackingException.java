package com.tradeguard.exception;

import java.util.Map;

/**
 * Local order state disagrees with what the caller (or the venue) asserts. Any of these means
 * local state can no longer be trusted and the account should be reconciled against the venue.
 */
public abstract class OrderTrackingException extends BaseException {

    private final String clientId;

    protected OrderTrackingException(ErrorCode errorCode, String clientId, String message) {
        super(errorCode, message, Map.of("clientId", clientId));
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }
}

package com.tradeguard.venue;

public enum VenueEventType {
    ACKNOWLEDGED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED,
    CONNECTION_UP,
    CONNECTION_DOWN,
    ERROR;

    public boolean isOrderEvent() {
        return this != CONNECTION_UP && this != CONNECTION_DOWN && this != ERROR;
    }
}

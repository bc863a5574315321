package com.tradeguard.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}

package com.tradeguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DUPLICATE_CLIENT_ID("DUPLICATE_CLIENT_ID", 409),
    INVALID_TRANSITION("INVALID_TRANSITION", 409),
    FILL_EXCEEDS_QUANTITY("FILL_EXCEEDS_QUANTITY", 409),
    UNKNOWN_ORDER("UNKNOWN_ORDER", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    VENUE_ERROR("VENUE_ERROR", 502),
    VENUE_UNAVAILABLE("VENUE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}

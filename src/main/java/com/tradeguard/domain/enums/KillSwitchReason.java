package com.tradeguard.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why the kill switch was activated. The code is the stable machine-readable form used in
 * logs, events and the REST status payload.
 */
@Getter
@RequiredArgsConstructor
public enum KillSwitchReason {
    MAX_DD_EXCEEDED("max_dd_exceeded"),
    WS_STALE("ws_stale"),
    ERROR_RATE("error_rate_exceeded"),
    MANUAL("manual");

    private final String code;
}

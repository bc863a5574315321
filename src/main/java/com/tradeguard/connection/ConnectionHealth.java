package com.tradeguard.connection;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time telemetry of the venue stream. Recomputed on every
 * {@link ConnectionMonitor#snapshot()} call; nothing here is persisted.
 */
@Value
@Builder
public class ConnectionHealth {

    /** Null if no update has been received since start. */
    Instant lastUpdateAt;

    /** Errors inside the error window since the last successful update. */
    int consecutiveErrorsInWindow;

    int reconnectCountInWindow;

    /** 95th percentile stream latency over the latency window, 0 when there are no samples. */
    long latencyP95Ms;

    /** Time since the last update, or since the monitor started if none arrived yet. */
    Duration silentFor;

    boolean stale;

    Instant capturedAt;
}

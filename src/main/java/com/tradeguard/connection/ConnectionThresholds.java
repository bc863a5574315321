package com.tradeguard.connection;

import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Windows and limits for connection health. Built by {@code ConnectionConfig} from
 * {@code tradeguard.connection.*} properties.
 */
@Data
@Builder
public class ConnectionThresholds {

    /** Silence longer than this marks the stream stale. */
    @Builder.Default
    private Duration staleThreshold = Duration.ofSeconds(60);

    @Builder.Default
    private Duration errorWindow = Duration.ofMinutes(1);

    @Builder.Default
    private Duration reconnectWindow = Duration.ofMinutes(60);

    @Builder.Default
    private Duration latencyWindow = Duration.ofMinutes(1);

    @Builder.Default
    private int latencySampleLimit = 1000;
}

package com.tradeguard.config;

import com.tradeguard.connection.ConnectionThresholds;
import com.tradeguard.connection.ReconnectBackoff;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connection health windows and the shared {@link Clock}.
 *
 * <p>Properties prefix: {@code tradeguard.connection.*}
 */
@Configuration
public class ConnectionConfig {

    @Bean
    public ConnectionThresholds connectionThresholds(
            @Value("${tradeguard.connection.stale-threshold:60s}") Duration staleThreshold,
            @Value("${tradeguard.connection.error-window:1m}") Duration errorWindow,
            @Value("${tradeguard.connection.reconnect-window:60m}") Duration reconnectWindow,
            @Value("${tradeguard.connection.latency-window:1m}") Duration latencyWindow,
            @Value("${tradeguard.connection.latency-sample-limit:1000}") int latencySampleLimit) {
        return ConnectionThresholds.builder()
                .staleThreshold(staleThreshold)
                .errorWindow(errorWindow)
                .reconnectWindow(reconnectWindow)
                .latencyWindow(latencyWindow)
                .latencySampleLimit(latencySampleLimit)
                .build();
    }

    @Bean
    public ReconnectBackoff reconnectBackoff(
            @Value("${tradeguard.connection.reconnect.initial-delay:1s}") Duration initialDelay,
            @Value("${tradeguard.connection.reconnect.max-delay:60s}") Duration maxDelay,
            @Value("${tradeguard.connection.reconnect.multiplier:2.0}") double multiplier,
            @Value("${tradeguard.connection.reconnect.jitter:0.2}") double jitter) {
        return new ReconnectBackoff(initialDelay, maxDelay, multiplier, jitter);
    }

    /** All time-dependent components read this clock, so tests can substitute a controllable one. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

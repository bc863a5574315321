package com.tradeguard.connection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rolling telemetry over the venue event stream.
 *
 * <p>The venue adapter (through the event processor) reports every update, error and reconnect.
 * {@link #snapshot()} derives health on demand:
 * <ul>
 *   <li>staleness depends only on wall-clock time since the last update, so a silent stream is
 *       flagged even when it reports no errors</li>
 *   <li>errors count within a trailing window and reset on the next successful update</li>
 *   <li>reconnects count within a separate, longer trailing window</li>
 *   <li>latency p95 uses the nearest-rank method over samples inside the latency window</li>
 * </ul>
 *
 * <p>The monitor depends on nothing else in the core; the risk manager consumes its snapshots.
 */
@Component
public class ConnectionMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

    private final Clock clock;
    private final ConnectionThresholds thresholds;
    private final Instant startedAt;

    private Instant lastUpdateAt;
    private final Deque<Instant> errors = new ArrayDeque<>();
    private final Deque<Instant> reconnects = new ArrayDeque<>();
    private final Deque<LatencySample> latencies = new ArrayDeque<>();

    private long totalUpdates;
    private long totalErrors;
    private long totalReconnects;

    public ConnectionMonitor(Clock clock, ConnectionThresholds thresholds) {
        this.clock = clock;
        this.thresholds = thresholds;
        this.startedAt = clock.instant();
    }

    public synchronized void recordUpdate() {
        lastUpdateAt = clock.instant();
        errors.clear();
        totalUpdates++;
    }

    /** Records an update together with its end-to-end latency (venue timestamp to receipt). */
    public synchronized void recordUpdate(Duration latency) {
        recordUpdate();
        long millis = Math.max(0L, latency.toMillis());
        latencies.addLast(new LatencySample(lastUpdateAt, millis));
        while (latencies.size() > thresholds.getLatencySampleLimit()) {
            latencies.removeFirst();
        }
    }

    public synchronized void recordError() {
        errors.addLast(clock.instant());
        totalErrors++;
        log.debug("Venue stream error recorded ({} in window)", errors.size());
    }

    public synchronized void recordReconnect() {
        reconnects.addLast(clock.instant());
        totalReconnects++;
        log.info("Venue stream reconnected ({} reconnects total)", totalReconnects);
    }

    public synchronized ConnectionHealth snapshot() {
        Instant now = clock.instant();
        prune(errors, now.minus(thresholds.getErrorWindow()));
        prune(reconnects, now.minus(thresholds.getReconnectWindow()));
        pruneLatencies(now.minus(thresholds.getLatencyWindow()));

        Instant reference = lastUpdateAt != null ? lastUpdateAt : startedAt;
        Duration silentFor = Duration.between(reference, now);

        return ConnectionHealth.builder()
                .lastUpdateAt(lastUpdateAt)
                .consecutiveErrorsInWindow(errors.size())
                .reconnectCountInWindow(reconnects.size())
                .latencyP95Ms(p95())
                .silentFor(silentFor)
                .stale(silentFor.compareTo(thresholds.getStaleThreshold()) > 0)
                .capturedAt(now)
                .build();
    }

    public synchronized long getTotalUpdates() {
        return totalUpdates;
    }

    public synchronized long getTotalErrors() {
        return totalErrors;
    }

    public ConnectionThresholds getThresholds() {
        return thresholds;
    }

    private long p95() {
        if (latencies.isEmpty()) {
            return 0L;
        }
        long[] values = latencies.stream().mapToLong(LatencySample::millis).sorted().toArray();
        int rank = (int) Math.ceil(0.95 * values.length);
        return values[Math.max(0, rank - 1)];
    }

    private static void prune(Deque<Instant> window, Instant cutoff) {
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }

    private void pruneLatencies(Instant cutoff) {
        Iterator<LatencySample> it = latencies.iterator();
        while (it.hasNext() && it.next().at().isBefore(cutoff)) {
            it.remove();
        }
    }

    private record LatencySample(Instant at, long millis) {}
}

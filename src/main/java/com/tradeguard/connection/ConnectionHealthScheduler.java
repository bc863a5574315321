package com.tradeguard.connection;

import com.tradeguard.exception.VenueException;
import com.tradeguard.execution.AccountLock;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.risk.RiskManager;
import com.tradeguard.venue.VenueClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * The periodic health tick. Runs whether or not any decision is pending, so a silent venue stream
 * trips the kill switch even when the strategy is idle.
 *
 * <p>Each tick, under the account lock:
 * <ol>
 *   <li>Feeds the connection snapshot to {@link RiskManager#evaluateConnectionHealth}</li>
 *   <li>Rolls the trading day at UTC midnight and archives old terminal orders when it does</li>
 *   <li>Releases automatic circuit breakers whose cooldown elapsed</li>
 *   <li>While the stream is stale, asks the venue adapter to reconnect, spaced by {@link ReconnectBackoff}</li>
 * </ol>
 */
@Component
public class ConnectionHealthScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHealthScheduler.class);

    private final ConnectionMonitor connectionMonitor;
    private final RiskManager riskManager;
    private final OrderTracker orderTracker;
    private final VenueClient venueClient;
    private final AccountLock accountLock;
    private final ReconnectBackoff reconnectBackoff;
    private final Duration archiveAfter;
    private final Clock clock;

    private Instant nextReconnectAt;

    public ConnectionHealthScheduler(
            ConnectionMonitor connectionMonitor,
            RiskManager riskManager,
            OrderTracker orderTracker,
            VenueClient venueClient,
            AccountLock accountLock,
            ReconnectBackoff reconnectBackoff,
            @Value("${tradeguard.oms.archive-after:24h}") Duration archiveAfter,
            Clock clock) {
        this.connectionMonitor = connectionMonitor;
        this.riskManager = riskManager;
        this.orderTracker = orderTracker;
        this.venueClient = venueClient;
        this.accountLock = accountLock;
        this.reconnectBackoff = reconnectBackoff;
        this.archiveAfter = archiveAfter;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${tradeguard.connection.health-tick-ms:1000}")
    public void tick() {
        accountLock.run(this::tickLocked);
    }

    private void tickLocked() {
        ConnectionHealth health = connectionMonitor.snapshot();
        riskManager.evaluateConnectionHealth(health);

        if (riskManager.rollDayIfNeeded()) {
            orderTracker.archiveTerminal(clock.instant().minus(archiveAfter));
        }
        riskManager.expireCircuitBreakers();

        if (health.isStale()) {
            maybeReconnect(health);
        } else if (nextReconnectAt != null) {
            log.info("Venue stream healthy again after {} reconnect attempts", reconnectBackoff.getAttemptCount());
            reconnectBackoff.reset();
            nextReconnectAt = null;
        }
    }

    private void maybeReconnect(ConnectionHealth health) {
        Instant now = clock.instant();
        if (nextReconnectAt != null && now.isBefore(nextReconnectAt)) {
            return;
        }
        Duration delay = reconnectBackoff.nextDelay();
        nextReconnectAt = now.plus(delay);
        log.warn(
                "Venue stream silent for {}s; reconnect attempt {} (next no sooner than {}ms)",
                health.getSilentFor().toSeconds(),
                reconnectBackoff.getAttemptCount(),
                delay.toMillis());
        try {
            venueClient.reconnect();
        } catch (VenueException e) {
            log.warn("Reconnect request failed: {}", e.getMessage());
            connectionMonitor.recordError();
        }
    }
}

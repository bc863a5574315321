package com.tradeguard.execution;

import com.tradeguard.connection.ConnectionMonitor;
import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.exception.OrderTrackingException;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.venue.VenueEvent;
import com.tradeguard.venue.VenueEventChannel;
import com.tradeguard.venue.VenueEventType;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single writer for venue events. A dedicated thread drains the {@link VenueEventChannel} and applies
 * each event under the {@link AccountLock}, in delivery order.
 *
 * <p>Every event counts as an update for the {@link ConnectionMonitor}. Order events are matched by
 * client id, then venue id, then against indeterminate placements. An event that matches nothing, or
 * that the tracker refuses, means local state is out of line with the venue and triggers a full
 * reconciliation.
 */
@Component
public class VenueEventProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(VenueEventProcessor.class);

    private static final long POLL_TIMEOUT_MS = 250;

    private final VenueEventChannel venueEventChannel;
    private final OrderTracker orderTracker;
    private final OrderStateApplier orderStateApplier;
    private final IndeterminateOrders indeterminateOrders;
    private final ReconciliationService reconciliationService;
    private final ConnectionMonitor connectionMonitor;
    private final AccountLock accountLock;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    public VenueEventProcessor(
            VenueEventChannel venueEventChannel,
            OrderTracker orderTracker,
            OrderStateApplier orderStateApplier,
            IndeterminateOrders indeterminateOrders,
            ReconciliationService reconciliationService,
            ConnectionMonitor connectionMonitor,
            AccountLock accountLock,
            Clock clock) {
        this.venueEventChannel = venueEventChannel;
        this.orderTracker = orderTracker;
        this.orderStateApplier = orderStateApplier;
        this.indeterminateOrders = indeterminateOrders;
        this.reconciliationService = reconciliationService;
        this.connectionMonitor = connectionMonitor;
        this.accountLock = accountLock;
        this.clock = clock;
    }

    // ========================
    // LIFECYCLE
    // ========================

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "venue-event-processor");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("VenueEventProcessor started (channel capacity {})", venueEventChannel.getCapacity());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consumerThread != null) {
                consumerThread.interrupt();
            }
            log.info("VenueEventProcessor stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // before anything that places orders, so acknowledgements are never left unread
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void processLoop() {
        boolean interrupted = false;
        while (running.get()) {
            try {
                VenueEvent event = venueEventChannel.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    processSafely(event);
                }
            } catch (InterruptedException e) {
                interrupted = true;
                if (running.compareAndSet(true, false)) {
                    // only stop() interrupts this thread; anyone else asking is treated as a stop request
                    log.error("VenueEventProcessor interrupted while running; stopping. The stream will go stale.");
                } else {
                    log.info("VenueEventProcessor interrupted during shutdown");
                }
            }
        }
        drainRemaining();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void drainRemaining() {
        int drained = 0;
        VenueEvent remaining;
        while ((remaining = venueEventChannel.pollNow()) != null) {
            processSafely(remaining);
            drained++;
        }
        if (drained > 0) {
            log.info("Drained {} remaining venue events during shutdown", drained);
        }
    }

    private void processSafely(VenueEvent event) {
        try {
            process(event);
        } catch (RuntimeException e) {
            // keep the single writer alive; the monitor counts it towards the error rate
            log.error("Failed to apply venue event {}", event, e);
            connectionMonitor.recordError();
        }
    }

    // ========================
    // EVENT APPLICATION
    // ========================

    /** Applies one venue event. Public so tests and synchronous adapters can bypass the channel. */
    public void process(VenueEvent event) {
        accountLock.run(() -> applyLocked(event));
    }

    private void applyLocked(VenueEvent event) {
        switch (event.getType()) {
            case CONNECTION_UP -> {
                connectionMonitor.recordReconnect();
                connectionMonitor.recordUpdate();
                log.info("Venue stream connected");
                if (hasLiveExposure()) {
                    reconciliationService.reconcile("reconnect");
                }
                return;
            }
            case CONNECTION_DOWN, ERROR -> {
                connectionMonitor.recordError();
                log.warn("Venue stream {}: {}", event.getType(), event.getReason());
                return;
            }
            default -> recordUpdate(event);
        }

        try {
            applyOrderEvent(event);
        } catch (OrderTrackingException e) {
            log.error("Venue event {} contradicts local state for {}; reconciling", event.getType(), e.getClientId(), e);
            reconciliationService.reconcile("invariant violation on " + e.getClientId());
        }
    }

    private void recordUpdate(VenueEvent event) {
        if (event.getVenueTimestamp() != null) {
            Duration latency = Duration.between(event.getVenueTimestamp(), clock.instant());
            connectionMonitor.recordUpdate(latency.isNegative() ? Duration.ZERO : latency);
        } else {
            connectionMonitor.recordUpdate();
        }
    }

    private void applyOrderEvent(VenueEvent event) {
        Optional<Order> tracked = resolve(event);
        if (tracked.isEmpty()) {
            Optional<OrderIntent> pending = Optional.ofNullable(event.getClientId())
                    .flatMap(indeterminateOrders::remove);
            if (pending.isEmpty()) {
                log.error(
                        "Venue event {} for unknown order (clientId={}, venueId={}); reconciling",
                        event.getType(),
                        event.getClientId(),
                        event.getVenueId());
                reconciliationService.reconcile("unknown order " + event.getClientId());
                return;
            }
            registerIndeterminate(event, pending.get());
            return;
        }

        String clientId = tracked.get().getClientId();
        switch (event.getType()) {
            case ACKNOWLEDGED -> orderStateApplier.acknowledge(clientId, event.getVenueId());
            case FILLED -> orderStateApplier.applyFill(clientId, event.getFill());
            case CANCELLED -> orderStateApplier.cancel(clientId);
            case REJECTED -> orderStateApplier.reject(clientId, event.getReason());
            case EXPIRED -> orderStateApplier.expire(clientId);
            default -> log.debug("Ignoring venue event {}", event.getType());
        }
    }

    private Optional<Order> resolve(VenueEvent event) {
        Optional<Order> order = Optional.empty();
        if (event.getClientId() != null) {
            order = orderTracker.get(event.getClientId());
        }
        if (order.isEmpty() && event.getVenueId() != null) {
            order = orderTracker.findByVenueId(event.getVenueId());
        }
        return order;
    }

    /** The venue turned out to have an order whose placement timed out: register it, then apply the event. */
    private void registerIndeterminate(VenueEvent event, OrderIntent intent) {
        String clientId = event.getClientId();
        if (event.getVenueId() == null && event.getType() != VenueEventType.REJECTED) {
            indeterminateOrders.add(clientId, intent);
            reconciliationService.reconcile("indeterminate order " + clientId + " without venue id");
            return;
        }
        log.info("Indeterminate order {} confirmed by venue event {}", clientId, event.getType());
        switch (event.getType()) {
            case REJECTED -> orderStateApplier.registerRejected(clientId, intent, event.getReason());
            case ACKNOWLEDGED -> orderStateApplier.registerAcknowledged(
                    clientId, intent, ExecutionMode.LIVE, event.getVenueId());
            default -> {
                orderStateApplier.registerAcknowledged(clientId, intent, ExecutionMode.LIVE, event.getVenueId());
                applyOrderEvent(event);
            }
        }
    }

    private boolean hasLiveExposure() {
        return !indeterminateOrders.clientIds().isEmpty()
                || orderTracker.openOrders().stream().anyMatch(o -> o.getMode() == ExecutionMode.LIVE);
    }
}

package com.tradeguard.execution;

import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.event.RiskLevel;
import com.tradeguard.exception.OrderTrackingException;
import com.tradeguard.exception.VenueException;
import com.tradeguard.observability.ExecutionMetrics;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.risk.CircuitBreakerState;
import com.tradeguard.risk.RiskManager;
import com.tradeguard.venue.VenueOrderStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings the tracker back in line with the venue after local state can no longer be trusted: an event
 * for an unknown order, an impossible transition, or a reconnect.
 *
 * <p>New decisions are blocked for the duration by an automatic global circuit breaker with reason
 * {@code reconciliation_pending}. It has no cooldown. On success only that breaker is released, so a
 * {@code venue_errors} or {@code reconnect_storm} halt engaged alongside it stays in force. On failure
 * it stays until a later reconciliation succeeds or an operator releases it, and a CRITICAL
 * {@code RECONCILIATION_FAILED} risk event is raised.
 *
 * <p>Per order, the venue's view wins. Fill quantity the venue reports beyond what the tracker has is
 * applied as one catch-up fill at the implied average price so the position ledger and daily PnL stay
 * consistent. Orders working locally but unknown to the venue are expired.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    static final String PENDING_REASON = "reconciliation_pending";

    private final OrderTracker orderTracker;
    private final OrderStateApplier orderStateApplier;
    private final RetryingVenueOperations retryingVenueOperations;
    private final IndeterminateOrders indeterminateOrders;
    private final RiskManager riskManager;
    private final AccountLock accountLock;
    private final EventPublisherHelper eventPublisherHelper;
    private final ExecutionMetrics executionMetrics;
    private final ExecutionSettings executionSettings;
    private final Clock clock;

    public ReconciliationService(
            OrderTracker orderTracker,
            OrderStateApplier orderStateApplier,
            RetryingVenueOperations retryingVenueOperations,
            IndeterminateOrders indeterminateOrders,
            RiskManager riskManager,
            AccountLock accountLock,
            EventPublisherHelper eventPublisherHelper,
            ExecutionMetrics executionMetrics,
            ExecutionSettings executionSettings,
            Clock clock) {
        this.orderTracker = orderTracker;
        this.orderStateApplier = orderStateApplier;
        this.retryingVenueOperations = retryingVenueOperations;
        this.indeterminateOrders = indeterminateOrders;
        this.riskManager = riskManager;
        this.accountLock = accountLock;
        this.eventPublisherHelper = eventPublisherHelper;
        this.executionMetrics = executionMetrics;
        this.executionSettings = executionSettings;
        this.clock = clock;
    }

    /**
     * Runs a full reconciliation against the venue.
     *
     * @param trigger what prompted it, for the log and the failure event
     * @return true if the tracker now matches the venue
     */
    public boolean reconcile(String trigger) {
        return accountLock.call(() -> reconcileLocked(trigger));
    }

    private boolean reconcileLocked(String trigger) {
        log.warn("Reconciliation started ({})", trigger);
        riskManager.engageCircuitBreakerUntilReleased(RiskManager.GLOBAL_SCOPE, PENDING_REASON);

        int changed;
        try {
            changed = synchronise();
        } catch (VenueException | OrderTrackingException e) {
            log.error("Reconciliation failed ({}); new decisions stay blocked", trigger, e);
            executionMetrics.recordReconciliation(false);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.RECONCILIATION_FAILED,
                    RiskLevel.CRITICAL,
                    "Reconciliation failed: " + e.getMessage(),
                    Map.of("trigger", trigger, "error", String.valueOf(e.getMessage())));
            return false;
        }

        // a manual breaker under the same reason belongs to an operator
        boolean ownBreaker = riskManager.getCircuitBreaker(RiskManager.GLOBAL_SCOPE, PENDING_REASON)
                .map(CircuitBreakerState::isAutomatic)
                .orElse(false);
        if (ownBreaker) {
            riskManager.releaseCircuitBreaker(RiskManager.GLOBAL_SCOPE, PENDING_REASON, "reconciliation");
        }
        executionMetrics.recordReconciliation(true);
        log.info("Reconciliation finished ({}): {} orders corrected", trigger, changed);
        return true;
    }

    private int synchronise() {
        List<VenueOrderStatus> venueOpen = retryingVenueOperations.openOrders();
        Set<String> seen = new HashSet<>();
        int changed = 0;

        for (VenueOrderStatus status : venueOpen) {
            seen.add(status.getClientId());
            if (syncFromVenue(status)) {
                changed++;
            }
        }

        // working locally but absent from the venue's open list: ask for each one
        for (Order local : orderTracker.openOrders()) {
            if (local.getMode() != ExecutionMode.LIVE || seen.contains(local.getClientId())) {
                continue;
            }
            Optional<VenueOrderStatus> status = retryingVenueOperations.getOrderStatus(local.getClientId());
            if (status.isPresent()) {
                if (syncFromVenue(status.get())) {
                    changed++;
                }
            } else {
                log.warn("Venue has no record of working order {}; expiring it", local.getClientId());
                orderStateApplier.expire(local.getClientId());
                changed++;
            }
        }

        for (String clientId : indeterminateOrders.clientIds()) {
            if (seen.contains(clientId)) {
                continue;
            }
            Optional<VenueOrderStatus> status = retryingVenueOperations.getOrderStatus(clientId);
            if (status.isPresent()) {
                syncFromVenue(status.get());
                changed++;
            } else {
                indeterminateOrders.remove(clientId);
                log.info("Indeterminate order {} never reached the venue", clientId);
            }
        }
        return changed;
    }

    /**
     * Aligns one order with the venue's status.
     *
     * @return true if anything changed locally
     */
    private boolean syncFromVenue(VenueOrderStatus status) {
        String clientId = status.getClientId();
        Optional<Order> tracked = orderTracker.get(clientId);
        if (tracked.isEmpty() && status.getVenueId() != null) {
            tracked = orderTracker.findByVenueId(status.getVenueId());
        }

        if (tracked.isEmpty()) {
            Optional<OrderIntent> intent = indeterminateOrders.remove(clientId);
            if (intent.isPresent()) {
                if (status.getVenueId() == null && status.getState() != OrderState.REJECTED) {
                    indeterminateOrders.add(clientId, intent.get());
                    throw new VenueException("Venue reported order " + clientId + " without a venue id");
                }
                if (status.getState() == OrderState.REJECTED) {
                    orderStateApplier.registerRejected(clientId, intent.get(), status.getRejectReason());
                    return true;
                }
                orderStateApplier.registerAcknowledged(clientId, intent.get(), ExecutionMode.LIVE, status.getVenueId());
                tracked = orderTracker.get(clientId);
            } else {
                log.warn("Adopting untracked venue order {} ({} {})", clientId, status.getSide(), status.getSymbol());
                orderStateApplier.adopt(status.toOrder(ExecutionMode.LIVE));
                return true;
            }
        }

        Order local = tracked.get();
        if (local.isTerminal()) {
            return false;
        }
        boolean changed = false;

        if (local.getState() == OrderState.SUBMITTED && status.getVenueId() != null
                && status.getState() != OrderState.REJECTED) {
            local = orderStateApplier.acknowledge(local.getClientId(), status.getVenueId());
            changed = true;
        }

        BigDecimal missing = status.getFilledQty().subtract(local.getFilledQty());
        if (missing.signum() > 0 && local.getState().isWorking() && status.getAvgFillPrice() != null) {
            local = orderStateApplier.applyFill(local.getClientId(), catchUpFill(local, status, missing));
            changed = true;
        }

        if (local.getState() != status.getState() && !local.isTerminal()) {
            orderStateApplier.adopt(local.toBuilder()
                    .state(status.getState())
                    .venueId(status.getVenueId() != null ? status.getVenueId() : local.getVenueId())
                    .rejectReason(status.getRejectReason())
                    .build());
            changed = true;
        }
        return changed;
    }

    private Fill catchUpFill(Order local, VenueOrderStatus status, BigDecimal missing) {
        // venue notional minus what is already accounted, spread over the missing quantity
        BigDecimal venueNotional = status.getFilledQty().multiply(status.getAvgFillPrice());
        BigDecimal localNotional = local.getAvgFillPrice() != null
                ? local.getFilledQty().multiply(local.getAvgFillPrice())
                : BigDecimal.ZERO;
        BigDecimal price = venueNotional.subtract(localNotional).divide(missing, 10, RoundingMode.HALF_UP);
        if (price.signum() <= 0) {
            price = status.getAvgFillPrice();
        }
        return Fill.builder()
                .orderClientId(local.getClientId())
                .fillId("reconcile-" + local.getClientId() + "-" + status.getFilledQty().toPlainString())
                .qty(missing)
                .price(price)
                .commissionAsset(executionSettings.getCommissionAsset())
                .timestamp(clock.instant())
                .isFinal(status.getState() == OrderState.FILLED)
                .build();
    }
}

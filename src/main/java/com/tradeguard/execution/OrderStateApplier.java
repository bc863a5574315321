package com.tradeguard.execution;

import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.FillOutcome;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.OrderEventType;
import com.tradeguard.exception.UnknownOrderException;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.oms.PositionLedger;
import com.tradeguard.risk.RiskManager;
import org.springframework.stereotype.Component;

/**
 * Applies order lifecycle changes to the tracker and carries their consequences onward: fills go
 * through the position ledger into the risk manager, and every change is published as an
 * {@code OrderEvent}.
 *
 * <p>Paper fills, live stream events and reconciliation all go through here, so a simulated fill is
 * accounted exactly like a live one. Callers hold the account lock.
 */
@Component
public class OrderStateApplier {

    private final OrderTracker orderTracker;
    private final PositionLedger positionLedger;
    private final RiskManager riskManager;
    private final EventPublisherHelper eventPublisherHelper;

    public OrderStateApplier(
            OrderTracker orderTracker,
            PositionLedger positionLedger,
            RiskManager riskManager,
            EventPublisherHelper eventPublisherHelper) {
        this.orderTracker = orderTracker;
        this.positionLedger = positionLedger;
        this.riskManager = riskManager;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Registers an order the venue has acknowledged: SUBMITTED then OPEN with its venue id. */
    public Order registerAcknowledged(String clientId, OrderIntent intent, ExecutionMode mode, String venueId) {
        Order order = newOrder(clientId, intent, mode);
        orderTracker.submit(order);
        eventPublisherHelper.publishOrderEvent(this, snapshot(clientId), OrderEventType.PLACED, null);
        return acknowledge(clientId, venueId);
    }

    /** Registers an order the venue reports as rejected, so the rejection stays on record. */
    public Order registerRejected(String clientId, OrderIntent intent, String reason) {
        orderTracker.submit(newOrder(clientId, intent, ExecutionMode.LIVE));
        return reject(clientId, reason);
    }

    public Order acknowledge(String clientId, String venueId) {
        OrderState previous = snapshot(clientId).getState();
        orderTracker.acknowledge(clientId, venueId);
        Order order = snapshot(clientId);
        if (previous != order.getState()) {
            eventPublisherHelper.publishOrderEvent(this, order, OrderEventType.ACKNOWLEDGED, previous);
        }
        return order;
    }

    /**
     * Applies a fill and feeds its realised PnL to the risk manager. Replayed fills (same fill id) change
     * nothing and are not accounted twice.
     */
    public Order applyFill(String clientId, Fill fill) {
        Order before = snapshot(clientId);
        Order after = orderTracker.applyFill(clientId, fill);
        if (after.getFilledQty().compareTo(before.getFilledQty()) == 0) {
            return after;
        }

        FillOutcome outcome = positionLedger.apply(after.getSymbol(), after.getSide(), fill);
        riskManager.updateAfterFill(outcome);

        OrderEventType type =
                after.getState() == OrderState.FILLED ? OrderEventType.FILLED : OrderEventType.PARTIALLY_FILLED;
        eventPublisherHelper.publishOrderEvent(this, after, type, before.getState());
        return after;
    }

    public Order cancel(String clientId) {
        OrderState previous = snapshot(clientId).getState();
        orderTracker.cancel(clientId);
        Order order = snapshot(clientId);
        eventPublisherHelper.publishOrderEvent(this, order, OrderEventType.CANCELLED, previous);
        return order;
    }

    public Order reject(String clientId, String reason) {
        OrderState previous = snapshot(clientId).getState();
        orderTracker.reject(clientId, reason);
        Order order = snapshot(clientId);
        eventPublisherHelper.publishOrderEvent(this, order, OrderEventType.REJECTED, previous);
        return order;
    }

    public Order expire(String clientId) {
        OrderState previous = snapshot(clientId).getState();
        orderTracker.expire(clientId);
        Order order = snapshot(clientId);
        eventPublisherHelper.publishOrderEvent(this, order, OrderEventType.EXPIRED, previous);
        return order;
    }

    public Order adopt(Order authoritative) {
        OrderState previous = orderTracker.get(authoritative.getClientId()).map(Order::getState).orElse(null);
        orderTracker.adopt(authoritative);
        Order order = snapshot(authoritative.getClientId());
        eventPublisherHelper.publishOrderEvent(this, order, OrderEventType.RECONCILED, previous);
        return order;
    }

    static Order newOrder(String clientId, OrderIntent intent, ExecutionMode mode) {
        return Order.builder()
                .clientId(clientId)
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .type(intent.getType())
                .requestedQty(intent.getQty())
                .limitPrice(intent.getLimitPrice())
                .referencePrice(intent.getReferencePrice())
                .mode(mode)
                .decisionReason(intent.getDecision() != null ? intent.getDecision().getReason() : null)
                .state(OrderState.SUBMITTED)
                .build();
    }

    private Order snapshot(String clientId) {
        return orderTracker.get(clientId).orElseThrow(() -> new UnknownOrderException(clientId));
    }
}

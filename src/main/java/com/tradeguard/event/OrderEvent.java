package com.tradeguard.event;

import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published after the tracker applied an order state change. Carries the new immutable
 * snapshot and the state the order was in before the change.
 *
 * <p>Listeners run synchronously on the publishing thread, which holds the account lock,
 * so they must stay short and must not call back into the dispatcher.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderState previousState;

    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderState previousState) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousState = previousState;
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Null for PLACED and for orders first seen during reconciliation. */
    public OrderState getPreviousState() {
        return previousState;
    }
}

package com.tradeguard.event;

import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.Order;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed front for Spring's {@link ApplicationEventPublisher}, so call sites read
 * {@code eventPublisherHelper.publishOrderEvent(this, order, FILLED, previous)} rather than
 * constructing events inline.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderEvent(Object source, Order order, OrderEventType eventType, OrderState previousState) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousState));
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, null));
    }

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }
}

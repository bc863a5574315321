package com.tradeguard.risk.policy;

import com.tradeguard.risk.RiskManager;
import com.tradeguard.risk.RiskViolation;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rejects unconditionally while a circuit breaker covers the whole account or the order's symbol.
 */
@Component
@Order(60)
public class CircuitBreakerPolicy implements RiskPolicy {

    @Override
    public String name() {
        return "circuit-breaker";
    }

    @Override
    public List<RiskViolation> evaluate(RiskContext context) {
        String symbol = context.getIntent().getSymbol();
        if (context.getEngagedBreakerScopes().contains(RiskManager.GLOBAL_SCOPE)) {
            return List.of(RiskViolation.of(RiskViolation.CIRCUIT_BREAKER_ENGAGED, "Account circuit breaker engaged"));
        }
        if (context.getEngagedBreakerScopes().contains(symbol)) {
            return List.of(RiskViolation.of(
                    RiskViolation.CIRCUIT_BREAKER_ENGAGED, "Circuit breaker engaged for " + symbol));
        }
        return List.of();
    }
}

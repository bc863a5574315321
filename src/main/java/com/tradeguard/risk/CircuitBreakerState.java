package com.tradeguard.risk;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One engaged circuit breaker. The scope is either {@link RiskManager#GLOBAL_SCOPE} or a symbol.
 * Automatic breakers carry an expiry; manual ones stay until released.
 */
@Value
@Builder
public class CircuitBreakerState {

    String scope;
    String reason;
    boolean automatic;
    Instant engagedAt;

    /** Null for manual breakers. */
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}

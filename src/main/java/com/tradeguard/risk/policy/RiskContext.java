package com.tradeguard.risk.policy;

import com.tradeguard.domain.model.AccountSnapshot;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.risk.RiskLimits;
import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a {@link RiskPolicy} may look at, frozen for the duration of one validation.
 */
@Value
@Builder
public class RiskContext {

    OrderIntent intent;
    AccountSnapshot account;
    RiskLimits limits;
    BigDecimal drawdownPct;
    BigDecimal openExposure;

    /** Scopes with an engaged circuit breaker: the global scope and/or symbols. */
    Set<String> engagedBreakerScopes;

    public BigDecimal getEquity() {
        return account.getEquity();
    }
}

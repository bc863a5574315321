package com.tradeguard.risk.policy;

import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rejects orders whose notional exceeds {@code maxPositionPct * equity}. Risk-reducing orders
 * are exempt so an oversized position can always be closed.
 */
@Component
@Order(10)
public class MaxPositionSizePolicy implements RiskPolicy {

    @Override
    public String name() {
        return "max-position-size";
    }

    @Override
    public List<RiskViolation> evaluate(RiskContext context) {
        BigDecimal maxPct = context.getLimits().getMaxPositionPct();
        if (maxPct == null || context.getIntent().isRiskReducing()) {
            return List.of();
        }
        BigDecimal cap = context.getEquity().multiply(maxPct);
        BigDecimal notional = context.getIntent().getNotional();
        if (notional.compareTo(cap) > 0) {
            return List.of(RiskViolation.of(
                    RiskViolation.MAX_POSITION_SIZE,
                    String.format(
                            "Notional %s exceeds %s of equity (%s)",
                            notional.toPlainString(), maxPct.toPlainString(), cap.toPlainString())));
        }
        return List.of();
    }
}

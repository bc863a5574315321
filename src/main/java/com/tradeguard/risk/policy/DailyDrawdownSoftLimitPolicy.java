package com.tradeguard.risk.policy;

import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Past the soft drawdown limit only risk-reducing orders pass.
 */
@Component
@Order(30)
public class DailyDrawdownSoftLimitPolicy implements RiskPolicy {

    @Override
    public String name() {
        return "daily-drawdown-soft-limit";
    }

    @Override
    public List<RiskViolation> evaluate(RiskContext context) {
        BigDecimal softLimit = context.getLimits().getDrawdownSoftLimit();
        if (softLimit == null || context.getIntent().isRiskReducing()) {
            return List.of();
        }
        if (context.getDrawdownPct().compareTo(softLimit) >= 0) {
            return List.of(RiskViolation.of(
                    RiskViolation.DAILY_DRAWDOWN_SOFT_LIMIT,
                    String.format(
                            "Daily drawdown %s at or above soft limit %s; only risk-reducing orders allowed",
                            context.getDrawdownPct().toPlainString(), softLimit.toPlainString())));
        }
        return List.of();
    }
}

package com.tradeguard.risk.policy;

import com.tradeguard.domain.enums.KillSwitchReason;
import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * At or past the hard drawdown limit every order is rejected and the violation escalates to
 * the kill switch.
 */
@Component
@Order(40)
public class DailyDrawdownHardLimitPolicy implements RiskPolicy {

    @Override
    public String name() {
        return "daily-drawdown-hard-limit";
    }

    @Override
    public List<RiskViolation> evaluate(RiskContext context) {
        BigDecimal hardLimit = context.getLimits().getDrawdownHardLimit();
        if (hardLimit == null || context.getDrawdownPct().compareTo(hardLimit) < 0) {
            return List.of();
        }
        return List.of(RiskViolation.builder()
                .code(RiskViolation.MAX_DD_EXCEEDED)
                .message(String.format(
                        "Daily drawdown %s at or above hard limit %s",
                        context.getDrawdownPct().toPlainString(), hardLimit.toPlainString()))
                .escalation(KillSwitchReason.MAX_DD_EXCEEDED)
                .build());
    }
}

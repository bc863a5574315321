package com.tradeguard.risk.policy;

import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * For leveraged orders, the free-margin ratio after placing the order,
 * {@code (equity - usedMargin - requiredMargin) / equity}, must stay at or above the floor.
 * Unleveraged (spot) orders are not margin-checked.
 */
@Component
@Order(50)
public class MarginPolicy implements RiskPolicy {

    @Override
    public String name() {
        return "margin";
    }

    @Override
    public List<RiskViolation> evaluate(RiskContext context) {
        BigDecimal floor = context.getLimits().getMinMarginRatio();
        if (floor == null || !context.getIntent().isLeveraged() || context.getIntent().isRiskReducing()) {
            return List.of();
        }
        BigDecimal equity = context.getEquity();
        BigDecimal free = equity.subtract(context.getAccount().getUsedMargin())
                .subtract(context.getIntent().getRequiredMargin());
        BigDecimal ratio = free.divide(equity, 4, RoundingMode.HALF_UP);
        if (ratio.compareTo(floor) < 0) {
            return List.of(RiskViolation.of(
                    RiskViolation.INSUFFICIENT_MARGIN,
                    String.format(
                            "Projected margin ratio %s below floor %s", ratio.toPlainString(), floor.toPlainString())));
        }
        return List.of();
    }
}

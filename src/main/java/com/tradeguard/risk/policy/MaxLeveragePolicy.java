package com.tradeguard.risk.policy;

import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Caps account leverage: {@code (openExposure + notional) / equity <= maxLeverage} for orders that
 * add exposure.
 */
@Component
@Order(20)
public class MaxLeveragePolicy implements RiskPolicy {

    @Override
    public String name() {
        return "max-leverage";
    }

    @Override
    public List<RiskViolation> evaluate(RiskContext context) {
        BigDecimal maxLeverage = context.getLimits().getMaxLeverage();
        if (maxLeverage == null || context.getIntent().isRiskReducing()) {
            return List.of();
        }
        BigDecimal projected = context.getOpenExposure().add(context.getIntent().getNotional());
        BigDecimal leverage = projected.divide(context.getEquity(), 4, RoundingMode.HALF_UP);
        if (leverage.compareTo(maxLeverage) > 0) {
            return List.of(RiskViolation.of(
                    RiskViolation.MAX_LEVERAGE,
                    String.format(
                            "Projected leverage %sx exceeds %sx",
                            leverage.toPlainString(), maxLeverage.toPlainString())));
        }
        return List.of();
    }
}

package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * A decision translated into concrete order terms, which is what the risk policies evaluate.
 *
 * <p>{@code riskReducing} is true when the order opposes the current net position and does not
 * exceed it, i.e. it can only shrink exposure.
 */
@Value
@Builder
public class OrderIntent {

    Decision decision;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal qty;
    BigDecimal referencePrice;
    BigDecimal limitPrice;
    BigDecimal notional;

    @Builder.Default
    BigDecimal leverage = BigDecimal.ONE;

    boolean riskReducing;

    /** Margin the order would lock: notional divided by leverage. */
    public BigDecimal getRequiredMargin() {
        return notional.divide(leverage, 8, RoundingMode.HALF_UP);
    }

    public boolean isLeveraged() {
        return leverage.compareTo(BigDecimal.ONE) > 0;
    }
}

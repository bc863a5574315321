package com.tradeguard.execution;

import com.tradeguard.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Moves the fill price against the order by a fixed number of basis points: buys fill above the
 * mark, sells below.
 */
public class FixedBpsSlippageModel implements SlippageModel {

    private static final BigDecimal BPS = new BigDecimal("10000");

    private final BigDecimal slippageBps;

    public FixedBpsSlippageModel(BigDecimal slippageBps) {
        if (slippageBps.signum() < 0) {
            throw new IllegalArgumentException("Slippage must not be negative: " + slippageBps);
        }
        this.slippageBps = slippageBps;
    }

    @Override
    public BigDecimal fillPrice(BigDecimal markPrice, OrderSide side) {
        BigDecimal factor = slippageBps.divide(BPS, 10, RoundingMode.HALF_UP);
        BigDecimal adjustment = side == OrderSide.BUY ? BigDecimal.ONE.add(factor) : BigDecimal.ONE.subtract(factor);
        return markPrice.multiply(adjustment).setScale(markPrice.scale() + 4, RoundingMode.HALF_UP);
    }
}

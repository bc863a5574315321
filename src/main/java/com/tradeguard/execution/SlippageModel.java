package com.tradeguard.execution;

import com.tradeguard.domain.enums.OrderSide;
import java.math.BigDecimal;

/**
 * Price adjustment applied to simulated paper fills.
 */
public interface SlippageModel {

    BigDecimal fillPrice(BigDecimal markPrice, OrderSide side);
}

package com.tradeguard.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Accounting effect of one fill: the PnL it realised by reducing a position and the commission it cost.
 */
@Value
@Builder
public class FillOutcome {

    String symbol;

    @Builder.Default
    BigDecimal realizedPnl = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal commission = BigDecimal.ZERO;

    /** Signed net position in the symbol after the fill. */
    BigDecimal netPositionAfter;

    /** Realised PnL net of commission. */
    public BigDecimal getNetPnl() {
        return realizedPnl.subtract(commission);
    }
}

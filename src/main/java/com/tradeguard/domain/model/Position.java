package com.tradeguard.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Net position in one symbol as reported by the account state provider.
 * Positive quantity is long, negative is short.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String symbol;
    BigDecimal quantity;
    BigDecimal markPrice;

    public BigDecimal getNotional() {
        return quantity.abs().multiply(markPrice);
    }

    public boolean isFlat() {
        return quantity.signum() == 0;
    }
}

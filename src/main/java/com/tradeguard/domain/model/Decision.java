package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.Direction;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An abstract trade instruction produced by strategy logic outside this core.
 *
 * <p>{@code sizeHint} is the fraction of current equity to commit, in (0, 1]. It is ignored for
 * {@link Direction#EXIT}, which always closes the whole net position. When {@code limitPrice} is set
 * the order is placed as a LIMIT order, otherwise as MARKET.
 */
@Value
@Builder
public class Decision {

    String symbol;
    Direction direction;
    BigDecimal sizeHint;
    double confidence;
    String reason;
    BigDecimal limitPrice;

    /**
     * Rejects structurally malformed decisions. This is a programmer error, not a risk rejection,
     * so it throws instead of producing a rejection result.
     *
     * @throws IllegalArgumentException if a field is missing or out of range
     */
    public void requireWellFormed() {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Decision symbol must not be blank");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Decision direction must not be null for " + symbol);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Decision confidence must be within [0, 1], got " + confidence);
        }
        if (direction != Direction.EXIT) {
            if (sizeHint == null || sizeHint.signum() <= 0 || sizeHint.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("Decision sizeHint must be within (0, 1], got " + sizeHint);
            }
        }
        if (limitPrice != null && limitPrice.signum() <= 0) {
            throw new IllegalArgumentException("Decision limitPrice must be positive, got " + limitPrice);
        }
    }
}

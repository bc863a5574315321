package com.tradeguard.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A partial or complete execution reported by the venue (or by the paper simulator).
 *
 * <p>Fills are applied in the order they are delivered, never re-sorted by {@code timestamp}.
 */
@Value
@Builder
public class Fill {

    String orderClientId;

    /** Venue trade id. When present, replays of the same fill are ignored. */
    String fillId;

    BigDecimal qty;
    BigDecimal price;

    @Builder.Default
    BigDecimal commission = BigDecimal.ZERO;

    String commissionAsset;
    Instant timestamp;

    /** True when the venue reports that this fill completes the order. */
    boolean isFinal;

    public BigDecimal getNotional() {
        return qty.multiply(price);
    }
}

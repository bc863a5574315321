package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One intended trade instruction and its execution progress.
 *
 * <p>Instances are immutable snapshots. The {@link com.tradeguard.oms.OrderTracker} owns the
 * authoritative record and replaces it with a new snapshot on every transition, so a reference
 * handed to a reader never changes under it.
 *
 * <p>{@code avgFillPrice} is null until the first fill and afterwards is the quantity-weighted
 * mean of every fill applied. {@code filledQty} never exceeds {@code requestedQty}.
 */
@Value
@Builder(toBuilder = true)
public class Order {

    /** Caller-generated id, unique for the lifetime of the process and never reused. */
    String clientId;

    /** Venue-assigned id. Null until the venue acknowledges the order. */
    String venueId;

    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal requestedQty;

    /** Limit price. Null for MARKET orders. */
    BigDecimal limitPrice;

    /** Mark price used to size the order; prices exposure while nothing is filled. */
    BigDecimal referencePrice;

    OrderState state;

    @Builder.Default
    BigDecimal filledQty = BigDecimal.ZERO;

    BigDecimal avgFillPrice;

    /** Commission in the accounting asset, already converted by the caller. */
    @Builder.Default
    BigDecimal commissionTotal = BigDecimal.ZERO;

    /** Mode the order was placed under. Fixed for the order's life. */
    ExecutionMode mode;

    String rejectReason;

    /** Free text carried over from the decision that produced this order. */
    String decisionReason;

    Instant createdAt;
    Instant updatedAt;

    public BigDecimal getRemainingQty() {
        return requestedQty.subtract(filledQty);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}

package com.tradeguard.venue;

import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.enums.OrderType;
import com.tradeguard.domain.model.Order;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * The venue's authoritative view of one order, as returned by status queries and open order listings.
 */
@Value
@Builder
public class VenueOrderStatus {

    String clientId;
    String venueId;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal requestedQty;
    BigDecimal limitPrice;

    @Builder.Default
    BigDecimal filledQty = BigDecimal.ZERO;

    BigDecimal avgFillPrice;
    OrderState state;
    String rejectReason;

    /** Builds the order record the tracker adopts during reconciliation. */
    public Order toOrder(ExecutionMode mode) {
        return Order.builder()
                .clientId(clientId)
                .venueId(venueId)
                .symbol(symbol)
                .side(side)
                .type(type)
                .requestedQty(requestedQty)
                .limitPrice(limitPrice)
                .referencePrice(avgFillPrice != null ? avgFillPrice : limitPrice)
                .state(state)
                .filledQty(filledQty)
                .avgFillPrice(filledQty.signum() > 0 ? avgFillPrice : null)
                .mode(mode)
                .rejectReason(rejectReason)
                .build();
    }
}

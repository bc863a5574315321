package com.tradeguard.venue;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Venue-neutral order placement request. The client id travels with the order so the venue can
 * be asked about it by that id after an ambiguous failure.
 */
@Value
@Builder
public class OrderPlacement {

    String clientId;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal qty;

    /** Null for MARKET orders. */
    BigDecimal limitPrice;
}

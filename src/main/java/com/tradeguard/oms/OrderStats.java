package com.tradeguard.oms;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Counters over the orders currently held by the tracker, for reporting.
 */
@Value
@Builder
public class OrderStats {

    int trackedOrders;
    int openOrders;
    int filledOrders;
    int cancelledOrders;
    int rejectedOrders;
    int expiredOrders;
    int archivedOrders;
    BigDecimal filledNotional;
    BigDecimal commissionTotal;
}

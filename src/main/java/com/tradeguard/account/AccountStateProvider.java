package com.tradeguard.account;

import com.tradeguard.domain.model.AccountSnapshot;
import com.tradeguard.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;

/**
 * Source of account equity and positions, normally backed by the venue's account endpoints.
 */
public interface AccountStateProvider {

    BigDecimal currentEquity();

    List<Position> openPositions();

    default BigDecimal usedMargin() {
        return BigDecimal.ZERO;
    }

    default AccountSnapshot snapshot() {
        return AccountSnapshot.builder()
                .equity(currentEquity())
                .usedMargin(usedMargin())
                .positions(openPositions())
                .build();
    }
}

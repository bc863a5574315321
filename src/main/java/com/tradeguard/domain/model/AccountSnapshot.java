package com.tradeguard.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the account used for one risk validation.
 */
@Value
@Builder
public class AccountSnapshot {

    BigDecimal equity;

    @Builder.Default
    BigDecimal usedMargin = BigDecimal.ZERO;

    @Builder.Default
    List<Position> positions = List.of();

    public Optional<Position> positionFor(String symbol) {
        return positions.stream()
                .filter(p -> p.getSymbol().equals(symbol) && !p.isFlat())
                .findFirst();
    }

    /** Sum of absolute position notionals at mark. */
    public BigDecimal getPositionNotional() {
        return positions.stream().map(Position::getNotional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

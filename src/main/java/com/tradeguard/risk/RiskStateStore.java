package com.tradeguard.risk;

import java.util.Optional;

/**
 * Persistence port for {@link RiskState}, so an active kill switch and the day's drawdown
 * accounting survive a restart. The risk manager saves a detached copy after every change
 * and loads once at construction.
 */
public interface RiskStateStore {

    Optional<RiskState> load();

    void save(RiskState state);
}

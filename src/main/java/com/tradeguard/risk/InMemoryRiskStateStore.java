package com.tradeguard.risk;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local {@link RiskStateStore}. Used when no durable store is configured; it survives
 * a risk manager being rebuilt inside the same JVM but not a process restart.
 */
public class InMemoryRiskStateStore implements RiskStateStore {

    private final AtomicReference<RiskState> saved = new AtomicReference<>();

    @Override
    public Optional<RiskState> load() {
        RiskState state = saved.get();
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    @Override
    public void save(RiskState state) {
        saved.set(state.copy());
    }
}

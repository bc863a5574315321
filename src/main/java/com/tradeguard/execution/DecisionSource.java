package com.tradeguard.execution;

import com.tradeguard.domain.model.Decision;
import java.util.Optional;

/**
 * Producer of trade decisions. How decisions are generated is outside this core; only the value is used.
 */
@FunctionalInterface
public interface DecisionSource {

    /** The next pending decision, or empty when there is none right now. */
    Optional<Decision> nextDecision();
}

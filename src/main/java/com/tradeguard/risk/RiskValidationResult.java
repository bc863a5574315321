package com.tradeguard.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of pre-trade validation: approved, or rejected with every violation found.
 *
 * <p>Rejection is an expected result, not an error, so it is returned rather than thrown.
 * All policies run before the result is built, so the caller sees the complete list.
 */
@Getter
public class RiskValidationResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private RiskValidationResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, Collections.emptyList());
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A rejection needs at least one violation");
        }
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }

    public List<String> reasonCodes() {
        return violations.stream().map(RiskViolation::getCode).toList();
    }
}

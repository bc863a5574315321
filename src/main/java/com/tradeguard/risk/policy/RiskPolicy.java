package com.tradeguard.risk.policy;

import com.tradeguard.risk.RiskViolation;
import java.util.List;

/**
 * One pre-trade check. Policies are stateless; every input comes through the context.
 *
 * <p>Implementations return violations as data and never throw for a failing check. The risk
 * manager runs every policy in {@code @Order} sequence and reports all violations together.
 */
public interface RiskPolicy {

    String name();

    List<RiskViolation> evaluate(RiskContext context);
}

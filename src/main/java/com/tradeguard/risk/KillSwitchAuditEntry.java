package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchReason;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Audit record of a kill switch activation or manual clear.
 */
@Value
@Builder
public class KillSwitchAuditEntry {

    public enum Action {
        ACTIVATED,
        CLEARED
    }

    Action action;
    KillSwitchReason reason;

    /** "system" for automatic activations. */
    String operator;

    String note;
    BigDecimal drawdownPct;
    Instant at;
}

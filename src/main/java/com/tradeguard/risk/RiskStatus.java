package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable risk snapshot for reporting and alerting consumers.
 */
@Value
@Builder
public class RiskStatus {

    boolean killSwitchActive;
    KillSwitchReason killSwitchReason;
    String killSwitchDetail;
    Instant killSwitchActivatedAt;
    BigDecimal drawdownPct;
    BigDecimal dailyPnl;
    BigDecimal currentEquity;
    BigDecimal peakEquity;
    BigDecimal openExposure;
    List<CircuitBreakerState> circuitBreakers;
    Instant dayStart;
}

package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Mutable risk accounting for one account.
 *
 * <p>Owned by {@link RiskManager}: nothing else mutates it, and readers get a {@link RiskStatus}
 * snapshot instead. {@link #copy()} produces the detached copy handed to {@link RiskStateStore}.
 *
 * <p>{@code currentDrawdownPct = max(0, (dailyPeakEquity - currentEquity) / dailyPeakEquity)}, zero
 * while no peak is known.
 */
@Data
public class RiskState {

    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
    private BigDecimal dailyPeakEquity = BigDecimal.ZERO;
    private BigDecimal currentEquity = BigDecimal.ZERO;
    private BigDecimal currentDrawdownPct = BigDecimal.ZERO;
    private BigDecimal openNotionalExposure = BigDecimal.ZERO;

    private boolean killSwitchActive;
    private KillSwitchReason killSwitchReason;
    private String killSwitchDetail;
    private Instant killSwitchActivatedAt;

    /** UTC midnight that opened the current trading day. */
    private Instant dayStart;

    /** Set once the soft limit alert was raised for the current day. */
    private boolean softLimitAlerted;

    /** Scope, then reason. Each reason on a scope is engaged and released on its own. */
    private Map<String, Map<String, CircuitBreakerState>> circuitBreakers = new LinkedHashMap<>();
    private List<KillSwitchAuditEntry> killSwitchAudit = new ArrayList<>();

    public static RiskState startingAt(Instant dayStart) {
        RiskState state = new RiskState();
        state.setDayStart(dayStart);
        return state;
    }

    public RiskState copy() {
        RiskState copy = new RiskState();
        copy.dailyRealizedPnl = dailyRealizedPnl;
        copy.dailyPeakEquity = dailyPeakEquity;
        copy.currentEquity = currentEquity;
        copy.currentDrawdownPct = currentDrawdownPct;
        copy.openNotionalExposure = openNotionalExposure;
        copy.killSwitchActive = killSwitchActive;
        copy.killSwitchReason = killSwitchReason;
        copy.killSwitchDetail = killSwitchDetail;
        copy.killSwitchActivatedAt = killSwitchActivatedAt;
        copy.dayStart = dayStart;
        copy.softLimitAlerted = softLimitAlerted;
        copy.circuitBreakers = new LinkedHashMap<>();
        circuitBreakers.forEach((scope, byReason) -> copy.circuitBreakers.put(scope, new LinkedHashMap<>(byReason)));
        copy.killSwitchAudit = new ArrayList<>(killSwitchAudit);
        return copy;
    }
}

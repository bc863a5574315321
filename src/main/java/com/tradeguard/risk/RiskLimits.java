package com.tradeguard.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Account risk limits. Fractions are expressed as decimals (0.02 = 2%).
 *
 * <p>Organized in three groups:
 * <ul>
 *   <li><b>Sizing:</b> position size as a fraction of equity, leverage, margin floor</li>
 *   <li><b>Drawdown:</b> soft limit (only risk-reducing decisions pass) and hard limit (kill switch)</li>
 *   <li><b>Connection:</b> how much silence or how many errors the venue stream may show before
 *       trading stops</li>
 * </ul>
 *
 * <p>A null limit disables its check. Loaded from {@code tradeguard.risk.*} by {@code RiskConfig}.
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Sizing ====================

    /** Maximum notional of one order as a fraction of equity. */
    private BigDecimal maxPositionPct;

    /** Maximum (open exposure + new notional) / equity. */
    private BigDecimal maxLeverage;

    /** Minimum free-margin ratio after a leveraged order. */
    private BigDecimal minMarginRatio;

    // ==================== Drawdown ====================

    private BigDecimal drawdownSoftLimit;

    private BigDecimal drawdownHardLimit;

    // ==================== Connection ====================

    /** A stale stream silent for at least this long activates the kill switch. */
    private Duration staleKillAfter;

    /** More consecutive stream errors than this activates the kill switch. */
    private Integer maxConsecutiveErrors;

    /** More reconnects than this inside the reconnect window engages the circuit breaker. */
    private Integer maxReconnectsPerWindow;

    // ==================== Circuit breaker ====================

    /** How long an automatically engaged circuit breaker stays engaged. */
    @Builder.Default
    private Duration circuitBreakerCooldown = Duration.ofMinutes(5);

    // ==================== Audit ====================

    /** Kill switch audit entries kept in memory; the oldest are dropped first. */
    @Builder.Default
    private int killSwitchAuditCapacity = 500;
}

package com.tradeguard.execution;

import com.tradeguard.domain.enums.ExecutionMode;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Data;

/**
 * Dispatcher and paper-simulator settings. Built by {@code ExecutionConfig} from
 * {@code tradeguard.execution.*} properties.
 */
@Data
@Builder
public class ExecutionSettings {

    /** Mode used by {@code execute(decision)} until changed at runtime. */
    @Builder.Default
    private ExecutionMode defaultMode = ExecutionMode.DRY_RUN;

    /** How long a LIVE placement waits for the venue to acknowledge before the outcome is indeterminate. */
    @Builder.Default
    private Duration ackTimeout = Duration.ofSeconds(5);

    /** Leverage applied to new orders; 1 means unleveraged. */
    @Builder.Default
    private BigDecimal leverage = BigDecimal.ONE;

    /** Decimal places order quantities are rounded down to. */
    @Builder.Default
    private int quantityScale = 8;

    /** Consecutive LIVE placement failures that engage the automatic circuit breaker. */
    @Builder.Default
    private int placementFailureThreshold = 3;

    // ==================== Idempotent venue calls ====================

    /** Attempts for status, cancel and open-order queries, the first included. */
    @Builder.Default
    private int retryMaxAttempts = 4;

    @Builder.Default
    private Duration retryBaseDelay = Duration.ofMillis(200);

    @Builder.Default
    private double retryMultiplier = 2.0;

    /** Randomisation factor applied to each retry delay, 0.2 meaning plus or minus 20%. */
    @Builder.Default
    private double retryJitter = 0.2;

    // ==================== Paper simulation ====================

    /** Adverse slippage applied to simulated fills, in basis points. */
    @Builder.Default
    private BigDecimal paperSlippageBps = new BigDecimal("5");

    @Builder.Default
    private BigDecimal paperCommissionBps = new BigDecimal("10");

    /** Fraction of a paper order filled immediately. Below 1 the order stays PARTIALLY_FILLED. */
    @Builder.Default
    private BigDecimal paperFillRatio = BigDecimal.ONE;

    @Builder.Default
    private String commissionAsset = "USD";
}

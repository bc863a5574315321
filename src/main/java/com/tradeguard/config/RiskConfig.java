package com.tradeguard.config;

import com.tradeguard.risk.InMemoryRiskStateStore;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskStateStore;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.yml.
 *
 * <p>Limits default to null (disabled) when the property is absent; application.yml ships the
 * production values. Null = check skipped.
 *
 * <p>Properties prefix: {@code tradeguard.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradeguard.risk.max-position-pct:#{null}}") BigDecimal maxPositionPct,
            @Value("${tradeguard.risk.max-leverage:#{null}}") BigDecimal maxLeverage,
            @Value("${tradeguard.risk.min-margin-ratio:#{null}}") BigDecimal minMarginRatio,
            @Value("${tradeguard.risk.drawdown-soft-limit:#{null}}") BigDecimal drawdownSoftLimit,
            @Value("${tradeguard.risk.drawdown-hard-limit:#{null}}") BigDecimal drawdownHardLimit,
            @Value("${tradeguard.risk.stale-kill-after:#{null}}") Duration staleKillAfter,
            @Value("${tradeguard.risk.max-consecutive-errors:#{null}}") Integer maxConsecutiveErrors,
            @Value("${tradeguard.risk.max-reconnects-per-window:#{null}}") Integer maxReconnectsPerWindow,
            @Value("${tradeguard.risk.circuit-breaker-cooldown:5m}") Duration circuitBreakerCooldown,
            @Value("${tradeguard.risk.kill-switch-audit-capacity:500}") int killSwitchAuditCapacity) {
        return RiskLimits.builder()
                .maxPositionPct(maxPositionPct)
                .maxLeverage(maxLeverage)
                .minMarginRatio(minMarginRatio)
                .drawdownSoftLimit(drawdownSoftLimit)
                .drawdownHardLimit(drawdownHardLimit)
                .staleKillAfter(staleKillAfter)
                .maxConsecutiveErrors(maxConsecutiveErrors)
                .maxReconnectsPerWindow(maxReconnectsPerWindow)
                .circuitBreakerCooldown(circuitBreakerCooldown)
                .killSwitchAuditCapacity(killSwitchAuditCapacity)
                .build();
    }

    /** Replaced by a durable store when one is configured. */
    @Bean
    @ConditionalOnMissingBean(RiskStateStore.class)
    public RiskStateStore riskStateStore() {
        return new InMemoryRiskStateStore();
    }
}

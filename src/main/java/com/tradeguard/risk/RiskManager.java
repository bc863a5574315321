package com.tradeguard.risk;

import com.tradeguard.connection.ConnectionHealth;
import com.tradeguard.domain.enums.KillSwitchReason;
import com.tradeguard.domain.model.AccountSnapshot;
import com.tradeguard.domain.model.FillOutcome;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.event.RiskLevel;
import com.tradeguard.exception.BusinessException;
import com.tradeguard.risk.policy.RiskContext;
import com.tradeguard.risk.policy.RiskPolicy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade validation and account-level safety state.
 *
 * <p>Owns the account's {@link RiskState}. Three kinds of input mutate it:
 * <ul>
 *   <li><b>Trade outcomes</b> ({@link #updateAfterFill}, {@link #markToMarket}): daily PnL, peak equity
 *       and drawdown. Crossing the hard drawdown limit activates the kill switch.</li>
 *   <li><b>Connection health ticks</b> ({@link #evaluateConnectionHealth}): a stale stream or too many
 *       consecutive errors activates the kill switch; a reconnect storm engages the circuit breaker.
 *       Runs on every tick whether or not any decision is pending.</li>
 *   <li><b>Operator actions</b>: manual kill switch clear (audited, the only way to clear it) and
 *       manual circuit breaker engage/release.</li>
 * </ul>
 *
 * <p>{@link #validate} runs every configured {@link RiskPolicy} and reports all violations. An already
 * active kill switch short-cuts to a single {@code kill_switch_active} rejection. Rejections are data;
 * only malformed input throws.
 *
 * <p>Every state change is saved through the {@link RiskStateStore}, and the last saved state is restored
 * on construction, so the kill switch stays active across restarts.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    /** Circuit breaker scope covering every symbol. */
    public static final String GLOBAL_SCOPE = "*";

    static final String RECONNECT_STORM_REASON = "reconnect_storm";

    private static final int PCT_SCALE = 8;
    private static final String SYSTEM_OPERATOR = "system";

    private final RiskLimits riskLimits;
    private final List<RiskPolicy> policies;
    private final RiskStateStore riskStateStore;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final RiskState state;

    public RiskManager(
            RiskLimits riskLimits,
            List<RiskPolicy> policies,
            RiskStateStore riskStateStore,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.riskLimits = riskLimits;
        this.policies = List.copyOf(policies);
        this.riskStateStore = riskStateStore;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;

        Optional<RiskState> restored = riskStateStore.load();
        this.state = restored.orElseGet(() -> RiskState.startingAt(utcMidnight(clock.instant())));
        if (restored.isPresent()) {
            log.info(
                    "Risk state restored: equity={}, dailyPnl={}, killSwitchActive={}",
                    state.getCurrentEquity(),
                    state.getDailyRealizedPnl(),
                    state.isKillSwitchActive());
            if (state.isKillSwitchActive()) {
                log.warn(
                        "Kill switch still active after restart (reason={}); manual clear required",
                        state.getKillSwitchReason());
            }
        }
        log.info("Risk manager started with policies {}", this.policies.stream().map(RiskPolicy::name).toList());
    }

    // ========================
    // PRE-TRADE VALIDATION
    // ========================

    /**
     * Validates an order intent against every policy.
     *
     * @return approved, {@code [kill_switch_active]} alone if the kill switch is already active,
     *         or every violation found
     */
    public synchronized RiskValidationResult validate(OrderIntent intent, AccountSnapshot account) {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(account, "account");
        rollDayIfNeeded();
        expireCircuitBreakers();

        if (state.isKillSwitchActive()) {
            log.info(
                    "Decision rejected: {} {} {} (kill switch active, reason={})",
                    intent.getSide(),
                    intent.getQty().toPlainString(),
                    intent.getSymbol(),
                    state.getKillSwitchReason().getCode());
            return RiskValidationResult.rejected(List.of(RiskViolation.of(
                    RiskViolation.KILL_SWITCH_ACTIVE,
                    "Kill switch active: " + state.getKillSwitchReason().getCode())));
        }

        if (account.getEquity() == null || account.getEquity().signum() <= 0) {
            return reject(intent, List.of(RiskViolation.of(
                    RiskViolation.NON_POSITIVE_EQUITY, "Account equity must be positive, got " + account.getEquity())));
        }

        RiskContext context = RiskContext.builder()
                .intent(intent)
                .account(account)
                .limits(riskLimits)
                .drawdownPct(state.getCurrentDrawdownPct())
                .openExposure(state.getOpenNotionalExposure())
                .engagedBreakerScopes(engagedScopes())
                .build();

        List<RiskViolation> violations = new ArrayList<>();
        for (RiskPolicy policy : policies) {
            violations.addAll(policy.evaluate(context));
        }

        if (violations.isEmpty()) {
            log.debug("Decision approved: {} {} {}", intent.getSide(), intent.getQty().toPlainString(), intent.getSymbol());
            return RiskValidationResult.approved();
        }

        violations.stream()
                .map(RiskViolation::getEscalation)
                .filter(Objects::nonNull)
                .findFirst()
                .ifPresent(reason -> activateKillSwitch(reason, "Escalated from pre-trade validation"));

        return reject(intent, violations);
    }

    private RiskValidationResult reject(OrderIntent intent, List<RiskViolation> violations) {
        RiskValidationResult result = RiskValidationResult.rejected(violations);
        log.info(
                "Decision rejected: {} {} {} -> {}",
                intent.getSide(),
                intent.getQty().toPlainString(),
                intent.getSymbol(),
                result.reasonCodes());
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.DECISION_REJECTED,
                RiskLevel.INFO,
                "Decision rejected for " + intent.getSymbol(),
                Map.of("symbol", intent.getSymbol(), "reasons", result.reasonCodes()));
        return result;
    }

    // ========================
    // TRADE OUTCOMES
    // ========================

    /**
     * Applies a fill's realised PnL net of commission to the day's PnL and to current equity, then
     * refreshes peak equity and drawdown.
     */
    public synchronized void updateAfterFill(FillOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        rollDayIfNeeded();
        BigDecimal net = outcome.getNetPnl();
        state.setDailyRealizedPnl(state.getDailyRealizedPnl().add(net));
        applyEquity(state.getCurrentEquity().add(net));
        log.debug(
                "Fill outcome applied: symbol={}, net={}, dailyPnl={}, drawdown={}",
                outcome.getSymbol(),
                net.toPlainString(),
                state.getDailyRealizedPnl().toPlainString(),
                state.getCurrentDrawdownPct().toPlainString());
        persist();
    }

    /** Replaces current equity with the account provider's figure, which includes unrealised PnL. */
    public synchronized void markToMarket(BigDecimal equity) {
        Objects.requireNonNull(equity, "equity");
        rollDayIfNeeded();
        applyEquity(equity);
        persist();
    }

    public synchronized void recordExposure(BigDecimal openNotional) {
        state.setOpenNotionalExposure(Objects.requireNonNull(openNotional, "openNotional"));
    }

    private void applyEquity(BigDecimal equity) {
        state.setCurrentEquity(equity);
        if (equity.compareTo(state.getDailyPeakEquity()) > 0) {
            state.setDailyPeakEquity(equity);
        }
        state.setCurrentDrawdownPct(drawdown(state.getDailyPeakEquity(), equity));
        checkDrawdownLimits();
    }

    private void checkDrawdownLimits() {
        BigDecimal drawdown = state.getCurrentDrawdownPct();
        BigDecimal hard = riskLimits.getDrawdownHardLimit();
        if (hard != null && drawdown.compareTo(hard) >= 0) {
            activateKillSwitch(
                    KillSwitchReason.MAX_DD_EXCEEDED,
                    "Daily drawdown " + drawdown.toPlainString() + " reached hard limit " + hard.toPlainString());
            return;
        }
        BigDecimal soft = riskLimits.getDrawdownSoftLimit();
        if (soft != null && drawdown.compareTo(soft) >= 0 && !state.isSoftLimitAlerted()) {
            state.setSoftLimitAlerted(true);
            log.warn("Daily drawdown {} reached soft limit {}; only risk-reducing orders allowed", drawdown, soft);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DRAWDOWN_SOFT_LIMIT,
                    RiskLevel.WARNING,
                    "Daily drawdown reached soft limit",
                    Map.of("drawdownPct", drawdown, "softLimit", soft));
        }
    }

    static BigDecimal drawdown(BigDecimal peak, BigDecimal equity) {
        if (peak.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal dd = peak.subtract(equity).divide(peak, PCT_SCALE, RoundingMode.HALF_UP);
        return dd.signum() < 0 ? BigDecimal.ZERO : dd;
    }

    // ========================
    // CONNECTION HEALTH
    // ========================

    /**
     * Applies one connection health tick. Must run on every tick, independent of trading activity.
     */
    public synchronized void evaluateConnectionHealth(ConnectionHealth health) {
        Objects.requireNonNull(health, "health");
        expireCircuitBreakers();

        if (health.isStale()
                && (riskLimits.getStaleKillAfter() == null
                        || health.getSilentFor().compareTo(riskLimits.getStaleKillAfter()) >= 0)) {
            activateKillSwitch(
                    KillSwitchReason.WS_STALE,
                    "No venue update for " + health.getSilentFor().toSeconds() + "s");
        }

        Integer maxErrors = riskLimits.getMaxConsecutiveErrors();
        if (maxErrors != null && health.getConsecutiveErrorsInWindow() > maxErrors) {
            activateKillSwitch(
                    KillSwitchReason.ERROR_RATE,
                    health.getConsecutiveErrorsInWindow() + " consecutive venue errors (limit " + maxErrors + ")");
        }

        Integer maxReconnects = riskLimits.getMaxReconnectsPerWindow();
        if (maxReconnects != null
                && health.getReconnectCountInWindow() > maxReconnects
                && getCircuitBreaker(GLOBAL_SCOPE, RECONNECT_STORM_REASON).isEmpty()) {
            engageCircuitBreaker(GLOBAL_SCOPE, RECONNECT_STORM_REASON, true);
        }
    }

    // ========================
    // KILL SWITCH
    // ========================

    /**
     * Activates the kill switch. Idempotent: while active, further activations are ignored and the
     * first reason is kept.
     *
     * @return true if this call activated it
     */
    public synchronized boolean activateKillSwitch(KillSwitchReason reason, String detail) {
        Objects.requireNonNull(reason, "reason");
        if (state.isKillSwitchActive()) {
            log.debug("Kill switch already active ({}); ignoring {}", state.getKillSwitchReason(), reason);
            return false;
        }

        Instant now = clock.instant();
        state.setKillSwitchActive(true);
        state.setKillSwitchReason(reason);
        state.setKillSwitchDetail(detail);
        state.setKillSwitchActivatedAt(now);
        appendAudit(KillSwitchAuditEntry.builder()
                .action(KillSwitchAuditEntry.Action.ACTIVATED)
                .reason(reason)
                .operator(SYSTEM_OPERATOR)
                .note(detail)
                .drawdownPct(state.getCurrentDrawdownPct())
                .at(now)
                .build());
        persist();

        log.error("KILL SWITCH ACTIVATED: reason={}, detail={}", reason.getCode(), detail);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.getCode());
        details.put("detail", detail);
        details.put("drawdownPct", state.getCurrentDrawdownPct());
        eventPublisherHelper.publishRiskEvent(
                this, RiskEventType.KILL_SWITCH_TRIGGERED, RiskLevel.CRITICAL, "Kill switch activated", details);
        return true;
    }

    /**
     * Clears an active kill switch. This is the only way to clear it, and it is recorded in the audit trail.
     *
     * @return false if the kill switch was not active
     * @throws BusinessException if operator or note is blank
     */
    public synchronized boolean clearKillSwitch(String operator, String note) {
        if (operator == null || operator.isBlank() || note == null || note.isBlank()) {
            throw new BusinessException("Clearing the kill switch requires an operator and a note");
        }
        if (!state.isKillSwitchActive()) {
            log.info("Kill switch clear requested by {} but it is not active", operator);
            return false;
        }

        KillSwitchReason previous = state.getKillSwitchReason();
        Instant now = clock.instant();
        state.setKillSwitchActive(false);
        state.setKillSwitchReason(null);
        state.setKillSwitchDetail(null);
        state.setKillSwitchActivatedAt(null);
        appendAudit(KillSwitchAuditEntry.builder()
                .action(KillSwitchAuditEntry.Action.CLEARED)
                .reason(previous)
                .operator(operator)
                .note(note)
                .drawdownPct(state.getCurrentDrawdownPct())
                .at(now)
                .build());
        persist();

        log.warn("Kill switch cleared by {} (was {}): {}", operator, previous.getCode(), note);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.KILL_SWITCH_CLEARED,
                RiskLevel.INFO,
                "Kill switch cleared by " + operator,
                Map.of("operator", operator, "note", note, "previousReason", previous.getCode()));
        return true;
    }

    private void appendAudit(KillSwitchAuditEntry entry) {
        List<KillSwitchAuditEntry> audit = state.getKillSwitchAudit();
        audit.add(entry);
        int overflow = audit.size() - Math.max(1, riskLimits.getKillSwitchAuditCapacity());
        if (overflow > 0) {
            audit.subList(0, overflow).clear();
        }
    }

    public synchronized boolean isKillSwitchActive() {
        return state.isKillSwitchActive();
    }

    public synchronized List<KillSwitchAuditEntry> getKillSwitchAudit() {
        return List.copyOf(state.getKillSwitchAudit());
    }

    // ========================
    // CIRCUIT BREAKER
    // ========================

    /**
     * Engages a circuit breaker for a symbol or, with {@link #GLOBAL_SCOPE} or a blank scope, for the
     * whole account. Breakers are kept per scope and reason, so engaging one never replaces another.
     * Automatic breakers expire after the configured cooldown; an automatic engagement never
     * downgrades a manual breaker with the same reason.
     */
    public synchronized void engageCircuitBreaker(String scope, String reason, boolean automatic) {
        engage(scope, reason, automatic, automatic ? riskLimits.getCircuitBreakerCooldown() : null);
    }

    /**
     * Engages an automatic breaker that never expires on its own. It stays until
     * {@link #releaseCircuitBreaker(String, String, String)} lifts that reason or an operator
     * releases the scope.
     */
    public synchronized void engageCircuitBreakerUntilReleased(String scope, String reason) {
        engage(scope, reason, true, null);
    }

    private void engage(String scope, String reason, boolean automatic, Duration cooldown) {
        Objects.requireNonNull(reason, "reason");
        String key = normalizeScope(scope);
        Map<String, CircuitBreakerState> byReason =
                state.getCircuitBreakers().computeIfAbsent(key, k -> new LinkedHashMap<>());
        CircuitBreakerState existing = byReason.get(reason);
        if (existing != null && !existing.isAutomatic() && automatic) {
            log.debug("Manual circuit breaker {} on {} kept; automatic engagement ignored", reason, key);
            return;
        }

        Instant now = clock.instant();
        CircuitBreakerState breaker = CircuitBreakerState.builder()
                .scope(key)
                .reason(reason)
                .automatic(automatic)
                .engagedAt(now)
                .expiresAt(cooldown != null ? now.plus(cooldown) : null)
                .build();
        byReason.put(reason, breaker);
        persist();

        log.warn("Circuit breaker engaged: scope={}, reason={}, automatic={}", key, reason, automatic);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.CIRCUIT_BREAKER_ENGAGED,
                RiskLevel.WARNING,
                "Circuit breaker engaged on " + key,
                Map.of("scope", key, "reason", reason, "automatic", automatic));
    }

    /**
     * Operator release: lifts every breaker on a scope, whatever its reason.
     *
     * @return false if no breaker was engaged there
     */
    public synchronized boolean releaseCircuitBreaker(String scope, String releasedBy) {
        Map<String, CircuitBreakerState> removed = state.getCircuitBreakers().remove(normalizeScope(scope));
        if (removed == null || removed.isEmpty()) {
            return false;
        }
        persist();
        removed.values().forEach(breaker -> publishRelease(breaker, releasedBy));
        return true;
    }

    /**
     * Lifts the breaker with one reason on a scope and leaves any other reason engaged.
     *
     * @return false if that reason was not engaged there
     */
    public synchronized boolean releaseCircuitBreaker(String scope, String reason, String releasedBy) {
        String key = normalizeScope(scope);
        Map<String, CircuitBreakerState> byReason = state.getCircuitBreakers().get(key);
        CircuitBreakerState removed = byReason != null ? byReason.remove(reason) : null;
        if (removed == null) {
            return false;
        }
        if (byReason.isEmpty()) {
            state.getCircuitBreakers().remove(key);
        }
        persist();
        publishRelease(removed, releasedBy);
        return true;
    }

    private void publishRelease(CircuitBreakerState breaker, String releasedBy) {
        String by = releasedBy == null || releasedBy.isBlank() ? SYSTEM_OPERATOR : releasedBy;
        log.info("Circuit breaker released: scope={}, reason={}, by={}", breaker.getScope(), breaker.getReason(), by);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.CIRCUIT_BREAKER_RELEASED,
                RiskLevel.INFO,
                "Circuit breaker released on " + breaker.getScope(),
                Map.of("scope", breaker.getScope(), "releasedBy", by, "reason", breaker.getReason()));
    }

    public synchronized Optional<CircuitBreakerState> getCircuitBreaker(String scope, String reason) {
        Map<String, CircuitBreakerState> byReason = state.getCircuitBreakers().get(normalizeScope(scope));
        return byReason == null ? Optional.empty() : Optional.ofNullable(byReason.get(reason));
    }

    /** Every breaker engaged on exactly this scope, oldest first. */
    public synchronized List<CircuitBreakerState> getCircuitBreakers(String scope) {
        Map<String, CircuitBreakerState> byReason = state.getCircuitBreakers().get(normalizeScope(scope));
        return byReason == null ? List.of() : List.copyOf(byReason.values());
    }

    public synchronized boolean isCircuitBreakerEngaged(String symbol) {
        return hasBreakers(GLOBAL_SCOPE) || hasBreakers(symbol);
    }

    private boolean hasBreakers(String scope) {
        Map<String, CircuitBreakerState> byReason = state.getCircuitBreakers().get(scope);
        return byReason != null && !byReason.isEmpty();
    }

    /** Releases automatic breakers whose cooldown elapsed. */
    public synchronized void expireCircuitBreakers() {
        Instant now = clock.instant();
        List<CircuitBreakerState> expired = new ArrayList<>();
        Iterator<Map<String, CircuitBreakerState>> scopes = state.getCircuitBreakers().values().iterator();
        while (scopes.hasNext()) {
            Map<String, CircuitBreakerState> byReason = scopes.next();
            Iterator<CircuitBreakerState> it = byReason.values().iterator();
            while (it.hasNext()) {
                CircuitBreakerState breaker = it.next();
                if (breaker.isExpired(now)) {
                    it.remove();
                    expired.add(breaker);
                }
            }
            if (byReason.isEmpty()) {
                scopes.remove();
            }
        }
        if (expired.isEmpty()) {
            return;
        }
        persist();
        for (CircuitBreakerState breaker : expired) {
            log.info("Automatic circuit breaker expired: scope={}, reason={}", breaker.getScope(), breaker.getReason());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.CIRCUIT_BREAKER_RELEASED,
                    RiskLevel.INFO,
                    "Circuit breaker expired on " + breaker.getScope(),
                    Map.of("scope", breaker.getScope(), "releasedBy", SYSTEM_OPERATOR, "reason", breaker.getReason()));
        }
    }

    private Set<String> engagedScopes() {
        Set<String> scopes = new HashSet<>();
        state.getCircuitBreakers().forEach((scope, byReason) -> {
            if (!byReason.isEmpty()) {
                scopes.add(scope);
            }
        });
        return scopes;
    }

    private static String normalizeScope(String scope) {
        return scope == null || scope.isBlank() ? GLOBAL_SCOPE : scope;
    }

    // ========================
    // DAY BOUNDARY
    // ========================

    /**
     * Starts a new trading day: daily PnL to zero, peak equity to current equity. Never touches the kill switch.
     */
    public synchronized void resetDaily() {
        BigDecimal previousPnl = state.getDailyRealizedPnl();
        state.setDailyRealizedPnl(BigDecimal.ZERO);
        state.setDailyPeakEquity(state.getCurrentEquity());
        state.setCurrentDrawdownPct(BigDecimal.ZERO);
        state.setSoftLimitAlerted(false);
        state.setDayStart(utcMidnight(clock.instant()));
        persist();

        log.info(
                "Daily risk counters reset: previousPnl={}, peakEquity={}, killSwitchActive={}",
                previousPnl,
                state.getDailyPeakEquity(),
                state.isKillSwitchActive());
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.DAILY_RESET,
                RiskLevel.INFO,
                "Daily risk counters reset",
                Map.of("previousPnl", previousPnl, "dayStart", state.getDayStart().toString()));
    }

    /**
     * Resets the daily counters if the UTC date moved past the current day anchor.
     *
     * @return true if a reset happened
     */
    public synchronized boolean rollDayIfNeeded() {
        Instant today = utcMidnight(clock.instant());
        if (state.getDayStart() == null || today.isAfter(state.getDayStart())) {
            resetDaily();
            return true;
        }
        return false;
    }

    private static Instant utcMidnight(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
    }

    // ========================
    // STATUS
    // ========================

    public synchronized RiskStatus getStatus() {
        return RiskStatus.builder()
                .killSwitchActive(state.isKillSwitchActive())
                .killSwitchReason(state.getKillSwitchReason())
                .killSwitchDetail(state.getKillSwitchDetail())
                .killSwitchActivatedAt(state.getKillSwitchActivatedAt())
                .drawdownPct(state.getCurrentDrawdownPct())
                .dailyPnl(state.getDailyRealizedPnl())
                .currentEquity(state.getCurrentEquity())
                .peakEquity(state.getDailyPeakEquity())
                .openExposure(state.getOpenNotionalExposure())
                .circuitBreakers(state.getCircuitBreakers().values().stream()
                        .flatMap(byReason -> byReason.values().stream())
                        .toList())
                .dayStart(state.getDayStart())
                .build();
    }

    public RiskLimits getRiskLimits() {
        return riskLimits;
    }

    private void persist() {
        riskStateStore.save(state.copy());
    }
}

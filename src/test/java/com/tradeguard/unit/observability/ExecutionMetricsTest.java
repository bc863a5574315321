package com.tradeguard.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.domain.enums.Direction;
import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.KillSwitchReason;
import com.tradeguard.domain.model.Decision;
import com.tradeguard.event.OrderEvent;
import com.tradeguard.event.RiskEvent;
import com.tradeguard.support.CoreHarness;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for ExecutionMetrics over a hand-wired core. Spring does not route events in the harness,
 * so the listener methods are fed the collected events directly.
 */
class ExecutionMetricsTest {

    private CoreHarness core;

    @BeforeEach
    void setUp() {
        core = new CoreHarness();
    }

    private static Decision buy(String sizeHint) {
        return Decision.builder()
                .symbol(CoreHarness.SYMBOL)
                .direction(Direction.LONG)
                .sizeHint(new BigDecimal(sizeHint))
                .confidence(0.5)
                .build();
    }

    private void replayEvents() {
        for (Object event : core.events) {
            if (event instanceof OrderEvent orderEvent) {
                core.executionMetrics.onOrderEvent(orderEvent);
            } else if (event instanceof RiskEvent riskEvent) {
                core.executionMetrics.onRiskEvent(riskEvent);
            }
        }
    }

    private double gauge(String name) {
        return core.meterRegistry.get(name).gauge().value();
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("tradeguard.decisions is tagged with the outcome")
        void decisionsByOutcome() {
            core.dispatcher.execute(buy("0.05"), ExecutionMode.DRY_RUN);
            core.dispatcher.execute(buy("0.5"), ExecutionMode.DRY_RUN);
            core.dispatcher.execute(buy("0.05"), ExecutionMode.PAPER);

            assertThat(core.meterRegistry.counter("tradeguard.decisions", "outcome", "dry_run_approved").count())
                    .isEqualTo(1.0);
            assertThat(core.meterRegistry.counter("tradeguard.decisions", "outcome", "rejected").count())
                    .isEqualTo(1.0);
            assertThat(core.meterRegistry.counter("tradeguard.decisions", "outcome", "filled").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Order events drive placed-by-mode and fill counters")
        void orderEvents() {
            core.dispatcher.execute(buy("0.05"), ExecutionMode.PAPER);
            replayEvents();

            assertThat(core.meterRegistry.counter("tradeguard.orders.placed", "mode", "paper").count())
                    .isEqualTo(1.0);
            assertThat(core.meterRegistry.counter("tradeguard.fills").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Kill switch activations are counted once per activation")
        void killSwitchActivations() {
            core.riskManager.activateKillSwitch(KillSwitchReason.MANUAL, "ops");
            core.riskManager.activateKillSwitch(KillSwitchReason.MANUAL, "ops again");
            replayEvents();

            assertThat(core.meterRegistry.counter("tradeguard.killswitch.activations").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Reconciliation results are tagged success or failure")
        void reconciliations() {
            core.executionMetrics.recordReconciliation(true);
            core.executionMetrics.recordReconciliation(false);
            core.executionMetrics.recordReconciliation(false);

            assertThat(core.meterRegistry.counter("tradeguard.reconciliations", "result", "failure").count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Placement latency feeds the timer")
        void placementLatency() {
            core.executionMetrics.recordPlacementLatency(Duration.ofMillis(40));

            assertThat(core.meterRegistry.get("tradeguard.venue.placement.latency").timer().totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(40.0);
        }
    }

    @Nested
    @DisplayName("Gauges")
    class Gauges {

        @Test
        @DisplayName("Kill switch and open order gauges follow live state")
        void liveState() {
            assertThat(gauge("tradeguard.risk.killswitch.active")).isEqualTo(0.0);

            core.riskManager.activateKillSwitch(KillSwitchReason.MANUAL, "ops");

            assertThat(gauge("tradeguard.risk.killswitch.active")).isEqualTo(1.0);
            assertThat(gauge("tradeguard.orders.open")).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Connection gauge turns stale once the stream is silent past the threshold")
        void staleness() {
            core.connectionMonitor.recordUpdate();
            assertThat(gauge("tradeguard.connection.stale")).isEqualTo(0.0);

            core.clock.advance(Duration.ofSeconds(61));

            assertThat(gauge("tradeguard.connection.stale")).isEqualTo(1.0);
        }
    }
}

package com.tradeguard.observability;

import com.tradeguard.connection.ConnectionMonitor;
import com.tradeguard.domain.enums.ExecutionStatus;
import com.tradeguard.event.OrderEvent;
import com.tradeguard.event.OrderEventType;
import com.tradeguard.event.RiskEvent;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.risk.RiskManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the execution core.
 *
 * <ul>
 *   <li><b>tradeguard.decisions</b> (counter, tag outcome): one per executed decision</li>
 *   <li><b>tradeguard.orders.placed</b> (counter, tag mode): orders registered with the tracker</li>
 *   <li><b>tradeguard.fills</b> (counter): fills applied</li>
 *   <li><b>tradeguard.killswitch.activations</b> (counter)</li>
 *   <li><b>tradeguard.reconciliations</b> (counter, tag result)</li>
 *   <li><b>tradeguard.venue.placement.latency</b> (timer): LIVE placement round trip</li>
 *   <li><b>tradeguard.risk.drawdown</b>, <b>tradeguard.risk.killswitch.active</b>,
 *       <b>tradeguard.orders.open</b>, <b>tradeguard.connection.stale</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer on scrape. Counters are driven by order and risk events.
 */
@Service
public class ExecutionMetrics {

    private static final Logger log = LoggerFactory.getLogger(ExecutionMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter fillsCounter;
    private final Counter killSwitchCounter;
    private final Timer placementTimer;

    public ExecutionMetrics(
            MeterRegistry meterRegistry,
            RiskManager riskManager,
            OrderTracker orderTracker,
            ConnectionMonitor connectionMonitor) {
        this.meterRegistry = meterRegistry;

        this.fillsCounter = Counter.builder("tradeguard.fills")
                .description("Fills applied to tracked orders")
                .register(meterRegistry);

        this.killSwitchCounter = Counter.builder("tradeguard.killswitch.activations")
                .description("Kill switch activations")
                .register(meterRegistry);

        this.placementTimer = Timer.builder("tradeguard.venue.placement.latency")
                .description("Round trip of LIVE order placement until acknowledgement")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(meterRegistry);

        meterRegistry.gauge("tradeguard.risk.drawdown", riskManager, rm -> rm.getStatus()
                .getDrawdownPct()
                .doubleValue());
        meterRegistry.gauge("tradeguard.risk.killswitch.active", riskManager, rm -> rm.isKillSwitchActive() ? 1.0 : 0.0);
        meterRegistry.gauge("tradeguard.orders.open", orderTracker, t -> t.openOrders().size());
        meterRegistry.gauge(
                "tradeguard.connection.stale", connectionMonitor, m -> m.snapshot().isStale() ? 1.0 : 0.0);
    }

    public void recordDecision(ExecutionStatus status) {
        meterRegistry
                .counter("tradeguard.decisions", "outcome", status.name().toLowerCase(Locale.ROOT))
                .increment();
    }

    public void recordPlacementLatency(Duration elapsed) {
        placementTimer.record(elapsed);
    }

    public void recordReconciliation(boolean success) {
        meterRegistry
                .counter("tradeguard.reconciliations", "result", success ? "success" : "failure")
                .increment();
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() == OrderEventType.PLACED) {
            meterRegistry
                    .counter("tradeguard.orders.placed", "mode", event.getOrder().getMode().name().toLowerCase(Locale.ROOT))
                    .increment();
        } else if (event.getEventType() == OrderEventType.FILLED
                || event.getEventType() == OrderEventType.PARTIALLY_FILLED) {
            fillsCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.KILL_SWITCH_TRIGGERED) {
            killSwitchCounter.increment();
            log.debug("Kill switch activation counted: {}", event.getDetails().get("reason"));
        }
    }
}

package com.tradeguard.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradeguard.domain.enums.Direction;
import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.ExecutionStatus;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.Decision;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import com.tradeguard.exception.VenueTransientException;
import com.tradeguard.execution.ExecutionResult;
import com.tradeguard.execution.VenueEventProcessor;
import com.tradeguard.support.CoreHarness;
import com.tradeguard.venue.OrderPlacement;
import com.tradeguard.venue.VenueAck;
import com.tradeguard.venue.VenueEvent;
import com.tradeguard.venue.VenueEventChannel;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for VenueEventProcessor: event matching, indeterminate confirmation, reconciliation
 * triggers and connection telemetry.
 */
class VenueEventProcessorTest {

    private CoreHarness core;

    @BeforeEach
    void setUp() {
        core = new CoreHarness();
    }

    private static Decision buy() {
        return Decision.builder()
                .symbol(CoreHarness.SYMBOL)
                .direction(Direction.LONG)
                .sizeHint(new BigDecimal("0.05"))
                .confidence(0.8)
                .build();
    }

    private String placeLive() {
        return placeLive("v-1");
    }

    /** Places a LIVE order of 5 acknowledged under the given venue id and clears the venue mock's history. */
    private String placeLive(String venueId) {
        when(core.venueClient.placeOrder(any(OrderPlacement.class))).thenAnswer(inv -> {
            OrderPlacement placement = inv.getArgument(0);
            return new VenueAck(placement.getClientId(), venueId, core.clock.instant());
        });
        String clientId = core.dispatcher.execute(buy(), ExecutionMode.LIVE).getClientOrderId();
        clearInvocations(core.venueClient);
        return clientId;
    }

    /** Leaves a LIVE placement indeterminate: the send fails on transport and the status cannot be read. */
    private String placeIndeterminate() {
        when(core.venueClient.placeOrder(any())).thenThrow(new VenueTransientException("socket closed"));
        when(core.venueClient.getOrderStatus(anyString())).thenThrow(new VenueTransientException("socket closed"));
        ExecutionResult result = core.dispatcher.execute(buy(), ExecutionMode.LIVE);
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.INDETERMINATE);
        return result.getClientOrderId();
    }

    private Fill fill(String id, String qty, String price) {
        return Fill.builder()
                .fillId(id)
                .qty(new BigDecimal(qty))
                .price(new BigDecimal(price))
                .timestamp(core.clock.instant())
                .build();
    }

    private Order order(String clientId) {
        return core.orderTracker.get(clientId).orElseThrow();
    }

    private double reconciliations(String result) {
        return core.meterRegistry.counter("tradeguard.reconciliations", "result", result).count();
    }

    // ========================
    // TRACKED ORDERS
    // ========================

    @Nested
    @DisplayName("Events for tracked orders")
    class Tracked {

        @Test
        @DisplayName("Fills are applied in delivery order and accumulate")
        void fills_accumulate() {
            String clientId = placeLive();

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", fill("t-1", "2", "100")));
            assertThat(order(clientId).getState()).isEqualTo(OrderState.PARTIALLY_FILLED);

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", fill("t-2", "3", "102")));

            Order filled = order(clientId);
            assertThat(filled.getState()).isEqualTo(OrderState.FILLED);
            assertThat(filled.getAvgFillPrice()).isEqualByComparingTo("101.2");
            assertThat(core.positionLedger.netQuantity(CoreHarness.SYMBOL)).isEqualByComparingTo("5");
        }

        @Test
        @DisplayName("Replayed fill with the same trade id is ignored")
        void replayedFill_ignored() {
            String clientId = placeLive();

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", fill("t-1", "2", "100")));
            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", fill("t-1", "2", "100")));

            assertThat(order(clientId).getFilledQty()).isEqualByComparingTo("2");
            verifyNoInteractions(core.venueClient);
        }

        @Test
        @DisplayName("Event carrying only the venue id is matched through it")
        void venueIdOnly_matched() {
            String clientId = placeLive();

            core.eventProcessor.process(VenueEvent.cancelled(null, "v-1"));

            assertThat(order(clientId).getState()).isEqualTo(OrderState.CANCELLED);
        }

        @Test
        @DisplayName("Venue rejection and expiry end the order")
        void rejectAndExpire() {
            String first = placeLive();
            core.eventProcessor.process(VenueEvent.rejected(first, "v-1", "post only would cross"));
            assertThat(order(first).getState()).isEqualTo(OrderState.REJECTED);
            assertThat(order(first).getRejectReason()).isEqualTo("post only would cross");

            String second = placeLive("v-2");
            core.eventProcessor.process(VenueEvent.expired(second, null));
            assertThat(order(second).getState()).isEqualTo(OrderState.EXPIRED);
        }
    }

    // ========================
    // RECONCILIATION TRIGGERS
    // ========================

    @Nested
    @DisplayName("Reconciliation triggers")
    class Triggers {

        @Test
        @DisplayName("Event for an order nobody knows triggers reconciliation")
        void unknownOrder_reconciles() {
            core.eventProcessor.process(VenueEvent.filled("ghost", "v-404", fill("t-9", "1", "100")));

            verify(core.venueClient).openOrders();
            assertThat(reconciliations("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Fill after a confirmed cancel contradicts local state and triggers reconciliation")
        void fillAfterCancel_reconciles() {
            String clientId = placeLive();
            core.eventProcessor.process(VenueEvent.cancelled(clientId, "v-1"));

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", fill("t-1", "1", "100")));

            verify(core.venueClient).openOrders();
            assertThat(order(clientId).getState()).isEqualTo(OrderState.CANCELLED);
        }

        @Test
        @DisplayName("Overfill is refused and triggers reconciliation")
        void overfill_reconciles() {
            String clientId = placeLive();

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", fill("t-1", "6", "100")));

            verify(core.venueClient).openOrders();
            assertThat(order(clientId).getFilledQty()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Reconnect with LIVE exposure reconciles, without it does not")
        void reconnect_reconcilesOnlyWithExposure() {
            core.eventProcessor.process(VenueEvent.connectionUp());
            verifyNoInteractions(core.venueClient);

            placeLive();
            when(core.venueClient.openOrders()).thenReturn(List.of());
            core.eventProcessor.process(VenueEvent.connectionUp());

            verify(core.venueClient).openOrders();
            assertThat(core.connectionMonitor.snapshot().getReconnectCountInWindow()).isEqualTo(2);
        }
    }

    // ========================
    // INDETERMINATE PLACEMENTS
    // ========================

    @Nested
    @DisplayName("Events for indeterminate placements")
    class Indeterminate {

        @Test
        @DisplayName("Acknowledgement registers the order as OPEN")
        void ack_registers() {
            String clientId = placeIndeterminate();

            core.eventProcessor.process(VenueEvent.acknowledged(clientId, "v-3"));

            assertThat(order(clientId).getState()).isEqualTo(OrderState.OPEN);
            assertThat(order(clientId).getVenueId()).isEqualTo("v-3");
            assertThat(core.indeterminateOrders.contains(clientId)).isFalse();
        }

        @Test
        @DisplayName("Fill registers the order and then applies the fill")
        void fill_registersThenApplies() {
            String clientId = placeIndeterminate();

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-3", fill("t-1", "5", "100.1")));

            assertThat(order(clientId).getState()).isEqualTo(OrderState.FILLED);
            assertThat(core.positionLedger.netQuantity(CoreHarness.SYMBOL)).isEqualByComparingTo("5");
        }

        @Test
        @DisplayName("Rejection registers the order as REJECTED")
        void reject_registers() {
            String clientId = placeIndeterminate();

            core.eventProcessor.process(VenueEvent.rejected(clientId, null, "insufficient balance"));

            assertThat(order(clientId).getState()).isEqualTo(OrderState.REJECTED);
            assertThat(core.indeterminateOrders.contains(clientId)).isFalse();
        }
    }

    // ========================
    // CONNECTION TELEMETRY
    // ========================

    @Nested
    @DisplayName("Connection telemetry")
    class Telemetry {

        @Test
        @DisplayName("Every order event is an update; latency comes from the venue timestamp")
        void orderEvent_recordsLatency() {
            String clientId = placeLive();
            Fill late = Fill.builder()
                    .fillId("t-1")
                    .qty(new BigDecimal("1"))
                    .price(new BigDecimal("100"))
                    .timestamp(core.clock.instant().minusMillis(120))
                    .build();

            core.eventProcessor.process(VenueEvent.filled(clientId, "v-1", late));

            assertThat(core.connectionMonitor.snapshot().getLastUpdateAt()).isEqualTo(core.clock.instant());
            assertThat(core.connectionMonitor.snapshot().getLatencyP95Ms()).isEqualTo(120L);
        }

        @Test
        @DisplayName("Stream drops and errors count towards the error rate")
        void errors_counted() {
            core.eventProcessor.process(VenueEvent.connectionDown("EOF"));
            core.eventProcessor.process(VenueEvent.error("bad frame"));

            assertThat(core.connectionMonitor.snapshot().getConsecutiveErrorsInWindow()).isEqualTo(2);
            verify(core.venueClient, never()).openOrders();
        }
    }

    @Test
    @DisplayName("Started processor drains the channel on its own thread")
    void lifecycle_drainsChannel() throws Exception {
        String clientId = placeLive();
        VenueEventChannel channel = new VenueEventChannel(16);
        VenueEventProcessor processor = new VenueEventProcessor(
                channel,
                core.orderTracker,
                core.orderStateApplier,
                core.indeterminateOrders,
                core.reconciliationService,
                core.connectionMonitor,
                core.accountLock,
                core.clock);

        processor.start();
        try {
            channel.publish(VenueEvent.filled(clientId, "v-1", fill("t-1", "5", "100")));

            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (order(clientId).getState() != OrderState.FILLED && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(order(clientId).getState()).isEqualTo(OrderState.FILLED);
            assertThat(processor.isRunning()).isTrue();
        } finally {
            processor.stop();
        }
        assertThat(processor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Interrupt from outside stops the processor instead of spinning")
    void foreignInterrupt_stops() throws Exception {
        VenueEventProcessor processor = new VenueEventProcessor(
                new VenueEventChannel(16),
                core.orderTracker,
                core.orderStateApplier,
                core.indeterminateOrders,
                core.reconciliationService,
                core.connectionMonitor,
                core.accountLock,
                core.clock);
        processor.start();

        List<Thread> consumers = Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().equals("venue-event-processor") && t.isAlive())
                .toList();
        assertThat(consumers).isNotEmpty();
        consumers.forEach(Thread::interrupt);

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (processor.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(processor.isRunning()).isFalse();
        for (Thread consumer : consumers) {
            consumer.join(5000);
            assertThat(consumer.isAlive()).isFalse();
        }
    }
}

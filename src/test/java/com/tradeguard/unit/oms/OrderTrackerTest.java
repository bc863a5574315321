package com.tradeguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.enums.OrderType;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import com.tradeguard.exception.DuplicateClientIdException;
import com.tradeguard.exception.FillExceedsQuantityException;
import com.tradeguard.exception.InvalidTransitionException;
import com.tradeguard.exception.UnknownOrderException;
import com.tradeguard.oms.OrderStats;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for OrderTracker covering the order state machine, fill accumulation,
 * duplicate protection and archiving.
 */
class OrderTrackerTest {

    private MutableClock clock;
    private OrderTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        tracker = new OrderTracker(clock);
    }

    private static Order order(String clientId, String qty) {
        return Order.builder()
                .clientId(clientId)
                .symbol("BTCUSDT")
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .requestedQty(new BigDecimal(qty))
                .referencePrice(new BigDecimal("100"))
                .mode(ExecutionMode.LIVE)
                .build();
    }

    private static Fill fill(String fillId, String qty, String price, boolean isFinal) {
        return Fill.builder()
                .fillId(fillId)
                .qty(new BigDecimal(qty))
                .price(new BigDecimal(price))
                .isFinal(isFinal)
                .build();
    }

    private void openOrder(String clientId, String qty) {
        tracker.submit(order(clientId, qty));
        tracker.acknowledge(clientId, "v-" + clientId);
    }

    // ========================
    // SUBMISSION
    // ========================

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("Submitted order starts SUBMITTED with nothing filled")
        void submit_registersSubmitted() {
            tracker.submit(order("c1", "1.0"));

            Order stored = tracker.get("c1").orElseThrow();
            assertThat(stored.getState()).isEqualTo(OrderState.SUBMITTED);
            assertThat(stored.getFilledQty()).isEqualByComparingTo("0");
            assertThat(stored.getAvgFillPrice()).isNull();
            assertThat(stored.getVenueId()).isNull();
            assertThat(stored.getCreatedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Duplicate client id is refused and the original order is untouched")
        void duplicateClientId_refusedWithoutMutation() {
            openOrder("c1", "1.0");
            Order before = tracker.get("c1").orElseThrow();

            assertThatThrownBy(() -> tracker.submit(order("c1", "5.0")))
                    .isInstanceOf(DuplicateClientIdException.class);

            assertThat(tracker.get("c1")).contains(before);
            assertThat(tracker.openOrders()).hasSize(1);
            assertThat(tracker.stats().getTrackedOrders()).isEqualTo(1);
        }

        @Test
        @DisplayName("Non-positive quantity is refused")
        void zeroQuantity_refused() {
            assertThatThrownBy(() -> tracker.submit(order("c1", "0")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(tracker.get("c1")).isEmpty();
        }
    }

    // ========================
    // ACKNOWLEDGEMENT
    // ========================

    @Nested
    @DisplayName("Acknowledgement")
    class Acknowledgement {

        @Test
        @DisplayName("Acknowledge binds the venue id and opens the order")
        void acknowledge_opensOrder() {
            tracker.submit(order("c1", "1.0"));

            tracker.acknowledge("c1", "v1");

            assertThat(tracker.get("c1").orElseThrow().getState()).isEqualTo(OrderState.OPEN);
            assertThat(tracker.findByVenueId("v1")).map(Order::getClientId).contains("c1");
        }

        @Test
        @DisplayName("Repeated acknowledgement with the same venue id is a no-op")
        void sameVenueId_idempotent() {
            tracker.submit(order("c1", "1.0"));
            tracker.acknowledge("c1", "v1");
            Order before = tracker.get("c1").orElseThrow();

            tracker.acknowledge("c1", "v1");

            assertThat(tracker.get("c1")).contains(before);
        }

        @Test
        @DisplayName("Acknowledgement with a different venue id is an invalid transition")
        void differentVenueId_refused() {
            tracker.submit(order("c1", "1.0"));
            tracker.acknowledge("c1", "v1");

            assertThatThrownBy(() -> tracker.acknowledge("c1", "v2"))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(tracker.get("c1").orElseThrow().getVenueId()).isEqualTo("v1");
        }

        @Test
        @DisplayName("A venue id already bound to another order is refused")
        void venueIdBoundElsewhere_refused() {
            openOrder("c1", "1.0");
            tracker.submit(order("c2", "1.0"));

            assertThatThrownBy(() -> tracker.acknowledge("c2", "v-c1"))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(tracker.get("c2").orElseThrow().getState()).isEqualTo(OrderState.SUBMITTED);
        }

        @Test
        @DisplayName("Unknown client id raises UnknownOrderException")
        void unknownOrder_raises() {
            assertThatThrownBy(() -> tracker.acknowledge("missing", "v1"))
                    .isInstanceOf(UnknownOrderException.class);
        }
    }

    // ========================
    // FILLS
    // ========================

    @Nested
    @DisplayName("Fill accumulation")
    class Fills {

        @Test
        @DisplayName("Partial then final fill gives the quantity-weighted average")
        void partialThenFinal_weightedAverage() {
            tracker.submit(order("c1", "1.0"));
            tracker.acknowledge("c1", "v1");

            Order partial = tracker.applyFill("c1", fill("f1", "0.4", "100", false));
            assertThat(partial.getState()).isEqualTo(OrderState.PARTIALLY_FILLED);
            assertThat(partial.getAvgFillPrice()).isEqualByComparingTo("100");

            Order filled = tracker.applyFill("c1", fill("f2", "0.6", "102", true));
            assertThat(filled.getState()).isEqualTo(OrderState.FILLED);
            assertThat(filled.getAvgFillPrice()).isEqualByComparingTo("101.2");
            assertThat(filled.getFilledQty()).isEqualByComparingTo("1.0");
            assertThat(tracker.fills("c1")).hasSize(2);
        }

        @Test
        @DisplayName("Reaching the requested quantity fills the order even without a final flag")
        void fullQuantity_fillsOrder() {
            openOrder("c1", "2");

            Order filled = tracker.applyFill("c1", fill("f1", "2", "50", false));

            assertThat(filled.getState()).isEqualTo(OrderState.FILLED);
        }

        @Test
        @DisplayName("Final flag completes an order short of its requested quantity")
        void finalFlag_completesShortOrder() {
            openOrder("c1", "2");

            Order filled = tracker.applyFill("c1", fill("f1", "1.5", "50", true));

            assertThat(filled.getState()).isEqualTo(OrderState.FILLED);
            assertThat(filled.getFilledQty()).isEqualByComparingTo("1.5");
        }

        @Test
        @DisplayName("Replayed fill id is ignored")
        void duplicateFillId_ignored() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", fill("f1", "0.4", "100", false));

            Order replayed = tracker.applyFill("c1", fill("f1", "0.4", "100", false));

            assertThat(replayed.getFilledQty()).isEqualByComparingTo("0.4");
            assertThat(tracker.fills("c1")).hasSize(1);
        }

        @Test
        @DisplayName("Overfill is refused and leaves the order unchanged")
        void overfill_refused() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", fill("f1", "0.8", "100", false));

            assertThatThrownBy(() -> tracker.applyFill("c1", fill("f2", "0.3", "100", false)))
                    .isInstanceOf(FillExceedsQuantityException.class);

            Order order = tracker.get("c1").orElseThrow();
            assertThat(order.getFilledQty()).isEqualByComparingTo("0.8");
            assertThat(order.getState()).isEqualTo(OrderState.PARTIALLY_FILLED);
        }

        @Test
        @DisplayName("Fill before acknowledgement is an invalid transition")
        void fillOnSubmitted_refused() {
            tracker.submit(order("c1", "1.0"));

            assertThatThrownBy(() -> tracker.applyFill("c1", fill("f1", "0.5", "100", false)))
                    .isInstanceOf(InvalidTransitionException.class)
                    .extracting(e -> ((InvalidTransitionException) e).getFrom())
                    .isEqualTo(OrderState.SUBMITTED);
        }

        @Test
        @DisplayName("Commission accumulates across fills")
        void commission_accumulates() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", Fill.builder().fillId("f1").qty(new BigDecimal("0.5"))
                    .price(new BigDecimal("100")).commission(new BigDecimal("0.05")).build());
            tracker.applyFill("c1", Fill.builder().fillId("f2").qty(new BigDecimal("0.5"))
                    .price(new BigDecimal("100")).commission(new BigDecimal("0.07")).build());

            assertThat(tracker.get("c1").orElseThrow().getCommissionTotal()).isEqualByComparingTo("0.12");
        }

        @Test
        @DisplayName("Non-positive fill price is refused")
        void zeroPrice_refused() {
            openOrder("c1", "1.0");

            assertThatThrownBy(() -> tracker.applyFill("c1", fill("f1", "0.5", "0", false)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========================
    // TERMINAL STATES
    // ========================

    @Nested
    @DisplayName("Terminal states")
    class TerminalStates {

        @Test
        @DisplayName("Any transition out of FILLED fails loudly")
        void filled_isFinal() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", fill("f1", "1.0", "100", true));

            assertThatThrownBy(() -> tracker.cancel("c1")).isInstanceOf(InvalidTransitionException.class);
            assertThatThrownBy(() -> tracker.expire("c1")).isInstanceOf(InvalidTransitionException.class);
            assertThatThrownBy(() -> tracker.reject("c1", "late")).isInstanceOf(InvalidTransitionException.class);
            assertThatThrownBy(() -> tracker.applyFill("c1", fill("f2", "0.1", "100", false)))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(tracker.get("c1").orElseThrow().getState()).isEqualTo(OrderState.FILLED);
        }

        @Test
        @DisplayName("Cancel keeps the partial fill")
        void cancelPartial_keepsFill() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", fill("f1", "0.3", "100", false));

            tracker.cancel("c1");

            Order order = tracker.get("c1").orElseThrow();
            assertThat(order.getState()).isEqualTo(OrderState.CANCELLED);
            assertThat(order.getFilledQty()).isEqualByComparingTo("0.3");
            assertThat(tracker.openOrders()).isEmpty();
        }

        @Test
        @DisplayName("Cancel of a SUBMITTED order is refused")
        void cancelSubmitted_refused() {
            tracker.submit(order("c1", "1.0"));

            assertThatThrownBy(() -> tracker.cancel("c1")).isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("Reject is allowed from OPEN while nothing is filled")
        void rejectOpenUnfilled_allowed() {
            openOrder("c1", "1.0");

            tracker.reject("c1", "post_only_would_cross");

            Order order = tracker.get("c1").orElseThrow();
            assertThat(order.getState()).isEqualTo(OrderState.REJECTED);
            assertThat(order.getRejectReason()).isEqualTo("post_only_would_cross");
        }

        @Test
        @DisplayName("Reject after a partial fill is refused")
        void rejectPartiallyFilled_refused() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", fill("f1", "0.3", "100", false));

            assertThatThrownBy(() -> tracker.reject("c1", "late")).isInstanceOf(InvalidTransitionException.class);
        }
    }

    // ========================
    // RECONCILIATION
    // ========================

    @Nested
    @DisplayName("Adopting the venue view")
    class Adopt {

        @Test
        @DisplayName("Untracked order is inserted and indexed by venue id")
        void adoptUntracked_inserts() {
            tracker.adopt(order("c9", "2").toBuilder()
                    .venueId("v9")
                    .state(OrderState.PARTIALLY_FILLED)
                    .filledQty(new BigDecimal("1"))
                    .avgFillPrice(new BigDecimal("99"))
                    .build());

            assertThat(tracker.findByVenueId("v9")).map(Order::getState).contains(OrderState.PARTIALLY_FILLED);
        }

        @Test
        @DisplayName("Terminal local order cannot be overwritten")
        void adoptOverTerminal_refused() {
            openOrder("c1", "1.0");
            tracker.cancel("c1");

            assertThatThrownBy(() -> tracker.adopt(order("c1", "1.0").toBuilder().state(OrderState.OPEN).build()))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    // ========================
    // REPORTING AND ARCHIVE
    // ========================

    @Nested
    @DisplayName("Stats and archive")
    class StatsAndArchive {

        @Test
        @DisplayName("Stats count orders by state and total filled notional")
        void stats_countByState() {
            openOrder("c1", "1.0");
            tracker.applyFill("c1", fill("f1", "1.0", "100", true));
            openOrder("c2", "1.0");
            tracker.submit(order("c3", "1.0"));
            tracker.reject("c3", "insufficient_balance");

            OrderStats stats = tracker.stats();

            assertThat(stats.getTrackedOrders()).isEqualTo(3);
            assertThat(stats.getOpenOrders()).isEqualTo(1);
            assertThat(stats.getFilledOrders()).isEqualTo(1);
            assertThat(stats.getRejectedOrders()).isEqualTo(1);
            assertThat(stats.getFilledNotional()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Open order notional prices the remainder at the reference price, then the average fill")
        void openOrderNotional_pricesRemainder() {
            openOrder("c1", "2");
            assertThat(tracker.openOrderNotional()).isEqualByComparingTo("200");

            tracker.applyFill("c1", fill("f1", "0.5", "110", false));

            assertThat(tracker.openOrderNotional()).isEqualByComparingTo("165");
        }

        @Test
        @DisplayName("Archived terminal orders disappear but their client ids stay reserved")
        void archive_reservesClientIds() {
            openOrder("c1", "1.0");
            tracker.cancel("c1");
            openOrder("c2", "1.0");
            clock.advance(Duration.ofHours(25));

            int archived = tracker.archiveTerminal(clock.instant().minus(Duration.ofHours(24)));

            assertThat(archived).isEqualTo(1);
            assertThat(tracker.get("c1")).isEmpty();
            assertThat(tracker.get("c2")).isPresent();
            assertThat(tracker.stats().getArchivedOrders()).isEqualTo(1);
            assertThatThrownBy(() -> tracker.submit(order("c1", "1.0")))
                    .isInstanceOf(DuplicateClientIdException.class);
        }
    }
}

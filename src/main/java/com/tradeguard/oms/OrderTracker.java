package com.tradeguard.oms;

import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import com.tradeguard.exception.DuplicateClientIdException;
import com.tradeguard.exception.FillExceedsQuantityException;
import com.tradeguard.exception.InvalidTransitionException;
import com.tradeguard.exception.UnknownOrderException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
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
import org.springframework.stereotype.Component;

/**
 * Authoritative store of orders and their fills for one account.
 *
 * <p>Maps client order ids to venue ids, accumulates partial fills into a running
 * quantity-weighted average price and a commission total, and enforces the order state
 * machine described on {@link OrderState}. Every transition replaces the stored
 * {@link Order} snapshot, so callers only ever see immutable values.
 *
 * <p>Failure behaviour:
 * <ul>
 *   <li>Every rejected operation leaves the tracker exactly as it was</li>
 *   <li>Transitions out of a terminal state throw {@link InvalidTransitionException}
 *       instead of silently doing nothing, so desynchronisation with the venue surfaces</li>
 *   <li>Fills carrying a venue fill id are de-duplicated; fills without one are assumed to be
 *       delivered at most once</li>
 * </ul>
 *
 * <p>All public methods are synchronized on the tracker. Callers that need a consistent view
 * across the tracker and the risk manager hold the account lock around both.
 */
@Component
public class OrderTracker {

    private static final Logger log = LoggerFactory.getLogger(OrderTracker.class);

    static final int PRICE_SCALE = 10;

    private final Clock clock;

    /** Insertion-ordered so open order snapshots come back in submission order. */
    private final Map<String, Order> orders = new LinkedHashMap<>();

    private final Map<String, String> clientIdByVenueId = new HashMap<>();
    private final Map<String, List<Fill>> fillsByClientId = new HashMap<>();
    private final Map<String, Set<String>> seenFillIds = new HashMap<>();

    /** Client ids of archived orders. Kept so an id can never be registered twice. */
    private final Set<String> retiredClientIds = new HashSet<>();

    public OrderTracker(Clock clock) {
        this.clock = clock;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Registers a new order in SUBMITTED state.
     *
     * @throws DuplicateClientIdException if the client id was ever registered before
     */
    public synchronized void submit(Order order) {
        Objects.requireNonNull(order, "order");
        requireText(order.getClientId(), "clientId");
        requireText(order.getSymbol(), "symbol");
        if (order.getRequestedQty() == null || order.getRequestedQty().signum() <= 0) {
            throw new IllegalArgumentException("requestedQty must be positive for order " + order.getClientId());
        }

        String clientId = order.getClientId();
        if (orders.containsKey(clientId) || retiredClientIds.contains(clientId)) {
            throw new DuplicateClientIdException(clientId);
        }

        Instant now = clock.instant();
        Order registered = order.toBuilder()
                .venueId(null)
                .state(OrderState.SUBMITTED)
                .filledQty(BigDecimal.ZERO)
                .avgFillPrice(null)
                .commissionTotal(BigDecimal.ZERO)
                .createdAt(order.getCreatedAt() != null ? order.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        orders.put(clientId, registered);
        fillsByClientId.put(clientId, new ArrayList<>());

        log.info(
                "Order submitted: clientId={}, {} {} {} @ {}",
                clientId,
                registered.getSide(),
                registered.getRequestedQty().toPlainString(),
                registered.getSymbol(),
                registered.getLimitPrice() != null ? registered.getLimitPrice().toPlainString() : "MARKET");
    }

    /**
     * Binds the venue id and moves SUBMITTED to OPEN. Re-acknowledging a working order with the
     * venue id it already carries is a no-op; any other venue id is rejected.
     */
    public synchronized void acknowledge(String clientId, String venueId) {
        requireText(venueId, "venueId");
        Order order = require(clientId);

        if (order.isTerminal()) {
            throw new InvalidTransitionException(clientId, order.getState(), "acknowledge");
        }
        if (order.getState() != OrderState.SUBMITTED) {
            if (venueId.equals(order.getVenueId())) {
                log.debug("Duplicate acknowledgement ignored: clientId={}, venueId={}", clientId, venueId);
                return;
            }
            throw new InvalidTransitionException(clientId, order.getState(), "re-acknowledge with venue id " + venueId);
        }

        String boundTo = clientIdByVenueId.get(venueId);
        if (boundTo != null && !boundTo.equals(clientId)) {
            throw new InvalidTransitionException(
                    clientId, order.getState(), "bind venue id " + venueId + " already bound to " + boundTo);
        }

        replace(order.toBuilder().venueId(venueId).state(OrderState.OPEN));
        clientIdByVenueId.put(venueId, clientId);
        log.info("Order acknowledged: clientId={}, venueId={}", clientId, venueId);
    }

    /**
     * Applies one fill and returns the updated snapshot.
     *
     * <p>The average price is maintained as a running weighted average:
     * {@code avg = (avg * filledOld + price * qty) / (filledOld + qty)}. The order becomes FILLED
     * when the fill is final or the requested quantity is reached, PARTIALLY_FILLED otherwise.
     *
     * @throws FillExceedsQuantityException if the fill would overfill the order
     * @throws InvalidTransitionException   if the order is terminal or not yet acknowledged
     */
    public synchronized Order applyFill(String clientId, Fill fill) {
        Objects.requireNonNull(fill, "fill");
        if (fill.getQty() == null || fill.getQty().signum() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive for order " + clientId);
        }
        if (fill.getPrice() == null || fill.getPrice().signum() <= 0) {
            throw new IllegalArgumentException("Fill price must be positive for order " + clientId);
        }

        Order order = require(clientId);

        String fillId = fill.getFillId();
        if (fillId != null && seenFillIds.getOrDefault(clientId, Set.of()).contains(fillId)) {
            log.debug("Duplicate fill ignored: clientId={}, fillId={}", clientId, fillId);
            return order;
        }

        if (order.isTerminal() || order.getState() == OrderState.SUBMITTED) {
            throw new InvalidTransitionException(clientId, order.getState(), "apply fill to");
        }

        BigDecimal filledOld = order.getFilledQty();
        BigDecimal filledNew = filledOld.add(fill.getQty());
        if (filledNew.compareTo(order.getRequestedQty()) > 0) {
            throw new FillExceedsQuantityException(clientId, filledOld, fill.getQty(), order.getRequestedQty());
        }

        BigDecimal avg = order.getAvgFillPrice() == null
                ? fill.getPrice()
                : order.getAvgFillPrice()
                        .multiply(filledOld)
                        .add(fill.getNotional())
                        .divide(filledNew, PRICE_SCALE, RoundingMode.HALF_UP);

        boolean complete = fill.isFinal() || filledNew.compareTo(order.getRequestedQty()) == 0;
        OrderState next = complete ? OrderState.FILLED : OrderState.PARTIALLY_FILLED;
        BigDecimal commission = fill.getCommission() != null ? fill.getCommission() : BigDecimal.ZERO;

        Order updated = replace(order.toBuilder()
                .filledQty(filledNew)
                .avgFillPrice(avg)
                .commissionTotal(order.getCommissionTotal().add(commission))
                .state(next));

        fillsByClientId.computeIfAbsent(clientId, k -> new ArrayList<>()).add(fill);
        if (fillId != null) {
            seenFillIds.computeIfAbsent(clientId, k -> new HashSet<>()).add(fillId);
        }

        log.info(
                "Fill applied: clientId={}, qty={}, price={}, filled={}/{}, avg={}, state={}",
                clientId,
                fill.getQty().toPlainString(),
                fill.getPrice().toPlainString(),
                filledNew.toPlainString(),
                order.getRequestedQty().toPlainString(),
                avg.stripTrailingZeros().toPlainString(),
                next);
        return updated;
    }

    /** Confirms a venue cancellation. Never called optimistically when a cancel is merely requested. */
    public synchronized void cancel(String clientId) {
        Order order = require(clientId);
        if (!order.getState().isWorking()) {
            throw new InvalidTransitionException(clientId, order.getState(), "cancel");
        }
        replace(order.toBuilder().state(OrderState.CANCELLED));
        log.info("Order cancelled: clientId={}, filled={}", clientId, order.getFilledQty().toPlainString());
    }

    /**
     * Rejects a SUBMITTED order, or an OPEN order the venue rejected after acknowledging it
     * before any fill arrived.
     */
    public synchronized void reject(String clientId, String reason) {
        Order order = require(clientId);
        boolean allowed = order.getState() == OrderState.SUBMITTED
                || (order.getState() == OrderState.OPEN && order.getFilledQty().signum() == 0);
        if (!allowed) {
            throw new InvalidTransitionException(clientId, order.getState(), "reject");
        }
        replace(order.toBuilder().state(OrderState.REJECTED).rejectReason(reason));
        log.warn("Order rejected: clientId={}, reason={}", clientId, reason);
    }

    public synchronized void expire(String clientId) {
        Order order = require(clientId);
        if (!order.getState().isWorking()) {
            throw new InvalidTransitionException(clientId, order.getState(), "expire");
        }
        replace(order.toBuilder().state(OrderState.EXPIRED));
        log.info("Order expired: clientId={}, filled={}", clientId, order.getFilledQty().toPlainString());
    }

    /**
     * Inserts or overwrites a non-terminal order with the venue's authoritative view.
     * Only reconciliation calls this; it deliberately bypasses the incremental transitions.
     */
    public synchronized void adopt(Order authoritative) {
        Objects.requireNonNull(authoritative, "authoritative");
        String clientId = authoritative.getClientId();
        requireText(clientId, "clientId");
        if (authoritative.getFilledQty().compareTo(authoritative.getRequestedQty()) > 0) {
            throw new FillExceedsQuantityException(
                    clientId, BigDecimal.ZERO, authoritative.getFilledQty(), authoritative.getRequestedQty());
        }

        Order existing = orders.get(clientId);
        if (existing != null && existing.isTerminal()) {
            throw new InvalidTransitionException(clientId, existing.getState(), "reconcile");
        }
        if (existing == null && retiredClientIds.contains(clientId)) {
            throw new DuplicateClientIdException(clientId);
        }

        if (existing != null && existing.getVenueId() != null) {
            clientIdByVenueId.remove(existing.getVenueId());
        }
        Order adopted = authoritative.toBuilder()
                .createdAt(existing != null ? existing.getCreatedAt() : authoritative.getCreatedAt())
                .updatedAt(clock.instant())
                .build();
        orders.put(clientId, adopted);
        fillsByClientId.computeIfAbsent(clientId, k -> new ArrayList<>());
        if (adopted.getVenueId() != null) {
            clientIdByVenueId.put(adopted.getVenueId(), clientId);
        }
        log.warn(
                "Order reconciled from venue: clientId={}, state={} -> {}, filled={}",
                clientId,
                existing != null ? existing.getState() : "UNTRACKED",
                adopted.getState(),
                adopted.getFilledQty().toPlainString());
    }

    /**
     * Drops terminal orders last updated before the cutoff. Their client ids stay reserved.
     *
     * @return number of orders archived
     */
    public synchronized int archiveTerminal(Instant cutoff) {
        int archived = 0;
        Iterator<Map.Entry<String, Order>> it = orders.entrySet().iterator();
        while (it.hasNext()) {
            Order order = it.next().getValue();
            if (order.isTerminal() && order.getUpdatedAt().isBefore(cutoff)) {
                it.remove();
                retiredClientIds.add(order.getClientId());
                fillsByClientId.remove(order.getClientId());
                seenFillIds.remove(order.getClientId());
                if (order.getVenueId() != null) {
                    clientIdByVenueId.remove(order.getVenueId());
                }
                archived++;
            }
        }
        if (archived > 0) {
            log.info("Archived {} terminal orders updated before {}", archived, cutoff);
        }
        return archived;
    }

    // ========================
    // QUERIES
    // ========================

    public synchronized Optional<Order> get(String clientId) {
        return Optional.ofNullable(orders.get(clientId));
    }

    public synchronized Optional<Order> findByVenueId(String venueId) {
        String clientId = clientIdByVenueId.get(venueId);
        return clientId == null ? Optional.empty() : Optional.ofNullable(orders.get(clientId));
    }

    /** Non-terminal orders in submission order. */
    public synchronized List<Order> openOrders() {
        return orders.values().stream().filter(o -> !o.isTerminal()).toList();
    }

    public synchronized List<Fill> fills(String clientId) {
        return List.copyOf(fillsByClientId.getOrDefault(clientId, List.of()));
    }

    /**
     * Notional still working at the venue: remaining quantity of every non-terminal order priced at
     * its limit, else its average fill, else the reference price it was sized with.
     */
    public synchronized BigDecimal openOrderNotional() {
        BigDecimal total = BigDecimal.ZERO;
        for (Order order : orders.values()) {
            if (order.isTerminal()) {
                continue;
            }
            BigDecimal price = order.getLimitPrice() != null
                    ? order.getLimitPrice()
                    : order.getAvgFillPrice() != null ? order.getAvgFillPrice() : order.getReferencePrice();
            if (price != null) {
                total = total.add(order.getRemainingQty().multiply(price));
            }
        }
        return total;
    }

    public synchronized OrderStats stats() {
        Map<OrderState, Integer> byState = new HashMap<>();
        BigDecimal filledNotional = BigDecimal.ZERO;
        BigDecimal commission = BigDecimal.ZERO;
        for (Order order : orders.values()) {
            byState.merge(order.getState(), 1, Integer::sum);
            if (order.getAvgFillPrice() != null) {
                filledNotional = filledNotional.add(order.getFilledQty().multiply(order.getAvgFillPrice()));
            }
            commission = commission.add(order.getCommissionTotal());
        }
        int open = byState.getOrDefault(OrderState.SUBMITTED, 0)
                + byState.getOrDefault(OrderState.OPEN, 0)
                + byState.getOrDefault(OrderState.PARTIALLY_FILLED, 0);
        return OrderStats.builder()
                .trackedOrders(orders.size())
                .openOrders(open)
                .filledOrders(byState.getOrDefault(OrderState.FILLED, 0))
                .cancelledOrders(byState.getOrDefault(OrderState.CANCELLED, 0))
                .rejectedOrders(byState.getOrDefault(OrderState.REJECTED, 0))
                .expiredOrders(byState.getOrDefault(OrderState.EXPIRED, 0))
                .archivedOrders(retiredClientIds.size())
                .filledNotional(filledNotional)
                .commissionTotal(commission)
                .build();
    }

    // ========================
    // INTERNALS
    // ========================

    private Order require(String clientId) {
        Order order = orders.get(clientId);
        if (order == null) {
            throw new UnknownOrderException(clientId);
        }
        return order;
    }

    private Order replace(Order.OrderBuilder builder) {
        Order updated = builder.updatedAt(clock.instant()).build();
        orders.put(updated.getClientId(), updated);
        return updated;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}

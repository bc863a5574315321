package com.tradeguard.execution;

import com.tradeguard.account.AccountStateProvider;
import com.tradeguard.account.MarkPriceSource;
import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.ExecutionStatus;
import com.tradeguard.domain.enums.OrderState;
import com.tradeguard.domain.model.AccountSnapshot;
import com.tradeguard.domain.model.Decision;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.exception.InvalidTransitionException;
import com.tradeguard.exception.UnknownOrderException;
import com.tradeguard.exception.VenueException;
import com.tradeguard.exception.VenueTransientException;
import com.tradeguard.observability.ExecutionMetrics;
import com.tradeguard.oms.ClientOrderIdGenerator;
import com.tradeguard.oms.OrderTracker;
import com.tradeguard.risk.RiskManager;
import com.tradeguard.risk.RiskValidationResult;
import com.tradeguard.venue.OrderPlacement;
import com.tradeguard.venue.VenueAck;
import com.tradeguard.venue.VenueClient;
import com.tradeguard.venue.VenueOrderStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Routes decisions into orders according to the execution mode.
 *
 * <p>Every call sizes the decision, refreshes the risk manager's view of equity and exposure, and
 * validates. What happens after approval depends on the mode:
 * <ul>
 *   <li><b>DRY_RUN:</b> nothing beyond a log line. The venue is never called and nothing is tracked.</li>
 *   <li><b>PAPER:</b> the order is registered, acknowledged with a {@code paper-} venue id and filled
 *       locally at the mark price moved by the slippage model. The fill goes through the same path as a
 *       live fill.</li>
 *   <li><b>LIVE:</b> the order is sent to the venue and registered only once acknowledged. A timeout
 *       makes the outcome INDETERMINATE. A transient failure triggers a status query by client id before
 *       anything else; placement itself is never retried. A definitive venue refusal is a
 *       {@code venue_error} rejection.</li>
 * </ul>
 *
 * <p>Everything from sizing to registration runs under the {@link AccountLock}, including the bounded
 * wait for a LIVE acknowledgement, so two decisions can never both pass the exposure checks against the
 * same aggregate. Venue events arriving meanwhile wait in the event channel.
 *
 * <p>Orders keep the mode they were placed under. Changing the current mode affects new decisions only.
 */
@Service
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private static final String PAPER_VENUE_PREFIX = "paper-";
    private static final BigDecimal BPS = new BigDecimal("10000");

    private final RiskManager riskManager;
    private final OrderTracker orderTracker;
    private final OrderStateApplier orderStateApplier;
    private final PositionSizer positionSizer;
    private final AccountStateProvider accountStateProvider;
    private final MarkPriceSource markPriceSource;
    private final VenueClient venueClient;
    private final RetryingVenueOperations retryingVenueOperations;
    private final SlippageModel slippageModel;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final IndeterminateOrders indeterminateOrders;
    private final AccountLock accountLock;
    private final ExecutionSettings executionSettings;
    private final ExecutionMetrics executionMetrics;
    private final Executor placementExecutor;
    private final Clock clock;

    private final AtomicReference<ExecutionMode> currentMode;
    private final AtomicInteger consecutivePlacementFailures = new AtomicInteger();

    public ExecutionDispatcher(
            RiskManager riskManager,
            OrderTracker orderTracker,
            OrderStateApplier orderStateApplier,
            PositionSizer positionSizer,
            AccountStateProvider accountStateProvider,
            MarkPriceSource markPriceSource,
            VenueClient venueClient,
            RetryingVenueOperations retryingVenueOperations,
            SlippageModel slippageModel,
            ClientOrderIdGenerator clientOrderIdGenerator,
            IndeterminateOrders indeterminateOrders,
            AccountLock accountLock,
            ExecutionSettings executionSettings,
            ExecutionMetrics executionMetrics,
            @Qualifier("placementExecutor") Executor placementExecutor,
            Clock clock) {
        this.riskManager = riskManager;
        this.orderTracker = orderTracker;
        this.orderStateApplier = orderStateApplier;
        this.positionSizer = positionSizer;
        this.accountStateProvider = accountStateProvider;
        this.markPriceSource = markPriceSource;
        this.venueClient = venueClient;
        this.retryingVenueOperations = retryingVenueOperations;
        this.slippageModel = slippageModel;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.indeterminateOrders = indeterminateOrders;
        this.accountLock = accountLock;
        this.executionSettings = executionSettings;
        this.executionMetrics = executionMetrics;
        this.placementExecutor = placementExecutor;
        this.clock = clock;
        this.currentMode = new AtomicReference<>(executionSettings.getDefaultMode());
    }

    // ========================
    // EXECUTION
    // ========================

    /** Executes a decision in the current mode. */
    public ExecutionResult execute(Decision decision) {
        return execute(decision, currentMode.get());
    }

    /**
     * Executes one decision in the given mode. Rejections are returned, never thrown.
     *
     * @throws IllegalArgumentException if the decision is malformed
     */
    public ExecutionResult execute(Decision decision, ExecutionMode mode) {
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(mode, "mode");
        decision.requireWellFormed();

        ExecutionResult result = accountLock.call(() -> executeLocked(decision, mode));
        executionMetrics.recordDecision(result.getStatus());
        return result;
    }

    /**
     * Executes every decision the source has pending, in order, in the current mode.
     *
     * @return one result per decision
     */
    public List<ExecutionResult> drain(DecisionSource source) {
        Objects.requireNonNull(source, "source");
        List<ExecutionResult> results = new ArrayList<>();
        Optional<Decision> next;
        while ((next = source.nextDecision()).isPresent()) {
            results.add(execute(next.get()));
        }
        return results;
    }

    private ExecutionResult executeLocked(Decision decision, ExecutionMode mode) {
        AccountSnapshot account = accountStateProvider.snapshot();
        if (account.getEquity() != null) {
            riskManager.markToMarket(account.getEquity());
        }
        riskManager.recordExposure(account.getPositionNotional()
                .add(orderTracker.openOrderNotional())
                .add(indeterminateOrders.pendingNotional()));

        PositionSizer.Sizing sizing = positionSizer.size(decision, account);
        if (sizing.isRejected()) {
            log.info("[{}] Decision for {} not sized: {}", mode, decision.getSymbol(), sizing.violation());
            return ExecutionResult.rejected(mode, null, List.of(sizing.violation()));
        }
        OrderIntent intent = sizing.intent();

        RiskValidationResult validation = riskManager.validate(intent, account);
        if (validation.isRejected()) {
            return ExecutionResult.rejected(mode, null, validation.getViolations());
        }

        return switch (mode) {
            case DRY_RUN -> executeDryRun(intent);
            case PAPER -> executePaper(intent);
            case LIVE -> executeLive(intent);
        };
    }

    private ExecutionResult executeDryRun(OrderIntent intent) {
        log.info(
                "[DRY_RUN] Would place {} {} {} {} (notional {}, reason: {})",
                intent.getType(),
                intent.getSide(),
                intent.getQty().toPlainString(),
                intent.getSymbol(),
                intent.getNotional().toPlainString(),
                intent.getDecision().getReason());
        return ExecutionResult.builder()
                .status(ExecutionStatus.DRY_RUN_APPROVED)
                .mode(ExecutionMode.DRY_RUN)
                .message("Approved; nothing placed in DRY_RUN")
                .build();
    }

    private ExecutionResult executePaper(OrderIntent intent) {
        String clientId = clientOrderIdGenerator.next(intent.getSymbol());
        orderStateApplier.registerAcknowledged(clientId, intent, ExecutionMode.PAPER, PAPER_VENUE_PREFIX + clientId);

        BigDecimal fillQty = intent.getQty()
                .multiply(executionSettings.getPaperFillRatio())
                .setScale(executionSettings.getQuantityScale(), RoundingMode.DOWN);
        Order order;
        if (fillQty.signum() > 0) {
            order = orderStateApplier.applyFill(clientId, simulateFill(clientId, intent, fillQty));
        } else {
            order = orderTracker.get(clientId).orElseThrow(() -> new UnknownOrderException(clientId));
        }

        ExecutionStatus status = switch (order.getState()) {
            case FILLED -> ExecutionStatus.FILLED;
            case PARTIALLY_FILLED -> ExecutionStatus.PARTIALLY_FILLED;
            default -> ExecutionStatus.SUBMITTED;
        };
        log.info(
                "[PAPER] {} {} {} {} filled {} @ {}",
                clientId,
                order.getSide(),
                order.getRequestedQty().toPlainString(),
                order.getSymbol(),
                order.getFilledQty().toPlainString(),
                order.getAvgFillPrice() != null ? order.getAvgFillPrice().stripTrailingZeros().toPlainString() : "-");
        return ExecutionResult.builder()
                .status(status)
                .mode(ExecutionMode.PAPER)
                .clientOrderId(clientId)
                .order(order)
                .build();
    }

    private Fill simulateFill(String clientId, OrderIntent intent, BigDecimal qty) {
        BigDecimal mark = markPriceSource.lastPrice(intent.getSymbol()).orElse(intent.getReferencePrice());
        BigDecimal price = slippageModel.fillPrice(mark, intent.getSide());
        if (intent.getLimitPrice() != null) {
            // a simulated limit order never fills through its limit
            price = intent.getSide().sign() > 0 ? price.min(intent.getLimitPrice()) : price.max(intent.getLimitPrice());
        }
        BigDecimal commission = qty.multiply(price)
                .multiply(executionSettings.getPaperCommissionBps())
                .divide(BPS, 10, RoundingMode.HALF_UP);
        return Fill.builder()
                .orderClientId(clientId)
                .fillId(PAPER_VENUE_PREFIX + clientId + "-1")
                .qty(qty)
                .price(price)
                .commission(commission)
                .commissionAsset(executionSettings.getCommissionAsset())
                .timestamp(clock.instant())
                .isFinal(qty.compareTo(intent.getQty()) == 0)
                .build();
    }

    private ExecutionResult executeLive(OrderIntent intent) {
        String clientId = clientOrderIdGenerator.next(intent.getSymbol());
        OrderPlacement placement = OrderPlacement.builder()
                .clientId(clientId)
                .symbol(intent.getSymbol())
                .side(intent.getSide())
                .type(intent.getType())
                .qty(intent.getQty())
                .limitPrice(intent.getLimitPrice())
                .build();

        Instant started = clock.instant();
        CompletableFuture<VenueAck> future;
        try {
            future = CompletableFuture.supplyAsync(() -> venueClient.placeOrder(placement), placementExecutor);
        } catch (RejectedExecutionException e) {
            // nothing was sent, so the outcome is known
            recordPlacementFailure();
            log.error("Placement of {} not attempted: placement pool saturated ({})", clientId, e.getMessage());
            return ExecutionResult.venueError(ExecutionMode.LIVE, clientId, "Placement pool saturated; order not sent");
        }
        try {
            VenueAck ack = future.get(executionSettings.getAckTimeout().toMillis(), TimeUnit.MILLISECONDS);
            executionMetrics.recordPlacementLatency(Duration.between(started, clock.instant()));
            consecutivePlacementFailures.set(0);
            Order order = orderStateApplier.registerAcknowledged(clientId, intent, ExecutionMode.LIVE, ack.venueId());
            return ExecutionResult.builder()
                    .status(ExecutionStatus.SUBMITTED)
                    .mode(ExecutionMode.LIVE)
                    .clientOrderId(clientId)
                    .order(order)
                    .build();
        } catch (TimeoutException e) {
            future.cancel(true);
            return markIndeterminate(clientId, intent, "No acknowledgement within " + executionSettings.getAckTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return markIndeterminate(clientId, intent, "Interrupted while awaiting acknowledgement");
        } catch (ExecutionException e) {
            return handlePlacementFailure(clientId, intent, e.getCause());
        }
    }

    private ExecutionResult handlePlacementFailure(String clientId, OrderIntent intent, Throwable cause) {
        if (cause instanceof VenueTransientException) {
            log.warn("Placement of {} failed transiently ({}); checking venue status", clientId, cause.getMessage());
            return resolveAfterAmbiguousFailure(clientId, intent, cause.getMessage());
        }
        if (cause instanceof VenueException) {
            recordPlacementFailure();
            log.warn("Placement of {} refused by venue: {}", clientId, cause.getMessage());
            return ExecutionResult.venueError(ExecutionMode.LIVE, clientId, cause.getMessage());
        }
        log.error("Unexpected placement failure for {}", clientId, cause);
        return markIndeterminate(clientId, intent, "Unexpected placement failure: " + cause);
    }

    /**
     * After a transient placement failure the venue may or may not have the order. Ask before acting:
     * a known order is registered, an absent one is reported as a venue error, and an unanswerable
     * query leaves the outcome indeterminate.
     */
    private ExecutionResult resolveAfterAmbiguousFailure(String clientId, OrderIntent intent, String failure) {
        Order order;
        try {
            Optional<VenueOrderStatus> status = retryingVenueOperations.getOrderStatus(clientId);
            if (status.isEmpty()) {
                recordPlacementFailure();
                return ExecutionResult.venueError(ExecutionMode.LIVE, clientId, failure);
            }
            order = registerFromStatus(clientId, intent, status.get());
        } catch (VenueException e) {
            return markIndeterminate(clientId, intent, "Status query failed after placement error: " + e.getMessage());
        }
        consecutivePlacementFailures.set(0);
        if (order.getState() == OrderState.REJECTED) {
            return ExecutionResult.venueError(ExecutionMode.LIVE, clientId, order.getRejectReason());
        }
        return ExecutionResult.builder()
                .status(ExecutionStatus.SUBMITTED)
                .mode(ExecutionMode.LIVE)
                .clientOrderId(clientId)
                .order(order)
                .message("Placed despite transport error: " + failure)
                .build();
    }

    private Order registerFromStatus(String clientId, OrderIntent intent, VenueOrderStatus status) {
        if (status.getState() == OrderState.REJECTED) {
            return orderStateApplier.registerRejected(clientId, intent, status.getRejectReason());
        }
        if (status.getVenueId() == null) {
            throw new VenueException("Venue reported order " + clientId + " without a venue id");
        }
        // fills already executed at the venue arrive through the event stream
        return orderStateApplier.registerAcknowledged(clientId, intent, ExecutionMode.LIVE, status.getVenueId());
    }

    private ExecutionResult markIndeterminate(String clientId, OrderIntent intent, String message) {
        indeterminateOrders.add(clientId, intent);
        log.warn("LIVE placement of {} is INDETERMINATE: {}. Resolve by status query before acting on it.", clientId, message);
        return ExecutionResult.indeterminate(clientId, message);
    }

    private void recordPlacementFailure() {
        int failures = consecutivePlacementFailures.incrementAndGet();
        if (failures >= executionSettings.getPlacementFailureThreshold()) {
            riskManager.engageCircuitBreaker(RiskManager.GLOBAL_SCOPE, "venue_errors", true);
        }
    }

    // ========================
    // FOLLOW-UP OPERATIONS
    // ========================

    /**
     * Resolves an indeterminate placement by asking the venue for the order by client id.
     *
     * @return the registered order if the venue has it, empty if the venue never received it
     * @throws VenueException if the venue cannot be queried; the order stays indeterminate
     */
    public Optional<Order> resolveIndeterminate(String clientId) {
        return accountLock.call(() -> {
            Optional<Order> tracked = orderTracker.get(clientId);
            if (tracked.isPresent()) {
                indeterminateOrders.remove(clientId);
                return tracked;
            }
            OrderIntent intent =
                    indeterminateOrders.get(clientId).orElseThrow(() -> new UnknownOrderException(clientId));

            // the intent stays pending until the venue gave a usable answer
            Optional<VenueOrderStatus> status = retryingVenueOperations.getOrderStatus(clientId);
            if (status.isEmpty()) {
                indeterminateOrders.remove(clientId);
                log.info("Indeterminate order {} is unknown to the venue; it was never placed", clientId);
                return Optional.empty();
            }
            Order order = registerFromStatus(clientId, intent, status.get());
            indeterminateOrders.remove(clientId);
            log.info("Indeterminate order {} resolved as {}", clientId, order.getState());
            return Optional.of(order);
        });
    }

    /**
     * Requests cancellation. LIVE orders stay in their current state until the venue confirms; PAPER
     * orders have no venue and are confirmed at once.
     *
     * @return the order snapshot after the request
     */
    public Order cancel(String clientId) {
        return accountLock.call(() -> {
            Order order = orderTracker.get(clientId).orElseThrow(() -> new UnknownOrderException(clientId));
            if (!order.getState().isWorking()) {
                throw new InvalidTransitionException(clientId, order.getState(), "cancel");
            }
            if (order.getMode() == ExecutionMode.PAPER) {
                return orderStateApplier.cancel(clientId);
            }
            retryingVenueOperations.cancelOrder(order.getVenueId());
            log.info("Cancel requested for {} (venueId={}); awaiting venue confirmation", clientId, order.getVenueId());
            return order;
        });
    }

    // ========================
    // MODE
    // ========================

    /**
     * Switches the mode used by {@link #execute(Decision)}. Working orders keep the mode they were placed
     * under until they are cancelled or resolve.
     */
    public void setMode(ExecutionMode mode) {
        Objects.requireNonNull(mode, "mode");
        ExecutionMode previous = currentMode.getAndSet(mode);
        if (previous == mode) {
            return;
        }
        long carriedOver = orderTracker.openOrders().stream()
                .filter(o -> o.getMode() != mode)
                .count();
        if (carriedOver > 0) {
            log.warn(
                    "Execution mode {} -> {}: {} working orders keep their original mode until they resolve",
                    previous,
                    mode,
                    carriedOver);
        } else {
            log.info("Execution mode {} -> {}", previous, mode);
        }
    }

    public ExecutionMode getMode() {
        return currentMode.get();
    }
}

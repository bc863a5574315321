package com.tradeguard.execution;

import com.tradeguard.account.MarkPriceSource;
import com.tradeguard.domain.enums.Direction;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderType;
import com.tradeguard.domain.model.AccountSnapshot;
import com.tradeguard.domain.model.Decision;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.domain.model.Position;
import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link Decision} into concrete order terms.
 *
 * <p>LONG buys and SHORT sells {@code equity * sizeHint / price}, rounded down to the quantity scale.
 * EXIT trades the opposite side of the whole net position. The price is the decision's limit price
 * when given, otherwise the last mark. No silent capping happens here; oversized intents are left
 * for the risk policies to reject.
 */
@Component
public class PositionSizer {

    private final MarkPriceSource markPriceSource;
    private final ExecutionSettings executionSettings;

    public PositionSizer(MarkPriceSource markPriceSource, ExecutionSettings executionSettings) {
        this.markPriceSource = markPriceSource;
        this.executionSettings = executionSettings;
    }

    public Sizing size(Decision decision, AccountSnapshot account) {
        String symbol = decision.getSymbol();
        Optional<BigDecimal> mark = markPriceSource.lastPrice(symbol);
        BigDecimal price = decision.getLimitPrice() != null ? decision.getLimitPrice() : mark.orElse(null);
        if (price == null) {
            return Sizing.rejected(RiskViolation.of(RiskViolation.NO_MARK_PRICE, "No mark price known for " + symbol));
        }

        Optional<Position> position = account.positionFor(symbol);
        OrderSide side;
        BigDecimal qty;
        if (decision.getDirection() == Direction.EXIT) {
            if (position.isEmpty()) {
                return Sizing.rejected(
                        RiskViolation.of(RiskViolation.NO_POSITION_TO_EXIT, "No open position in " + symbol));
            }
            BigDecimal held = position.get().getQuantity();
            side = held.signum() > 0 ? OrderSide.SELL : OrderSide.BUY;
            qty = held.abs();
        } else {
            side = decision.getDirection() == Direction.LONG ? OrderSide.BUY : OrderSide.SELL;
            BigDecimal equity = account.getEquity() != null ? account.getEquity().max(BigDecimal.ZERO) : BigDecimal.ZERO;
            qty = equity.multiply(decision.getSizeHint())
                    .divide(price, executionSettings.getQuantityScale(), RoundingMode.DOWN);
            if (qty.signum() == 0 && equity.signum() > 0) {
                return Sizing.rejected(RiskViolation.of(
                        RiskViolation.ZERO_QUANTITY, "Size hint " + decision.getSizeHint() + " rounds to zero quantity"));
            }
        }

        boolean reducing = position.isPresent()
                && position.get().getQuantity().signum() != side.sign()
                && qty.compareTo(position.get().getQuantity().abs()) <= 0;

        OrderIntent intent = OrderIntent.builder()
                .decision(decision)
                .symbol(symbol)
                .side(side)
                .type(decision.getLimitPrice() != null ? OrderType.LIMIT : OrderType.MARKET)
                .qty(qty)
                .referencePrice(mark.orElse(price))
                .limitPrice(decision.getLimitPrice())
                .notional(qty.multiply(price))
                .leverage(executionSettings.getLeverage())
                .riskReducing(reducing)
                .build();
        return Sizing.approved(intent);
    }

    /** Either a sized intent or the reason sizing was impossible. */
    public record Sizing(OrderIntent intent, RiskViolation violation) {

        static Sizing approved(OrderIntent intent) {
            return new Sizing(intent, null);
        }

        static Sizing rejected(RiskViolation violation) {
            return new Sizing(null, violation);
        }

        public boolean isRejected() {
            return violation != null;
        }
    }
}

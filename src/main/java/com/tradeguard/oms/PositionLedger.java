package com.tradeguard.oms;

import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.FillOutcome;
import com.tradeguard.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Net position and average entry price per symbol, built from applied fills.
 *
 * <p>Turns each fill into a {@link FillOutcome}: fills that reduce a position realise
 * {@code closedQty * (price - avgEntry)} for longs and the mirror image for shorts. A fill that
 * crosses through flat closes the old position and opens the remainder at the fill price.
 */
@Component
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private BigDecimal realizedTotal = BigDecimal.ZERO;
    private BigDecimal commissionTotal = BigDecimal.ZERO;

    public synchronized FillOutcome apply(String symbol, OrderSide side, Fill fill) {
        Entry entry = entries.computeIfAbsent(symbol, s -> new Entry());
        BigDecimal qty = fill.getQty();
        BigDecimal price = fill.getPrice();
        BigDecimal commission = fill.getCommission() != null ? fill.getCommission() : BigDecimal.ZERO;
        BigDecimal signedQty = side.sign() > 0 ? qty : qty.negate();
        BigDecimal realized = BigDecimal.ZERO;

        if (entry.quantity.signum() == 0 || entry.quantity.signum() == signedQty.signum()) {
            BigDecimal held = entry.quantity.abs();
            entry.avgEntry = held.signum() == 0
                    ? price
                    : entry.avgEntry
                            .multiply(held)
                            .add(price.multiply(qty))
                            .divide(held.add(qty), OrderTracker.PRICE_SCALE, RoundingMode.HALF_UP);
            entry.quantity = entry.quantity.add(signedQty);
        } else {
            BigDecimal closing = qty.min(entry.quantity.abs());
            BigDecimal perUnit = price.subtract(entry.avgEntry);
            realized = closing.multiply(entry.quantity.signum() > 0 ? perUnit : perUnit.negate());
            entry.quantity = entry.quantity.add(signedQty);
            if (entry.quantity.signum() == 0) {
                entry.avgEntry = BigDecimal.ZERO;
            } else if (entry.quantity.signum() == signedQty.signum()) {
                // crossed through flat: the remainder is a fresh position at the fill price
                entry.avgEntry = price;
            }
        }
        entry.lastPrice = price;

        realizedTotal = realizedTotal.add(realized);
        commissionTotal = commissionTotal.add(commission);

        log.debug(
                "Ledger {}: {} {} @ {} -> net={}, realized={}",
                symbol,
                side,
                qty.toPlainString(),
                price.toPlainString(),
                entry.quantity.toPlainString(),
                realized.toPlainString());

        return FillOutcome.builder()
                .symbol(symbol)
                .realizedPnl(realized)
                .commission(commission)
                .netPositionAfter(entry.quantity)
                .build();
    }

    public synchronized BigDecimal netQuantity(String symbol) {
        Entry entry = entries.get(symbol);
        return entry == null ? BigDecimal.ZERO : entry.quantity;
    }

    /** Non-flat positions marked at the last fill price. */
    public synchronized List<Position> positions() {
        List<Position> result = new ArrayList<>();
        entries.forEach((symbol, entry) -> {
            if (entry.quantity.signum() != 0) {
                result.add(Position.builder()
                        .symbol(symbol)
                        .quantity(entry.quantity)
                        .markPrice(entry.lastPrice)
                        .build());
            }
        });
        return result;
    }

    public synchronized BigDecimal getRealizedTotal() {
        return realizedTotal;
    }

    public synchronized BigDecimal getCommissionTotal() {
        return commissionTotal;
    }

    private static final class Entry {
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal avgEntry = BigDecimal.ZERO;
        private BigDecimal lastPrice = BigDecimal.ZERO;
    }
}

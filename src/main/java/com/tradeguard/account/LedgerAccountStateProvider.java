package com.tradeguard.account;

import com.tradeguard.domain.model.Position;
import com.tradeguard.oms.PositionLedger;
import java.math.BigDecimal;
import java.util.List;

/**
 * Account view derived from the local {@link PositionLedger}: starting equity plus realised PnL net
 * of commission, and the ledger's positions re-marked at the latest mark price where one is known.
 *
 * <p>Used for paper trading and whenever no venue-backed provider is configured. Unrealised PnL is
 * not included in equity.
 */
public class LedgerAccountStateProvider implements AccountStateProvider {

    private final BigDecimal startingEquity;
    private final PositionLedger positionLedger;
    private final MarkPriceSource markPriceSource;

    public LedgerAccountStateProvider(
            BigDecimal startingEquity, PositionLedger positionLedger, MarkPriceSource markPriceSource) {
        this.startingEquity = startingEquity;
        this.positionLedger = positionLedger;
        this.markPriceSource = markPriceSource;
    }

    @Override
    public BigDecimal currentEquity() {
        return startingEquity.add(positionLedger.getRealizedTotal()).subtract(positionLedger.getCommissionTotal());
    }

    @Override
    public List<Position> openPositions() {
        return positionLedger.positions().stream()
                .map(p -> p.toBuilder()
                        .markPrice(markPriceSource.lastPrice(p.getSymbol()).orElse(p.getMarkPrice()))
                        .build())
                .toList();
    }
}

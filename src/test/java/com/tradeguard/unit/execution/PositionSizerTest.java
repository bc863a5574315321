package com.tradeguard.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.account.MarkPriceBook;
import com.tradeguard.domain.enums.Direction;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.enums.OrderType;
import com.tradeguard.domain.model.AccountSnapshot;
import com.tradeguard.domain.model.Decision;
import com.tradeguard.domain.model.OrderIntent;
import com.tradeguard.domain.model.Position;
import com.tradeguard.execution.ExecutionSettings;
import com.tradeguard.execution.PositionSizer;
import com.tradeguard.risk.RiskViolation;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionSizerTest {

    private MarkPriceBook marks;
    private PositionSizer sizer;

    @BeforeEach
    void setUp() {
        marks = new MarkPriceBook();
        marks.update("BTCUSDT", new BigDecimal("30000"));
        sizer = new PositionSizer(marks, ExecutionSettings.builder().build());
    }

    private static AccountSnapshot flat(String equity) {
        return AccountSnapshot.builder().equity(new BigDecimal(equity)).build();
    }

    private static AccountSnapshot holding(String qty) {
        return AccountSnapshot.builder()
                .equity(new BigDecimal("10000"))
                .positions(List.of(Position.builder()
                        .symbol("BTCUSDT")
                        .quantity(new BigDecimal(qty))
                        .markPrice(new BigDecimal("30000"))
                        .build()))
                .build();
    }

    private static Decision decision(Direction direction, String sizeHint) {
        return Decision.builder()
                .symbol("BTCUSDT")
                .direction(direction)
                .sizeHint(sizeHint != null ? new BigDecimal(sizeHint) : null)
                .confidence(0.5)
                .build();
    }

    @Test
    @DisplayName("LONG sizes equity times hint at the mark, rounded down")
    void long_sizedFromEquity() {
        OrderIntent intent = sizer.size(decision(Direction.LONG, "0.1"), flat("10000")).intent();

        assertThat(intent.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(intent.getType()).isEqualTo(OrderType.MARKET);
        // 1000 / 30000 = 0.0333333333... truncated to 8 places
        assertThat(intent.getQty()).isEqualByComparingTo("0.03333333");
        assertThat(intent.getReferencePrice()).isEqualByComparingTo("30000");
        assertThat(intent.isRiskReducing()).isFalse();
    }

    @Test
    @DisplayName("Limit price drives both order type and sizing price")
    void limitPrice_usedForSizing() {
        Decision decision = Decision.builder()
                .symbol("BTCUSDT")
                .direction(Direction.SHORT)
                .sizeHint(new BigDecimal("0.5"))
                .confidence(0.5)
                .limitPrice(new BigDecimal("25000"))
                .build();

        OrderIntent intent = sizer.size(decision, flat("10000")).intent();

        assertThat(intent.getSide()).isEqualTo(OrderSide.SELL);
        assertThat(intent.getType()).isEqualTo(OrderType.LIMIT);
        assertThat(intent.getQty()).isEqualByComparingTo("0.2");
        assertThat(intent.getNotional()).isEqualByComparingTo("5000");
        assertThat(intent.getReferencePrice()).isEqualByComparingTo("30000");
    }

    @Test
    @DisplayName("EXIT trades the opposite side of the whole position and is risk-reducing")
    void exit_closesWholePosition() {
        OrderIntent intent = sizer.size(decision(Direction.EXIT, null), holding("-0.4")).intent();

        assertThat(intent.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(intent.getQty()).isEqualByComparingTo("0.4");
        assertThat(intent.isRiskReducing()).isTrue();
    }

    @Test
    @DisplayName("Opposite order larger than the position is not risk-reducing")
    void flipThroughFlat_notReducing() {
        // 0.5 * 10000 / 30000 = 0.16666666 against a 0.1 long
        PositionSizer.Sizing sizing = sizer.size(decision(Direction.SHORT, "0.5"), holding("0.1"));

        assertThat(sizing.intent().isRiskReducing()).isFalse();
        assertThat(sizer.size(decision(Direction.SHORT, "0.2"), holding("0.1")).intent().isRiskReducing())
                .isTrue();
    }

    @Test
    @DisplayName("Sizing refusals carry their reason code")
    void refusals() {
        assertThat(sizer.size(decision(Direction.EXIT, null), flat("10000")).violation().getCode())
                .isEqualTo(RiskViolation.NO_POSITION_TO_EXIT);

        Decision unknown = Decision.builder()
                .symbol("XRPUSDT")
                .direction(Direction.LONG)
                .sizeHint(new BigDecimal("0.1"))
                .confidence(0.5)
                .build();
        assertThat(sizer.size(unknown, flat("10000")).violation().getCode()).isEqualTo(RiskViolation.NO_MARK_PRICE);

        PositionSizer.Sizing dust = sizer.size(decision(Direction.LONG, "0.0000001"), flat("1"));
        assertThat(dust.isRejected()).isTrue();
        assertThat(dust.violation().getCode()).isEqualTo(RiskViolation.ZERO_QUANTITY);
    }
}

package com.positionledger.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionledger.domain.enums.MarkerKind;
import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.CurvePoint;
import com.positionledger.domain.model.DailyCashRow;
import com.positionledger.domain.model.InferredTransaction;
import com.positionledger.domain.model.LedgerCurves;
import com.positionledger.domain.model.TradeMarker;
import com.positionledger.reporting.CurveProjector;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CurveProjectorTest {

    private final CurveProjector projector = new CurveProjector();

    private static DailyCashRow cashRow(LocalDate date, String cash, String holdings) {
        BigDecimal balance = new BigDecimal(cash);
        BigDecimal value = new BigDecimal(holdings);
        return DailyCashRow.builder()
                .id(date.toString())
                .asOfDate(date)
                .cashBalance(balance)
                .holdingsValue(value)
                .netLiq(balance.add(value))
                .build();
    }

    private static InferredTransaction tx(LocalDate date, String symbol, OrderSide side) {
        return InferredTransaction.builder().asOfDate(date).symbol(symbol).side(side).build();
    }

    @Test
    @DisplayName("Each series has one point per cash row in date order")
    void seriesFollowRows() {
        LocalDate d1 = LocalDate.of(2024, 1, 2);
        LocalDate d2 = LocalDate.of(2024, 1, 3);

        LedgerCurves curves = projector.project(
                List.of(cashRow(d1, "75000", "25100"), cashRow(d2, "101000", "0")), List.of());

        assertThat(curves.getCash()).extracting(CurvePoint::getTs).containsExactly(d1, d2);
        assertThat(curves.getCash().get(1).getValue()).isEqualByComparingTo("101000");
        assertThat(curves.getHoldings().get(0).getValue()).isEqualByComparingTo("25100");
        assertThat(curves.getNetLiquidation().get(0).getValue()).isEqualByComparingTo("100100");
        assertThat(curves.getMarkers()).isEmpty();
    }

    @Test
    @DisplayName("Buys become crossover markers and sells crossunder markers")
    void markersPerTransaction() {
        LocalDate day = LocalDate.of(2024, 1, 2);

        LedgerCurves curves = projector.project(
                List.of(), List.of(tx(day, "RELIANCE", OrderSide.BUY), tx(day, "TCS", OrderSide.SELL)));

        assertThat(curves.getMarkers()).extracting(TradeMarker::getText).containsExactly("B RELIANCE", "S TCS");
        assertThat(curves.getMarkers())
                .extracting(TradeMarker::getKind)
                .containsExactly(MarkerKind.CROSSOVER, MarkerKind.CROSSUNDER);
        assertThat(curves.getMarkers()).allSatisfy(marker -> assertThat(marker.getTs()).isEqualTo(day));
    }

    @Test
    @DisplayName("Null inputs project to empty series")
    void nullInputs() {
        LedgerCurves curves = projector.project(null, null);

        assertThat(curves.getCash()).isEmpty();
        assertThat(curves.getHoldings()).isEmpty();
        assertThat(curves.getNetLiquidation()).isEmpty();
        assertThat(curves.getMarkers()).isEmpty();
    }
}

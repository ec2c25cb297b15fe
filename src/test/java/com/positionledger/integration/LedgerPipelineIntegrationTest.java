package com.positionledger.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionledger.config.LedgerProperties;
import com.positionledger.domain.enums.CaptureMergePolicy;
import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.DailyCashRow;
import com.positionledger.domain.model.InferredTransaction;
import com.positionledger.domain.model.PositionLedger;
import com.positionledger.domain.model.PositionSnapshot;
import com.positionledger.ledger.CashFoldEngine;
import com.positionledger.ledger.DailyAggregator;
import com.positionledger.ledger.PositionLedgerService;
import com.positionledger.ledger.SnapshotCaptureMerger;
import com.positionledger.ledger.SnapshotFieldResolver;
import com.positionledger.ledger.TransactionInferenceEngine;
import com.positionledger.pnl.DailyPnlAnalyzer;
import com.positionledger.reporting.CurveProjector;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end ledger pipeline with real components wired by hand:
 * capture merge -> inference -> daily aggregation -> cash fold -> P&L and curves.
 */
class LedgerPipelineIntegrationTest {

    private PositionLedgerService service;

    @BeforeEach
    void setUp() {
        SnapshotFieldResolver resolver = new SnapshotFieldResolver();
        service = new PositionLedgerService(
                new SnapshotCaptureMerger(resolver),
                new TransactionInferenceEngine(resolver),
                new DailyAggregator(resolver),
                new CashFoldEngine(),
                new DailyPnlAnalyzer(resolver),
                new CurveProjector(),
                new LedgerProperties(),
                Runnable::run);
    }

    private PositionLedger build(List<PositionSnapshot> snapshots, String startingCash) {
        return service.buildLedger(snapshots, new BigDecimal(startingCash), CaptureMergePolicy.SUM_ALL);
    }

    private static PositionSnapshot.PositionSnapshotBuilder row(String date, String symbol) {
        return PositionSnapshot.builder().asOfDate(date).symbol(symbol).exchange("NSE").product("CNC");
    }

    private static List<PositionSnapshot> roundTrip() {
        return List.of(
                row("2024-01-02", "RELIANCE")
                        .id(1L)
                        .qty(10.0)
                        .dayBuyQty(10.0)
                        .dayBuyAvgPrice(2500.0)
                        .build(),
                row("2024-01-03", "RELIANCE")
                        .id(2L)
                        .qty(0.0)
                        .pnl(1000.0)
                        .daySellQty(10.0)
                        .daySellAvgPrice(2600.0)
                        .build());
    }

    // ==============================
    // SCENARIOS
    // ==============================

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Round trip: buy then sell moves cash 100000 -> 75000 -> 101000")
        void roundTrip_cashFollowsTrades() {
            PositionLedger ledger = build(roundTrip(), "100000");

            assertThat(ledger.getTransactions())
                    .extracting(InferredTransaction::getSide)
                    .containsExactly(OrderSide.BUY, OrderSide.SELL);
            assertThat(ledger.getTransactions().get(0).getNotional()).isEqualByComparingTo("25000");
            assertThat(ledger.getTransactions().get(1).getNotional()).isEqualByComparingTo("26000");

            List<DailyCashRow> rows = ledger.getCashRows();
            assertThat(rows).hasSize(2);
            assertThat(rows.get(0).getCashBalance()).isEqualByComparingTo("75000");
            assertThat(rows.get(1).getCashBalance()).isEqualByComparingTo("101000");
            assertThat(rows.get(1).getNetCashflow()).isEqualByComparingTo("26000");
        }

        @Test
        @DisplayName("Flat holding with broker value contributes holdings but no cash flow")
        void flatHolding_valuedWithoutTrades() {
            PositionLedger ledger = build(
                    List.of(row("2024-01-04", "INFY").qty(0.0).value(15000.0).build()), "500");

            assertThat(ledger.getTransactions()).isEmpty();
            DailyCashRow day = ledger.getCashRows().get(0);
            assertThat(day.getHoldingsValue()).isEqualByComparingTo("15000");
            assertThat(day.getNetCashflow()).isEqualByComparingTo("0");
            assertThat(day.getCashBalance()).isEqualByComparingTo("500");
            assertThat(day.getNetLiq()).isEqualByComparingTo("15500");
        }

        @Test
        @DisplayName("Quantity without any price yields no transactions")
        void noPrices_noTransactions() {
            PositionLedger ledger = build(
                    List.of(row("2024-01-05", "SBIN").qty(50.0).dayBuyQty(50.0).build()), "0");

            assertThat(ledger.getTransactions()).isEmpty();
            assertThat(ledger.getCashRows()).singleElement().satisfies(day -> {
                assertThat(day.getTxCount()).isZero();
                assertThat(day.getHoldingsValue()).isEqualByComparingTo("0");
            });
        }

        @Test
        @DisplayName("Two symbols on one date are summed into a single row")
        void sameDate_summed() {
            PositionLedger ledger = build(
                    List.of(
                            row("2024-01-08", "TCS").dayBuyQty(10.0).dayBuyAvgPrice(100.0).build(),
                            row("2024-01-08", "INFY").dayBuyQty(20.0).dayBuyAvgPrice(100.0).build()),
                    "0");

            assertThat(ledger.getCashRows()).singleElement().satisfies(day -> {
                assertThat(day.getTurnoverBuy()).isEqualByComparingTo("3000");
                assertThat(day.getTxCount()).isEqualTo(2);
                assertThat(day.getCashBalance()).isEqualByComparingTo("-3000");
            });
        }

        @Test
        @DisplayName("Negative starting cash carries through days without trades")
        void negativeStart_unchanged() {
            PositionLedger ledger = build(
                    List.of(
                            row("2024-01-02", "TCS").qty(1.0).build(),
                            row("2024-01-03", "TCS").qty(1.0).build(),
                            row("2024-01-04", "TCS").qty(1.0).build()),
                    "-5000");

            assertThat(ledger.getCashRows())
                    .hasSize(3)
                    .allSatisfy(day -> assertThat(day.getCashBalance()).isEqualByComparingTo("-5000"));
        }
    }

    // ==============================
    // LEDGER INVARIANTS
    // ==============================

    @Nested
    @DisplayName("Ledger Invariants")
    class Invariants {

        private List<PositionSnapshot> mixedBook() {
            return List.of(
                    row("2024-02-01", "TCS").qty(5.0).dayBuyQty(5.0).dayBuyAvgPrice(3500.0).lastPrice(3510.0).build(),
                    row("2024-02-01", "INFY").qty(10.0).dayBuyQty(10.0).dayBuyAvgPrice(1500.0).build(),
                    row("2024-02-02", "TCS").qty(0.0).daySellQty(5.0).daySellAvgPrice(3600.0).build(),
                    row("not-a-date", "HDFC").dayBuyQty(1.0).dayBuyAvgPrice(1.0).build(),
                    row("2024-02-05", "INFY").qty(10.0).buyQty(3.0).buyAvgPrice(1490.0)
                            .sellQty(3.0).sellAvgPrice(1510.0).build());
        }

        @Test
        @DisplayName("Closing cash equals start plus sells minus buys")
        void conservation() {
            PositionLedger ledger = build(mixedBook(), "250000");

            BigDecimal expected = new BigDecimal("250000");
            for (InferredTransaction tx : ledger.getTransactions()) {
                expected = tx.getSide() == OrderSide.SELL
                        ? expected.add(tx.getNotional())
                        : expected.subtract(tx.getNotional());
            }
            List<DailyCashRow> rows = ledger.getCashRows();
            assertThat(rows.get(rows.size() - 1).getCashBalance()).isEqualByComparingTo(expected);
        }

        @Test
        @DisplayName("Rebuilding from the same input yields an equal ledger")
        void idempotent() {
            assertThat(build(mixedBook(), "1000")).isEqualTo(build(mixedBook(), "1000"));
        }

        @Test
        @DisplayName("One cash row per distinct valid date; invalid dates are dropped")
        void totalityOfDates() {
            PositionLedger ledger = build(mixedBook(), "0");

            assertThat(ledger.getCashRows())
                    .extracting(DailyCashRow::getAsOfDate)
                    .containsExactly(
                            LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 2), LocalDate.of(2024, 2, 5));
            assertThat(ledger.getTransactions())
                    .extracting(InferredTransaction::getSymbol)
                    .doesNotContain("HDFC");
        }

        @Test
        @DisplayName("A NaN price on a later date leaves earlier balances untouched")
        void nanPrice_doesNotCorruptBalances() {
            List<PositionSnapshot> clean = new ArrayList<>(mixedBook());
            PositionLedger before = build(clean, "10000");

            clean.add(row("2024-02-06", "WIPRO").qty(4.0).dayBuyQty(4.0).dayBuyAvgPrice(Double.NaN)
                    .ltp(Double.NaN).build());
            PositionLedger after = build(clean, "10000");

            List<DailyCashRow> beforeRows = before.getCashRows();
            List<DailyCashRow> afterRows = after.getCashRows();
            assertThat(afterRows.subList(0, beforeRows.size())).isEqualTo(beforeRows);

            DailyCashRow poisoned = afterRows.get(afterRows.size() - 1);
            assertThat(poisoned.getTxCount()).isZero();
            assertThat(poisoned.getCashBalance())
                    .isEqualByComparingTo(beforeRows.get(beforeRows.size() - 1).getCashBalance());
            assertThat(poisoned.getHoldingsValue()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Null rows are skipped under either policy, also on the bounded path")
        void nullRows_skipped() {
            List<PositionSnapshot> withNulls = new ArrayList<>(Arrays.asList(null, null));
            withNulls.addAll(1, roundTrip());
            PositionLedger clean = build(roundTrip(), "100000");

            for (CaptureMergePolicy policy : CaptureMergePolicy.values()) {
                PositionLedger ledger = service.buildLedgerWithin(
                        withNulls, new BigDecimal("100000"), policy, Duration.ofSeconds(5));

                assertThat(ledger.getTransactions()).isEqualTo(clean.getTransactions());
                assertThat(ledger.getCashRows()).isEqualTo(clean.getCashRows());
                assertThat(ledger.getDailyPnl()).isEqualTo(clean.getDailyPnl());
            }
        }

        @Test
        @DisplayName("Curves and markers line up with cash rows and transactions")
        void curvesMatchLedger() {
            PositionLedger ledger = build(roundTrip(), "100000");

            assertThat(ledger.getCurves().getCash())
                    .extracting(point -> point.getValue().stripTrailingZeros().toPlainString())
                    .containsExactly("75000", "101000");
            assertThat(ledger.getCurves().getMarkers())
                    .extracting(marker -> marker.getText())
                    .containsExactly("B RELIANCE", "S RELIANCE");
            assertThat(ledger.getPnlTotals().getRealisedPnl()).isEqualByComparingTo("1000");
        }
    }

    // ==============================
    // CAPTURE MERGE POLICY
    // ==============================

    @Nested
    @DisplayName("Capture Merge Policy")
    class CaptureMerge {

        private List<PositionSnapshot> duplicateCaptures() {
            return List.of(
                    row("2024-03-01", "ITC").id(1L).capturedAt("2024-03-01T10:00:00")
                            .qty(10.0).dayBuyQty(10.0).dayBuyAvgPrice(100.0).build(),
                    row("2024-03-01", "ITC").id(2L).capturedAt("2024-03-01T15:30:00")
                            .qty(10.0).dayBuyQty(10.0).dayBuyAvgPrice(100.0).build());
        }

        @Test
        @DisplayName("SUM_ALL counts every capture of the same day")
        void sumAll_doubleCounts() {
            PositionLedger ledger =
                    service.buildLedger(duplicateCaptures(), BigDecimal.ZERO, CaptureMergePolicy.SUM_ALL);

            assertThat(ledger.getTransactions()).hasSize(2);
            assertThat(ledger.getTransactions())
                    .extracting(InferredTransaction::getId)
                    .containsOnly("2024-03-01:NSE:ITC:CNC:BUY");
            assertThat(ledger.getCashRows().get(0).getTurnoverBuy()).isEqualByComparingTo("2000");
        }

        @Test
        @DisplayName("LATEST_PER_DAY keeps only the newest capture")
        void latestPerDay_keepsOne() {
            PositionLedger ledger =
                    service.buildLedger(duplicateCaptures(), BigDecimal.ZERO, CaptureMergePolicy.LATEST_PER_DAY);

            assertThat(ledger.getTransactions()).hasSize(1);
            assertThat(ledger.getCashRows().get(0).getTurnoverBuy()).isEqualByComparingTo("1000");
            assertThat(ledger.getCashRows().get(0).getCashBalance()).isEqualByComparingTo("-1000");
            assertThat(ledger.getCaptureMergePolicy()).isEqualTo(CaptureMergePolicy.LATEST_PER_DAY);
        }

        @Test
        @DisplayName("Distinct symbols on the same day survive LATEST_PER_DAY")
        void latestPerDay_keepsDistinctPositions() {
            List<PositionSnapshot> book = List.of(
                    row("2024-03-01", "ITC").dayBuyQty(1.0).dayBuyAvgPrice(400.0).build(),
                    row("2024-03-01", "SBIN").dayBuyQty(1.0).dayBuyAvgPrice(600.0).build());

            PositionLedger ledger = service.buildLedger(book, BigDecimal.ZERO, CaptureMergePolicy.LATEST_PER_DAY);

            assertThat(ledger.getTransactions().stream()
                            .map(InferredTransaction::getSymbol)
                            .collect(Collectors.toSet()))
                    .containsExactlyInAnyOrder("ITC", "SBIN");
        }
    }
}

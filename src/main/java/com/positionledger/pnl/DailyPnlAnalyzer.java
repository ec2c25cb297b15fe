package com.positionledger.pnl;

import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.DailyPnlRow;
import com.positionledger.domain.model.DailyPnlTotals;
import com.positionledger.domain.model.PositionSnapshot;
import com.positionledger.ledger.AsOfDates;
import com.positionledger.ledger.CaptureTimestamps;
import com.positionledger.ledger.SideAggregate;
import com.positionledger.ledger.SnapshotField;
import com.positionledger.ledger.SnapshotFieldResolver;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

/**
 * Splits each day's snapshot P&L into realised and unrealised parts.
 *
 * <p>Per snapshot:
 * <ul>
 *   <li><b>Open quantity:</b> delivery products (CNC, DELIVERY) cannot be short, so a negative
 *       net quantity there means "sold out of holdings" and counts as flat. Other products use
 *       the signed net quantity as-is.</li>
 *   <li><b>Realised:</b> the row's {@code pnl} when the position is flat and it either traded
 *       that day or still carries a non-zero net quantity.</li>
 *   <li><b>Unrealised:</b> the row's {@code pnl} while the position is open.</li>
 *   <li><b>Open value:</b> |open qty| * mark price, when a positive mark price is known.</li>
 * </ul>
 *
 * <p>Turnover here uses the same strictly-positive side rule as the cash ledger, so the two
 * views always agree on what traded.
 */
@Service
public class DailyPnlAnalyzer {

    private static final Set<String> DELIVERY_PRODUCTS = Set.of("CNC", "DELIVERY");

    private final SnapshotFieldResolver fieldResolver;

    public DailyPnlAnalyzer(SnapshotFieldResolver fieldResolver) {
        this.fieldResolver = fieldResolver;
    }

    /**
     * @return one row per distinct valid date, newest first
     */
    public List<DailyPnlRow> analyze(List<PositionSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return List.of();
        }

        Map<LocalDate, DayBucket> byDate = new TreeMap<>();
        for (PositionSnapshot snapshot : snapshots) {
            Optional<LocalDate> date = AsOfDates.dateOf(snapshot);
            if (date.isPresent()) {
                byDate.computeIfAbsent(date.get(), d -> new DayBucket()).add(snapshot);
            }
        }

        return byDate.entrySet().stream()
                .map(entry -> entry.getValue().toRow(entry.getKey()))
                .sorted(Comparator.comparing(DailyPnlRow::getAsOfDate).reversed())
                .toList();
    }

    public DailyPnlTotals totals(List<DailyPnlRow> rows) {
        BigDecimal realised = BigDecimal.ZERO;
        BigDecimal unrealised = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;
        BigDecimal openValue = BigDecimal.ZERO;
        BigDecimal buy = BigDecimal.ZERO;
        BigDecimal sell = BigDecimal.ZERO;

        if (rows != null) {
            for (DailyPnlRow row : rows) {
                realised = realised.add(row.getRealisedPnl());
                unrealised = unrealised.add(row.getUnrealisedPnl());
                net = net.add(row.getNetPnl());
                openValue = openValue.add(row.getOpenValue());
                buy = buy.add(row.getTurnoverBuy());
                sell = sell.add(row.getTurnoverSell());
            }
        }

        return DailyPnlTotals.builder()
                .realisedPnl(realised)
                .unrealisedPnl(unrealised)
                .netPnl(net)
                .openValue(openValue)
                .turnoverBuy(buy)
                .turnoverSell(sell)
                .totalTurnover(buy.add(sell))
                .build();
    }

    /**
     * SYMBOL:EXCHANGE:PRODUCT with the exchange as reported. A blank exchange stays blank here,
     * so it counts apart from an explicit NSE row.
     */
    private String positionKey(PositionSnapshot snapshot) {
        String exchange = snapshot.getExchange() == null ? "" : snapshot.getExchange();
        return fieldResolver.symbolOf(snapshot) + ":"
                + exchange.toUpperCase(Locale.ROOT) + ":"
                + fieldResolver.productOf(snapshot).toUpperCase(Locale.ROOT);
    }

    /** Open quantity after applying the no-short rule for delivery products. */
    BigDecimal openQtyOf(PositionSnapshot snapshot) {
        BigDecimal netQty = fieldResolver.resolve(snapshot, SnapshotField.QTY);
        String product = fieldResolver.productOf(snapshot).toUpperCase(Locale.ROOT);
        return DELIVERY_PRODUCTS.contains(product) ? netQty.max(BigDecimal.ZERO) : netQty;
    }

    private final class DayBucket {

        private BigDecimal realised = BigDecimal.ZERO;
        private BigDecimal unrealised = BigDecimal.ZERO;
        private BigDecimal net = BigDecimal.ZERO;
        private BigDecimal openValue = BigDecimal.ZERO;
        private BigDecimal turnoverBuy = BigDecimal.ZERO;
        private BigDecimal turnoverSell = BigDecimal.ZERO;
        private final Set<String> tradedKeys = new HashSet<>();
        private final Set<String> openKeys = new HashSet<>();
        private Instant latestCapture;

        void add(PositionSnapshot snapshot) {
            BigDecimal netQty = fieldResolver.resolve(snapshot, SnapshotField.QTY);
            BigDecimal openQty = openQtyOf(snapshot);
            boolean open = openQty.signum() != 0;

            SideAggregate buy = fieldResolver.resolveSide(snapshot, OrderSide.BUY);
            SideAggregate sell = fieldResolver.resolveSide(snapshot, OrderSide.SELL);
            boolean hasTrades = buy.getQty().signum() > 0 || sell.getQty().signum() > 0;

            BigDecimal pnl = fieldResolver.resolve(snapshot, SnapshotField.PNL);
            if (open) {
                unrealised = unrealised.add(pnl);
            } else if (hasTrades || netQty.signum() != 0) {
                realised = realised.add(pnl);
            }
            net = net.add(pnl);

            BigDecimal markPrice = fieldResolver.resolve(snapshot, SnapshotField.MARK_PRICE);
            if (markPrice.signum() > 0) {
                openValue = openValue.add(openQty.abs().multiply(markPrice));
            }

            String key = positionKey(snapshot);
            if (buy.isTraded()) {
                turnoverBuy = turnoverBuy.add(buy.getNotional());
                tradedKeys.add(key);
            }
            if (sell.isTraded()) {
                turnoverSell = turnoverSell.add(sell.getNotional());
                tradedKeys.add(key);
            }
            if (open) {
                openKeys.add(key);
            }

            CaptureTimestamps.parse(snapshot.getCapturedAt()).ifPresent(captured -> {
                if (latestCapture == null || captured.isAfter(latestCapture)) {
                    latestCapture = captured;
                }
            });
        }

        DailyPnlRow toRow(LocalDate date) {
            return DailyPnlRow.builder()
                    .id(date.toString())
                    .asOfDate(date)
                    .capturedAt(latestCapture)
                    .realisedPnl(realised)
                    .unrealisedPnl(unrealised)
                    .netPnl(net)
                    .openValue(openValue)
                    .turnoverBuy(turnoverBuy)
                    .turnoverSell(turnoverSell)
                    .tradedSymbols(tradedKeys.size())
                    .openPositions(openKeys.size())
                    .build();
        }
    }
}

package com.positionledger.ledger;

import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.InferredTransaction;
import com.positionledger.domain.model.PositionSnapshot;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconstructs buy/sell events from position snapshots.
 *
 * <p>Brokers only report day-level aggregates, so each snapshot yields at most one BUY
 * (day buy qty at day buy average) and one SELL. Both can come from the same row when the
 * position was opened and closed intraday; that is a real round trip, not a duplicate.
 *
 * <p>A side is emitted only when its resolved quantity and price are both strictly positive.
 * Null rows and rows with a missing or unparseable {@code as_of_date} are skipped.
 *
 * <p><b>Thread safety:</b> stateless; every call works on its own locals.
 */
@Service
public class TransactionInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(TransactionInferenceEngine.class);

    private static final Comparator<InferredTransaction> PRESENTATION_ORDER =
            Comparator.comparing(InferredTransaction::getAsOfDate).thenComparing(InferredTransaction::getSymbol);

    private final SnapshotFieldResolver fieldResolver;

    public TransactionInferenceEngine(SnapshotFieldResolver fieldResolver) {
        this.fieldResolver = fieldResolver;
    }

    /**
     * Infers transactions for every snapshot row.
     *
     * @return transactions stable-sorted by (date, symbol); rows of equal key keep input order
     */
    public List<InferredTransaction> infer(List<PositionSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return List.of();
        }

        List<InferredTransaction> transactions = new ArrayList<>();
        int skipped = 0;

        for (PositionSnapshot snapshot : snapshots) {
            Optional<LocalDate> date = AsOfDates.dateOf(snapshot);
            if (date.isEmpty()) {
                skipped++;
                continue;
            }
            for (OrderSide side : OrderSide.values()) {
                SideAggregate aggregate = fieldResolver.resolveSide(snapshot, side);
                if (aggregate.isTraded()) {
                    transactions.add(toTransaction(date.get(), snapshot, side, aggregate));
                }
            }
        }

        if (skipped > 0) {
            log.debug("Skipped {} null snapshot rows or rows without a valid as_of_date", skipped);
        }

        // List.sort is stable, so same-day same-symbol rows stay in input order
        transactions.sort(PRESENTATION_ORDER);
        return List.copyOf(transactions);
    }

    private InferredTransaction toTransaction(
            LocalDate date, PositionSnapshot snapshot, OrderSide side, SideAggregate aggregate) {
        String symbol = fieldResolver.symbolOf(snapshot);
        String exchange = fieldResolver.exchangeOf(snapshot);
        String product = fieldResolver.productOf(snapshot);

        return InferredTransaction.builder()
                .id(InferredTransaction.key(date, exchange, symbol, product, side))
                .asOfDate(date)
                .symbol(symbol)
                .exchange(exchange)
                .product(product)
                .side(side)
                .qty(aggregate.getQty())
                .avgPrice(aggregate.getAvgPrice())
                .notional(aggregate.getNotional())
                .build();
    }
}

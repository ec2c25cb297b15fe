package com.positionledger.ledger;

import com.positionledger.domain.model.DailyAggregate;
import com.positionledger.domain.model.DailyCashRow;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Folds per-date aggregates into a running cash balance.
 *
 * <p>Dates are walked in ascending order regardless of the map's own ordering. Each step takes
 * the previous closing balance and returns the day's row, whose {@code cashBalance} seeds the
 * next step. So for the k-th date:
 * <pre>
 *   cashBalance[k] = startingCash + sum(netCashflow[0..k])
 *   netLiq[k]      = cashBalance[k] + holdingsValue[k]
 * </pre>
 *
 * <p>The fold is inherently sequential. The balance lives only in the call's locals, so
 * concurrent folds with different starting balances never interfere.
 */
@Service
public class CashFoldEngine {

    /**
     * @param startingCash opening balance before the first date; null means zero, negatives model margin debt
     * @return one row per date, ascending
     */
    public List<DailyCashRow> fold(Map<LocalDate, DailyAggregate> aggregates, BigDecimal startingCash) {
        if (aggregates == null || aggregates.isEmpty()) {
            return List.of();
        }

        List<LocalDate> dates = new ArrayList<>(aggregates.keySet());
        dates.sort(null);

        List<DailyCashRow> rows = new ArrayList<>(dates.size());
        BigDecimal balance = startingCash != null ? startingCash : BigDecimal.ZERO;
        for (LocalDate date : dates) {
            DailyCashRow row = step(balance, date, aggregates.get(date));
            rows.add(row);
            balance = row.getCashBalance();
        }
        return List.copyOf(rows);
    }

    private static DailyCashRow step(BigDecimal openingBalance, LocalDate date, DailyAggregate day) {
        BigDecimal netCashflow = day.getNetCashflow();
        BigDecimal closingBalance = openingBalance.add(netCashflow);

        return DailyCashRow.builder()
                .id(date.toString())
                .asOfDate(date)
                .turnoverBuy(day.getTurnoverBuy())
                .turnoverSell(day.getTurnoverSell())
                .netCashflow(netCashflow)
                .cashBalance(closingBalance)
                .holdingsValue(day.getHoldingsValue())
                .netLiq(closingBalance.add(day.getHoldingsValue()))
                .txCount(day.getTxCount())
                .build();
    }
}

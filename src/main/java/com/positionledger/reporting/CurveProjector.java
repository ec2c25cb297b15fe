package com.positionledger.reporting;

import com.positionledger.domain.enums.MarkerKind;
import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.CurvePoint;
import com.positionledger.domain.model.DailyCashRow;
import com.positionledger.domain.model.InferredTransaction;
import com.positionledger.domain.model.LedgerCurves;
import com.positionledger.domain.model.TradeMarker;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Projects ledger rows onto chart series: holdings value, cash balance and net liquidation,
 * plus a B/S marker per inferred transaction. Pure reshaping; no values are recomputed.
 */
@Component
public class CurveProjector {

    public LedgerCurves project(List<DailyCashRow> cashRows, List<InferredTransaction> transactions) {
        List<DailyCashRow> rows = cashRows != null ? cashRows : List.of();
        List<InferredTransaction> txs = transactions != null ? transactions : List.of();

        return LedgerCurves.builder()
                .holdings(series(rows, DailyCashRow::getHoldingsValue))
                .cash(series(rows, DailyCashRow::getCashBalance))
                .netLiquidation(series(rows, DailyCashRow::getNetLiq))
                .markers(txs.stream().map(this::toMarker).toList())
                .build();
    }

    private List<CurvePoint> series(List<DailyCashRow> rows, Function<DailyCashRow, BigDecimal> value) {
        return rows.stream()
                .map(row -> CurvePoint.builder()
                        .ts(row.getAsOfDate())
                        .value(value.apply(row))
                        .build())
                .toList();
    }

    private TradeMarker toMarker(InferredTransaction tx) {
        String prefix = tx.getSide() == OrderSide.BUY ? "B" : "S";
        return TradeMarker.builder()
                .ts(tx.getAsOfDate())
                .kind(MarkerKind.forSide(tx.getSide()))
                .text(prefix + " " + tx.getSymbol())
                .build();
    }
}

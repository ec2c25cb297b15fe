package com.positionledger.domain.model;

import com.positionledger.domain.enums.CaptureMergePolicy;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Complete output of one ledger computation. Rebuilt from scratch on every call and never
 * mutated afterwards; all lists are unmodifiable.
 */
@Value
@Builder
public class PositionLedger {

    BigDecimal startingCash;
    CaptureMergePolicy captureMergePolicy;

    /** Sorted by (date, symbol). */
    List<InferredTransaction> transactions;

    /** One row per distinct valid snapshot date, ascending. */
    List<DailyCashRow> cashRows;

    /** Newest date first, matching the analysis grid. */
    List<DailyPnlRow> dailyPnl;

    DailyPnlTotals pnlTotals;
    LedgerCurves curves;
}

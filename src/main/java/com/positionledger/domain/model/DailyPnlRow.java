package com.positionledger.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Per-date P&L picture derived from snapshots: what was booked (realised) versus what is still
 * marked to market (unrealised), alongside turnover and position counts.
 */
@Value
@Builder
public class DailyPnlRow {

    String id;
    LocalDate asOfDate;

    /** Latest capture seen for the date, null when no row carried a parseable timestamp. */
    Instant capturedAt;

    BigDecimal realisedPnl;
    BigDecimal unrealisedPnl;
    BigDecimal netPnl;
    BigDecimal openValue;
    BigDecimal turnoverBuy;
    BigDecimal turnoverSell;

    /** Distinct SYMBOL:EXCHANGE:PRODUCT keys with at least one inferred side. */
    int tradedSymbols;

    /** Distinct SYMBOL:EXCHANGE:PRODUCT keys still holding a non-zero open quantity. */
    int openPositions;
}

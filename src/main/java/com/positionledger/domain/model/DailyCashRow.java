package com.positionledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One day of the cash ledger. {@code cashBalance} is the running balance after this day's
 * net cash flow; {@code netLiq} is that balance plus the day's holdings value.
 */
@Value
@Builder
public class DailyCashRow {

    /** ISO date, doubles as a stable row key for grid rendering. */
    String id;

    LocalDate asOfDate;
    BigDecimal turnoverBuy;
    BigDecimal turnoverSell;
    BigDecimal netCashflow;
    BigDecimal cashBalance;
    BigDecimal holdingsValue;
    BigDecimal netLiq;
    int txCount;
}

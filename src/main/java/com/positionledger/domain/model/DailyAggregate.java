package com.positionledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-date totals feeding the cash fold. Combining is associative and commutative, so rows
 * can be reduced in any order or partitioned by date without changing the result.
 */
@Value
@Builder
public class DailyAggregate {

    public static final DailyAggregate EMPTY = DailyAggregate.builder()
            .turnoverBuy(BigDecimal.ZERO)
            .turnoverSell(BigDecimal.ZERO)
            .holdingsValue(BigDecimal.ZERO)
            .txCount(0)
            .build();

    BigDecimal turnoverBuy;
    BigDecimal turnoverSell;
    BigDecimal holdingsValue;
    int txCount;

    public DailyAggregate plus(DailyAggregate other) {
        return DailyAggregate.builder()
                .turnoverBuy(turnoverBuy.add(other.turnoverBuy))
                .turnoverSell(turnoverSell.add(other.turnoverSell))
                .holdingsValue(holdingsValue.add(other.holdingsValue))
                .txCount(txCount + other.txCount)
                .build();
    }

    /** Sell turnover minus buy turnover: cash received (positive) or paid (negative). */
    public BigDecimal getNetCashflow() {
        return turnoverSell.subtract(turnoverBuy);
    }
}

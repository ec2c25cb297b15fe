package com.positionledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Column totals over a range of {@link DailyPnlRow}s. */
@Value
@Builder
public class DailyPnlTotals {

    BigDecimal realisedPnl;
    BigDecimal unrealisedPnl;
    BigDecimal netPnl;
    BigDecimal openValue;
    BigDecimal turnoverBuy;
    BigDecimal turnoverSell;
    BigDecimal totalTurnover;
}

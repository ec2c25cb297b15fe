package com.positionledger.domain.model;

import com.positionledger.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A buy or sell event reconstructed from a snapshot's day-level aggregates.
 *
 * <p>Not a real fill: one snapshot yields at most one BUY and one SELL, each carrying the
 * day's total quantity at the day's average price. {@code qty} and {@code avgPrice} are
 * always strictly positive.
 */
@Value
@Builder
public class InferredTransaction {

    /** {@code date:exchange:symbol:product:side}. */
    String id;

    LocalDate asOfDate;
    String symbol;
    String exchange;
    String product;
    OrderSide side;
    BigDecimal qty;
    BigDecimal avgPrice;

    /** qty * avgPrice. */
    BigDecimal notional;

    public static String key(LocalDate date, String exchange, String symbol, String product, OrderSide side) {
        return date + ":" + exchange + ":" + symbol + ":" + product + ":" + side;
    }
}

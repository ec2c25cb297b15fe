package com.positionledger.ledger;

import java.math.BigDecimal;
import lombok.Value;

/** Resolved day quantity and average price for one side of a snapshot. */
@Value
public class SideAggregate {

    BigDecimal qty;
    BigDecimal avgPrice;

    /** True only when both quantity and price are strictly positive. */
    public boolean isTraded() {
        return qty.signum() > 0 && avgPrice.signum() > 0;
    }

    public BigDecimal getNotional() {
        return qty.multiply(avgPrice);
    }
}

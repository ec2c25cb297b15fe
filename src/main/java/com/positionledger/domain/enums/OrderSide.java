package com.positionledger.domain.enums;

/** Buy or sell side of an inferred transaction. Mirrors the broker's transaction_type values. */
public enum OrderSide {
    BUY,
    SELL
}

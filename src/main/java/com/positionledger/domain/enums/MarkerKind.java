package com.positionledger.domain.enums;

/** Chart marker glyphs used for trade markers on the cash and holdings curves. */
public enum MarkerKind {
    CROSSOVER,
    CROSSUNDER;

    public static MarkerKind forSide(OrderSide side) {
        return side == OrderSide.BUY ? CROSSOVER : CROSSUNDER;
    }
}

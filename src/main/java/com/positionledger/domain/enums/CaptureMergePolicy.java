package com.positionledger.domain.enums;

/**
 * How several captures of the same position (date, exchange, symbol, product) are combined.
 *
 * <p>A broker sync may run more than once a day. Whether each capture carries incremental
 * activity or the same cumulative day total is broker-dependent, so the choice is explicit.
 */
public enum CaptureMergePolicy {

    /** Every capture contributes. Two syncs of the same cumulative day total count twice. */
    SUM_ALL,

    /** Only the capture with the latest captured_at survives for each position and date. */
    LATEST_PER_DAY
}

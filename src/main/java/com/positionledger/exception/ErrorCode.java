package com.positionledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories raised by the ledger service and the snapshot file runner.
 * The ledger core itself never throws; these only surface at the outer layer.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_INPUT("INVALID_INPUT", false),
    COMPUTATION_TIMEOUT("COMPUTATION_TIMEOUT", true),
    COMPUTATION_REJECTED("COMPUTATION_REJECTED", true),
    COMPUTATION_INTERRUPTED("COMPUTATION_INTERRUPTED", false),
    COMPUTATION_FAILED("COMPUTATION_FAILED", false),
    FILE_READ_ERROR("FILE_READ_ERROR", false),
    FILE_WRITE_ERROR("FILE_WRITE_ERROR", false);

    private final String code;

    /** Whether a caller may reasonably resubmit the same work unchanged. */
    private final boolean retryable;
}

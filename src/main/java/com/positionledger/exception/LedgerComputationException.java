package com.positionledger.exception;

import java.util.Map;

/**
 * Raised when a bounded ledger computation cannot produce a complete result.
 * The whole pipeline is rejected; no partial ledger is ever returned alongside it.
 */
public class LedgerComputationException extends BaseException {

    public LedgerComputationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public LedgerComputationException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(errorCode, message, details, cause);
    }
}

package com.positionledger.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the ledger's unchecked exceptions. Carries an {@link ErrorCode} and a small map of
 * context values (timeout, snapshot count, file path) for the log line that reports it.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}

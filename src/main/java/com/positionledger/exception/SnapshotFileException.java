package com.positionledger.exception;

import java.util.Map;

public class SnapshotFileException extends BaseException {

    public SnapshotFileException(ErrorCode errorCode, String message, String path, Throwable cause) {
        super(errorCode, message, Map.of("path", path), cause);
    }
}

package com.lendingledger.exception;

import java.util.Map;

public class LedgerException extends BaseException {

    public LedgerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public LedgerException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}

package com.flagship.gold_history.history;

/**
 * Base class of the failures raised while writing history.
 */
public class HistoryException extends RuntimeException {

    private final HistoryErrorCode code;

    public HistoryException(HistoryErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public HistoryException(HistoryErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public HistoryErrorCode getCode() {
        return code;
    }
}

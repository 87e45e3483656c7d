package com.flagship.gold_history.history;

/**
 * The history store rejected or failed a write.
 */
public class StoreWriteFailureException extends HistoryException {

    public StoreWriteFailureException(String message, Throwable cause) {
        super(HistoryErrorCode.STORE_WRITE_FAILURE, message, cause);
    }
}

package com.flagship.gold_history.history;

/**
 * A snapshot that cannot be interpreted as a set of rows keyed by natural
 * key, or holding values the history tables cannot store.
 */
public class InvalidSnapshotException extends HistoryException {

    public InvalidSnapshotException(String message) {
        super(HistoryErrorCode.INVALID_SNAPSHOT, message);
    }

    public InvalidSnapshotException(String message, Throwable cause) {
        super(HistoryErrorCode.INVALID_SNAPSHOT, message, cause);
    }
}

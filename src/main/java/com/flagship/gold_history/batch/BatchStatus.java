package com.flagship.gold_history.batch;

/**
 * Lifecycle of a batch run: STARTED, then exactly one terminal status.
 */
public enum BatchStatus {
    STARTED,
    SUCCESS,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this != STARTED;
    }

    /**
     * Whether an identical extract with this status must not be processed again.
     */
    public boolean isProcessed() {
        return this == SUCCESS || this == SKIPPED;
    }
}

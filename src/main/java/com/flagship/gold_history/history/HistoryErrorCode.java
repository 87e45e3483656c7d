package com.flagship.gold_history.history;

/**
 * Failure taxonomy of the historization engine.
 *
 * Row-level codes (DANGLING_REFERENCE, DUPLICATE_SETTLEMENT) are reported
 * as diagnostics and never abort a batch. The others fail the whole call.
 */
public enum HistoryErrorCode {
    DUPLICATE_BATCH(false),
    LEDGER_CONFLICT(true),
    DANGLING_REFERENCE(false),
    DUPLICATE_SETTLEMENT(false),
    STORE_WRITE_FAILURE(true),
    HASH_MISMATCH_RACE(true),
    STALE_SNAPSHOT(false),
    INVALID_SNAPSHOT(false);

    private final boolean retryable;

    HistoryErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether re-running the same batch later can succeed without a change
     * to its input.
     */
    public boolean isRetryable() {
        return retryable;
    }
}

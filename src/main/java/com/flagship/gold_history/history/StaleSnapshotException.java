package com.flagship.gold_history.history;

import java.time.LocalDate;

/**
 * A snapshot dated before the current version of a key. History is
 * append-only, so such a snapshot cannot be merged.
 */
public class StaleSnapshotException extends HistoryException {

    public StaleSnapshotException(String naturalKey, LocalDate asOf, LocalDate currentValidFrom) {
        super(HistoryErrorCode.STALE_SNAPSHOT,
            String.format("Snapshot as of %s is older than the current version of %s (valid from %s)",
                asOf, naturalKey, currentValidFrom));
    }
}

package com.flagship.gold_history.history;

import java.time.LocalDate;

/**
 * The current version of a key changed between the read and the write of
 * a merge. The merge is rolled back; the batch may be retried.
 */
public class HashMismatchRaceException extends HistoryException {

    public HashMismatchRaceException(String table, String naturalKey, LocalDate validFrom, String expectedHash) {
        super(HistoryErrorCode.HASH_MISMATCH_RACE,
            String.format("Current version of %s[%s] valid from %s no longer matches hash %s",
                table, naturalKey, validFrom, expectedHash));
    }

    public HashMismatchRaceException(String message, Throwable cause) {
        super(HistoryErrorCode.HASH_MISMATCH_RACE, message, cause);
    }
}

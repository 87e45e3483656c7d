package com.flagship.gold_history.batch;

import com.flagship.gold_history.history.HistoryErrorCode;
import com.flagship.gold_history.history.HistoryException;

import java.time.LocalDate;

/**
 * Another run of the same extract is in progress.
 */
public class LedgerConflictException extends HistoryException {

    public LedgerConflictException(String dataset, LocalDate asOf, String checksum) {
        super(HistoryErrorCode.LEDGER_CONFLICT,
            String.format("A run of %s as of %s with checksum %s is already in progress", dataset, asOf, checksum));
    }

    public LedgerConflictException(String dataset, LocalDate asOf, String checksum, Throwable cause) {
        super(HistoryErrorCode.LEDGER_CONFLICT,
            String.format("Concurrent run of %s as of %s with checksum %s", dataset, asOf, checksum), cause);
    }
}

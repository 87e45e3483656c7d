package com.flagship.gold_history.ingestion;

import com.flagship.gold_history.history.HistoryErrorCode;
import com.flagship.gold_history.history.MergeResult;
import com.flagship.gold_history.history.RowDiagnostic;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * What happened to one submitted snapshot.
 */
@Value
@Builder
public class HistorizationOutcome {

    public enum Status {
        /** History written and batch committed as SUCCESS. */
        SUCCESS,
        /** Same extract already processed; history untouched. */
        SKIPPED,
        /** Batch rolled back and recorded FAILED. */
        FAILED,
        /** Same extract being processed concurrently; nothing recorded. */
        CONFLICT
    }

    Status status;
    String dataset;
    LocalDate asOf;
    Long batchId;
    HistoryErrorCode errorCode;
    boolean retryable;
    String message;
    @Singular
    List<MergeResult> results;

    public List<RowDiagnostic> getDiagnostics() {
        return results.stream()
            .flatMap(result -> result.getDiagnostics().stream())
            .toList();
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESS || status == Status.SKIPPED;
    }
}

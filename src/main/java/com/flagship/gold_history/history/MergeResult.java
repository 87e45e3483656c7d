package com.flagship.gold_history.history;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one merge or enrichment call.
 */
@Value
@Builder
public class MergeResult {
    String dataset;
    LocalDate asOf;
    Long batchId;
    Map<ChangeKind, Integer> changes;
    int rowsInserted;
    int rowsOverwritten;
    int rowsClosed;
    @Singular
    List<RowDiagnostic> diagnostics;

    public int count(ChangeKind kind) {
        return changes.getOrDefault(kind, 0);
    }

    /**
     * Number of rows inserted or rewritten by this call.
     */
    public int getRowsWritten() {
        return rowsInserted + rowsOverwritten;
    }

    public boolean isNoOp() {
        return getRowsWritten() == 0 && rowsClosed == 0;
    }

    @Override
    public String toString() {
        return String.format("%s as of %s: %s, inserted=%d, overwritten=%d, closed=%d, anomalies=%d",
            dataset, asOf, changes, rowsInserted, rowsOverwritten, rowsClosed, diagnostics.size());
    }
}

package com.flagship.gold_history.history;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the writes and counts of a merge before they are applied.
 */
class ChangeTally<T> {

    private final List<HistoryWrite<T>> writes = new ArrayList<>();
    private final Map<ChangeKind, Integer> changes = new EnumMap<>(ChangeKind.class);
    private final List<RowDiagnostic> diagnostics = new ArrayList<>();

    void record(ChangeKind kind, List<HistoryWrite<T>> keyWrites) {
        changes.merge(kind, 1, Integer::sum);
        writes.addAll(keyWrites);
    }

    void unchanged() {
        changes.merge(ChangeKind.UNCHANGED, 1, Integer::sum);
    }

    void anomaly(String naturalKey, HistoryErrorCode code, String message) {
        diagnostics.add(new RowDiagnostic(naturalKey, code, message));
    }

    List<HistoryWrite<T>> writes() {
        return Collections.unmodifiableList(writes);
    }

    MergeResult toResult(String dataset, LocalDate asOf, Long batchId) {
        return MergeResult.builder()
            .dataset(dataset)
            .asOf(asOf)
            .batchId(batchId)
            .changes(Collections.unmodifiableMap(new EnumMap<>(changes)))
            .rowsInserted(count(HistoryWrite.Type.INSERT))
            .rowsOverwritten(count(HistoryWrite.Type.OVERWRITE))
            .rowsClosed(count(HistoryWrite.Type.CLOSE))
            .diagnostics(diagnostics)
            .build();
    }

    private int count(HistoryWrite.Type type) {
        return (int) writes.stream().filter(write -> write.getType() == type).count();
    }
}

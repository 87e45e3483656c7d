package com.flagship.gold_history.history;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Turns "key K has version V as of date D" into history writes.
 *
 * <ul>
 *   <li>no current version: insert V, open from D</li>
 *   <li>current version opened before D: close it at D, insert V open from D</li>
 *   <li>current version opened on D: overwrite it with V (no zero-width interval)</li>
 *   <li>current version opened after D: refused, history is append-only</li>
 * </ul>
 */
@Component
public class IntervalPlanner {

    private final Clock clock;

    public IntervalPlanner(Clock clock) {
        this.clock = clock;
    }

    public <T> List<HistoryWrite<T>> open(String naturalKey, T attributes, boolean deleted,
                                          String recordHash, LocalDate asOf, long batchId) {
        return List.of(HistoryWrite.insert(newVersion(naturalKey, attributes, deleted, recordHash, asOf, batchId)));
    }

    public <T> List<HistoryWrite<T>> supersede(HistoryRecord<T> current, T attributes, boolean deleted,
                                               String recordHash, LocalDate asOf, long batchId) {
        if (!current.isCurrent()) {
            throw new IllegalArgumentException("Only the current version can be superseded: " + current.getNaturalKey());
        }
        if (asOf.isBefore(current.getValidFrom())) {
            throw new StaleSnapshotException(current.getNaturalKey(), asOf, current.getValidFrom());
        }
        HistoryRecord<T> successor = newVersion(current.getNaturalKey(), attributes, deleted, recordHash, asOf, batchId);
        if (isSameDay(current, asOf)) {
            return List.of(HistoryWrite.overwrite(current, successor));
        }
        return List.of(HistoryWrite.close(current, asOf), HistoryWrite.insert(successor));
    }

    public boolean isSameDay(HistoryRecord<?> current, LocalDate asOf) {
        return current.getValidFrom().equals(asOf);
    }

    private <T> HistoryRecord<T> newVersion(String naturalKey, T attributes, boolean deleted,
                                            String recordHash, LocalDate asOf, long batchId) {
        ValidityInterval interval = ValidityInterval.openFrom(asOf);
        return HistoryRecord.<T>builder()
            .naturalKey(naturalKey)
            .attributes(attributes)
            .validFrom(interval.getFrom())
            .validTo(interval.getTo())
            .current(true)
            .deleted(deleted)
            .recordHash(recordHash)
            .batchId(batchId)
            .ingestedAt(Instant.now(clock))
            .build();
    }
}

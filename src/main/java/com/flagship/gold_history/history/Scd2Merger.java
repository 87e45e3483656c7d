package com.flagship.gold_history.history;

import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.hashing.RecordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges a full snapshot of an entity into its SCD2 history.
 *
 * For every key of the snapshot:
 * <ul>
 *   <li>unknown key: open a first version</li>
 *   <li>same record_hash as the current version: nothing to write</li>
 *   <li>different hash: close the current version at the as-of date and open
 *       a successor, or overwrite it when it was opened on that same date</li>
 *   <li>current version is a tombstone: open a live version (resurrection)</li>
 * </ul>
 * Every live key missing from the snapshot gets a tombstone carrying its
 * last known attributes.
 *
 * All writes of one call are applied by the store in a single unit, so a
 * reader never sees a closed version without its successor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Scd2Merger {

    private final HistoryStore historyStore;
    private final RecordHasher recordHasher;
    private final IntervalPlanner intervalPlanner;

    /**
     * Applies a snapshot.
     *
     * @param definition the entity being historized
     * @param asOf logical date of the snapshot
     * @param snapshot every row of the entity as of {@code asOf}
     * @param batch the running batch stamped on every written version
     * @return what changed
     * @throws InvalidSnapshotException if a natural key is missing or repeated
     * @throws StaleSnapshotException if a key's current version is newer than {@code asOf}
     * @throws HashMismatchRaceException if a concurrent writer changed a current version
     */
    @Transactional
    public <T> MergeResult apply(EntityDefinition<T> definition, LocalDate asOf,
                                 Collection<T> snapshot, BatchRun batch) {
        requireRunning(batch);
        long batchId = batch.getId();
        Map<String, T> incoming = indexByKey(definition, snapshot);
        Map<String, HistoryRecord<T>> current = historyStore.findCurrent(definition);

        ChangeTally<T> tally = new ChangeTally<>();

        for (Map.Entry<String, T> entry : incoming.entrySet()) {
            String key = entry.getKey();
            HistoryRecord<T> existing = current.get(key);

            if (existing == null) {
                T row = definition.carryForward(null, entry.getValue());
                String hash = recordHasher.digest(definition, row, false);
                tally.record(ChangeKind.INSERTED, intervalPlanner.open(key, row, false, hash, asOf, batchId));
                continue;
            }

            T candidate = definition.carryForward(existing.getAttributes(), entry.getValue());
            String hash = recordHasher.digest(definition, candidate, false);
            if (hash.equals(existing.getRecordHash())) {
                tally.unchanged();
                continue;
            }

            ChangeKind kind;
            if (existing.isDeleted()) {
                kind = ChangeKind.RESURRECTED;
            } else if (intervalPlanner.isSameDay(existing, asOf)) {
                kind = ChangeKind.CORRECTED;
            } else {
                kind = ChangeKind.UPDATED;
            }
            tally.record(kind, intervalPlanner.supersede(existing, candidate, false, hash, asOf, batchId));
        }

        for (HistoryRecord<T> existing : current.values()) {
            if (existing.isDeleted() || incoming.containsKey(existing.getNaturalKey())) {
                continue;
            }
            String hash = recordHasher.digest(definition, existing.getAttributes(), true);
            tally.record(ChangeKind.DELETED,
                intervalPlanner.supersede(existing, existing.getAttributes(), true, hash, asOf, batchId));
        }

        historyStore.apply(definition, tally.writes());

        MergeResult result = tally.toResult(definition.getDataset(), asOf, batchId);
        log.info("Merged snapshot into {} under batch {}: {}", definition.getTable(), batchId, result);
        return result;
    }

    private <T> Map<String, T> indexByKey(EntityDefinition<T> definition, Collection<T> snapshot) {
        if (snapshot == null) {
            throw new InvalidSnapshotException("Snapshot of " + definition.getDataset() + " cannot be null");
        }
        Map<String, T> byKey = new TreeMap<>();
        for (T row : snapshot) {
            String key = definition.naturalKey(row);
            if (key == null || key.isBlank()) {
                throw new InvalidSnapshotException("Row without natural key in " + definition.getDataset() + " snapshot");
            }
            if (byKey.putIfAbsent(key, row) != null) {
                throw new InvalidSnapshotException(
                    String.format("Natural key %s appears twice in %s snapshot", key, definition.getDataset()));
            }
        }
        return byKey;
    }

    static void requireRunning(BatchRun batch) {
        if (batch == null || batch.getId() == null) {
            throw new IllegalArgumentException("A started batch is required");
        }
        if (!batch.isRunning()) {
            throw new IllegalStateException(
                String.format("Batch %d is %s, history can only be written under a STARTED batch",
                    batch.getId(), batch.getStatus()));
        }
    }
}

package com.flagship.gold_history.history;

import com.flagship.gold_history.entity.EntityDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned storage of entity histories, one table per entity.
 *
 * Implementations must apply the writes of one {@link #apply} call
 * all-or-nothing, and must reject a CLOSE or OVERWRITE whose target row is
 * no longer current with the expected hash by throwing
 * {@link HashMismatchRaceException}.
 */
public interface HistoryStore {

    /**
     * Current versions (live and tombstones) keyed by natural key.
     */
    <T> Map<String, HistoryRecord<T>> findCurrent(EntityDefinition<T> definition);

    <T> Optional<HistoryRecord<T>> findCurrentVersion(EntityDefinition<T> definition, String naturalKey);

    /**
     * All versions of a key ordered by valid_from.
     */
    <T> List<HistoryRecord<T>> findHistory(EntityDefinition<T> definition, String naturalKey);

    <T> void apply(EntityDefinition<T> definition, List<HistoryWrite<T>> writes);
}

package com.flagship.gold_history.history;

import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.entity.EntityDefinitions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the Gold history: version chains and point-in-time lookups.
 */
@Service
@RequiredArgsConstructor
public class HistoryQueryService {

    private final HistoryStore historyStore;

    /**
     * All versions of a key, oldest first.
     *
     * @throws IllegalArgumentException if the dataset is unknown
     */
    @Transactional(readOnly = true)
    public List<HistoryRecord<?>> history(String dataset, String naturalKey) {
        return List.copyOf(historyStore.findHistory(definition(dataset), naturalKey));
    }

    /**
     * The version whose validity interval contains the date. A tombstone is
     * returned as is; callers decide whether a deleted version counts.
     */
    @Transactional(readOnly = true)
    public Optional<HistoryRecord<?>> versionAt(String dataset, String naturalKey, LocalDate date) {
        return historyStore.findHistory(definition(dataset), naturalKey).stream()
            .filter(record -> record.getInterval().contains(date))
            .<HistoryRecord<?>>map(record -> record)
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<HistoryRecord<?>> current(String dataset, String naturalKey) {
        return historyStore.findCurrentVersion(definition(dataset), naturalKey)
            .map(record -> record);
    }

    private static EntityDefinition<?> definition(String dataset) {
        return EntityDefinitions.byDataset(dataset)
            .orElseThrow(() -> new IllegalArgumentException("Unknown dataset: " + dataset));
    }
}

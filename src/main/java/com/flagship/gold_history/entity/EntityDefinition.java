package com.flagship.gold_history.entity;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Describes how one entity is historized.
 *
 * The SCD2 merge algorithm is written once against this type; each entity
 * contributes its natural key, its business columns and the conversions
 * between its value object and a column map.
 *
 * @param <T> the entity value type
 */
@Getter
public abstract class EntityDefinition<T> {

    private final String dataset;
    private final String table;
    private final String keyColumn;
    private final List<HistoryColumn> businessColumns;

    protected EntityDefinition(String dataset, String table, String keyColumn,
                               List<HistoryColumn> businessColumns) {
        this.dataset = dataset;
        this.table = table;
        this.keyColumn = keyColumn;
        this.businessColumns = List.copyOf(businessColumns);
    }

    public abstract String naturalKey(T entity);

    /**
     * Business column values keyed by column name. The natural key is not
     * part of the map.
     */
    public abstract Map<String, Object> toColumns(T entity);

    public abstract T fromColumns(String naturalKey, Map<String, Object> columns);

    /**
     * Builds the candidate version for an incoming snapshot row given the
     * version currently stored for the same key. Entities whose history
     * holds columns owned by another feed copy them over here; the default
     * takes the snapshot row as is.
     *
     * @param current the attributes of the current version, or null
     * @param incoming the snapshot row
     */
    public T carryForward(T current, T incoming) {
        return incoming;
    }

    @Override
    public String toString() {
        return dataset;
    }
}

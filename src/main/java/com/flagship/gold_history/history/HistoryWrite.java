package com.flagship.gold_history.history;

import lombok.Value;

import java.time.LocalDate;

/**
 * A single write against a history table.
 *
 * CLOSE and OVERWRITE target an existing current row identified by
 * (naturalKey, targetValidFrom) and only apply while that row still has
 * {@code expectedHash}; a store must fail the whole unit otherwise.
 *
 * @param <T> the entity value type
 */
@Value
public class HistoryWrite<T> {

    public enum Type {
        INSERT,
        CLOSE,
        OVERWRITE
    }

    Type type;
    String naturalKey;
    LocalDate targetValidFrom;
    String expectedHash;
    LocalDate closeAt;
    HistoryRecord<T> record;

    public static <T> HistoryWrite<T> insert(HistoryRecord<T> record) {
        return new HistoryWrite<>(Type.INSERT, record.getNaturalKey(), record.getValidFrom(),
            null, null, record);
    }

    public static <T> HistoryWrite<T> close(HistoryRecord<T> current, LocalDate closeAt) {
        return new HistoryWrite<>(Type.CLOSE, current.getNaturalKey(), current.getValidFrom(),
            current.getRecordHash(), closeAt, null);
    }

    public static <T> HistoryWrite<T> overwrite(HistoryRecord<T> current, HistoryRecord<T> replacement) {
        return new HistoryWrite<>(Type.OVERWRITE, current.getNaturalKey(), current.getValidFrom(),
            current.getRecordHash(), null, replacement);
    }
}

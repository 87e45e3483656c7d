package com.flagship.gold_history.history;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One version of an entity in its history table.
 *
 * @param <T> the entity value type
 */
@Value
@Builder(toBuilder = true)
public class HistoryRecord<T> {
    String naturalKey;
    T attributes;
    LocalDate validFrom;
    LocalDate validTo;
    boolean current;
    boolean deleted;
    String recordHash;
    Long batchId;
    Instant ingestedAt;

    public ValidityInterval getInterval() {
        return new ValidityInterval(validFrom, validTo);
    }

    /**
     * A live (current, not deleted) version that has not been superseded.
     */
    public boolean isLive() {
        return current && !deleted;
    }

    /**
     * Returns this version closed at the given date.
     */
    public HistoryRecord<T> closedAt(LocalDate date) {
        return toBuilder()
            .validTo(getInterval().closeAt(date).getTo())
            .current(false)
            .build();
    }
}

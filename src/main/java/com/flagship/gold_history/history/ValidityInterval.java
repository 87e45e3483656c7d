package com.flagship.gold_history.history;

import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Half-open validity interval [from, to) of a history version.
 *
 * An open interval ends at the {@link #OPEN_END} sentinel. Intervals are
 * never empty: closing an interval on its own start date is rejected, which
 * is why a same-day correction overwrites the version instead.
 */
@Value
public class ValidityInterval {

    public static final LocalDate OPEN_END = LocalDate.of(9999, 12, 31);

    LocalDate from;
    LocalDate to;

    public ValidityInterval(LocalDate from, LocalDate to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException(
                String.format("Empty validity interval [%s, %s)", from, to));
        }
    }

    public static ValidityInterval openFrom(LocalDate from) {
        return new ValidityInterval(from, OPEN_END);
    }

    public boolean isOpen() {
        return OPEN_END.equals(to);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && date.isBefore(to);
    }

    /**
     * Ends this interval at the given date (exclusive).
     *
     * @throws IllegalArgumentException if the date is not strictly inside the interval
     */
    public ValidityInterval closeAt(LocalDate date) {
        if (!date.isAfter(from) || date.isAfter(to)) {
            throw new IllegalArgumentException(
                String.format("Cannot close [%s, %s) at %s", from, to, date));
        }
        return new ValidityInterval(from, date);
    }

    /**
     * True when {@code next} starts exactly where this interval ends.
     */
    public boolean meets(ValidityInterval next) {
        return to.equals(next.from);
    }

    public boolean overlaps(ValidityInterval other) {
        return from.isBefore(other.to) && other.from.isBefore(to);
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + ")";
    }
}

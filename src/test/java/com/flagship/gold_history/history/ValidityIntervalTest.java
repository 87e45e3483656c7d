package com.flagship.gold_history.history;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ValidityIntervalTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate D3 = LocalDate.of(2024, 1, 3);

    @Test
    @DisplayName("Open interval ends at 9999-12-31")
    void testOpenFrom() {
        ValidityInterval interval = ValidityInterval.openFrom(D1);

        assertTrue(interval.isOpen());
        assertEquals(LocalDate.of(9999, 12, 31), interval.getTo());
        assertEquals("[2024-01-01, 9999-12-31)", interval.toString());
        assertTrue(interval.toString().chars().allMatch(c -> c < 128));
    }

    @Test
    @DisplayName("Interval is half-open: start included, end excluded")
    void testContains_HalfOpen() {
        ValidityInterval interval = new ValidityInterval(D1, D3);

        assertTrue(interval.contains(D1));
        assertTrue(interval.contains(D2));
        assertFalse(interval.contains(D3));
        assertFalse(interval.contains(D1.minusDays(1)));
    }

    @Test
    @DisplayName("Empty or inverted intervals are rejected")
    void testConstructor_RejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new ValidityInterval(D1, D1));
        assertThrows(IllegalArgumentException.class, () -> new ValidityInterval(D2, D1));
    }

    @Test
    @DisplayName("Closing at the start date would be zero-width and is rejected")
    void testCloseAt_RejectsStartDate() {
        ValidityInterval interval = ValidityInterval.openFrom(D2);

        assertThrows(IllegalArgumentException.class, () -> interval.closeAt(D2));
        assertThrows(IllegalArgumentException.class, () -> interval.closeAt(D1));
    }

    @Test
    @DisplayName("Closed interval meets its successor and does not overlap it")
    void testCloseAt_MeetsSuccessor() {
        ValidityInterval closed = ValidityInterval.openFrom(D1).closeAt(D3);
        ValidityInterval successor = ValidityInterval.openFrom(D3);

        assertEquals(new ValidityInterval(D1, D3), closed);
        assertTrue(closed.meets(successor));
        assertFalse(closed.overlaps(successor));
        assertTrue(ValidityInterval.openFrom(D2).overlaps(closed));
    }
}

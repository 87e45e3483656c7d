package com.flagship.gold_history.support;

import com.flagship.gold_history.history.HistoryRecord;
import com.flagship.gold_history.history.ValidityInterval;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks that a key's versions partition time: ordered, gap-free,
 * non-overlapping, with exactly one current version which is the last one
 * and is open-ended.
 */
public final class HistoryAssertions {

    private HistoryAssertions() {
        // Utility class
    }

    public static <T> void assertPartitioned(List<HistoryRecord<T>> versions) {
        assertFalse(versions.isEmpty(), "expected at least one version");

        long currentCount = versions.stream().filter(HistoryRecord::isCurrent).count();
        assertEquals(1, currentCount, "exactly one current version expected");

        for (int i = 1; i < versions.size(); i++) {
            ValidityInterval previous = versions.get(i - 1).getInterval();
            ValidityInterval next = versions.get(i).getInterval();
            assertTrue(previous.meets(next),
                "version " + previous + " must end where " + next + " starts");
            assertFalse(versions.get(i - 1).isCurrent(), "only the last version may be current");
        }

        HistoryRecord<T> last = versions.get(versions.size() - 1);
        assertTrue(last.isCurrent());
        assertTrue(last.getInterval().isOpen());
    }
}

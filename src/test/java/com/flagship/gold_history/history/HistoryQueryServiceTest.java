package com.flagship.gold_history.history;

import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.batch.BatchStatus;
import com.flagship.gold_history.entity.Employee;
import com.flagship.gold_history.entity.EntityDefinitions;
import com.flagship.gold_history.hashing.RecordHasher;
import com.flagship.gold_history.support.InMemoryHistoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-02-01T10:00:00Z");
    private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate D3 = LocalDate.of(2024, 1, 3);
    private static final LocalDate D5 = LocalDate.of(2024, 1, 5);

    private HistoryQueryService queryService;

    @BeforeEach
    void setUp() {
        InMemoryHistoryStore store = new InMemoryHistoryStore();
        Scd2Merger merger = new Scd2Merger(store, new RecordHasher(), new IntervalPlanner(Clock.fixed(NOW, ZoneOffset.UTC)));
        queryService = new HistoryQueryService(store);

        merger.apply(EntityDefinitions.EMPLOYEE, D1, List.of(employee("Diaz")), batch(1L, D1));
        merger.apply(EntityDefinitions.EMPLOYEE, D3, List.of(employee("Diaz-Lopez")), batch(2L, D3));
        merger.apply(EntityDefinitions.EMPLOYEE, D5, List.of(), batch(3L, D5));
    }

    private static Employee employee(String lastName) {
        return Employee.builder().ref("E1").lastName(lastName).build();
    }

    private static BatchRun batch(long id, LocalDate asOf) {
        return new BatchRun(id, "employee", asOf, "erp", "c" + id, NOW, null, BatchStatus.STARTED, null);
    }

    @Test
    @DisplayName("The full chain is returned oldest first")
    void testHistory() {
        List<HistoryRecord<?>> versions = queryService.history("employee", "E1");

        assertEquals(3, versions.size());
        assertEquals(D1, versions.get(0).getValidFrom());
        assertEquals(D3, versions.get(1).getValidFrom());
        assertTrue(versions.get(2).isDeleted());
        assertTrue(queryService.history("employee", "E404").isEmpty());
    }

    @Test
    @DisplayName("A date resolves to the version whose interval contains it")
    void testVersionAt() {
        assertEquals("Diaz", ((Employee) queryService.versionAt("employee", "E1", LocalDate.of(2024, 1, 2))
            .orElseThrow().getAttributes()).getLastName());
        assertEquals(D3, queryService.versionAt("employee", "E1", D3).orElseThrow().getValidFrom());
        assertTrue(queryService.versionAt("employee", "E1", D5).orElseThrow().isDeleted());
        assertTrue(queryService.versionAt("employee", "E1", LocalDate.of(2023, 12, 31)).isEmpty());
    }

    @Test
    @DisplayName("The current version of a deleted key is its tombstone")
    void testCurrent() {
        HistoryRecord<?> current = queryService.current("employee", "E1").orElseThrow();

        assertTrue(current.isCurrent());
        assertTrue(current.isDeleted());
        assertEquals(3L, current.getBatchId());
    }

    @Test
    @DisplayName("Unknown datasets are rejected")
    void testUnknownDataset() {
        assertThrows(IllegalArgumentException.class, () -> queryService.history("planet", "E1"));
    }
}

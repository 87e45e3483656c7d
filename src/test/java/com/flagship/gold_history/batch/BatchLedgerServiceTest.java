package com.flagship.gold_history.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the batch ledger against PostgreSQL.
 *
 * These tests try to break the run-once guarantee:
 * - the same extract submitted twice
 * - the same extract submitted while still running
 * - a failed extract submitted again
 * - completing a run twice
 * - a late retry reported as a stuck run, or losing its failure message
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class BatchLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("test_gold")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    private static final LocalDate AS_OF = LocalDate.of(2024, 1, 1);

    @Autowired
    private BatchLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static String checksum() {
        return "sha-" + UUID.randomUUID();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ " + message);
    }

    @Test
    @DisplayName("A new extract opens a STARTED run with the default source")
    void testBegin_NewExtract() {
        printTestHeader("New extract opens a run");
        String checksum = checksum();

        BatchStart start = ledgerService.begin("employee", AS_OF, null, checksum);

        assertFalse(start.isSkipped());
        BatchRun run = start.getBatch();
        assertNotNull(run.getId());
        assertEquals(BatchStatus.STARTED, run.getStatus());
        assertEquals(BatchLedgerService.DEFAULT_SOURCE, run.getSourceName());
        assertEquals(checksum, run.getSourceChecksum());
        assertNull(run.getFinishedAt());
        printSuccess("Run " + run.getId() + " started");
    }

    @Test
    @DisplayName("A successfully processed extract is skipped")
    void testBegin_ProcessedExtractIsSkipped() {
        printTestHeader("Processed extract is skipped");
        String checksum = checksum();
        BatchRun first = ledgerService.begin("employee", AS_OF, "erp", checksum).getBatch();
        ledgerService.complete(first.getId(), BatchStatus.SUCCESS, "ok");

        BatchStart again = ledgerService.begin("employee", AS_OF, "erp", checksum);

        assertTrue(again.isSkipped());
        assertEquals(first.getId(), again.getBatch().getId());
        assertEquals(BatchStatus.SUCCESS, again.getBatch().getStatus());
        printSuccess("Second submission pointed at run " + first.getId());
    }

    @Test
    @DisplayName("A running extract cannot be started twice")
    void testBegin_RunningExtractConflicts() {
        printTestHeader("Running extract conflicts");
        String checksum = checksum();
        ledgerService.begin("advance_request", AS_OF, null, checksum);

        LedgerConflictException e = assertThrows(LedgerConflictException.class,
            () -> ledgerService.begin("advance_request", AS_OF, null, checksum));

        assertTrue(e.getCode().isRetryable());
        printSuccess("Conflict raised: " + e.getMessage());
    }

    @Test
    @DisplayName("A failed extract is re-opened under the same run id")
    void testBegin_FailedExtractIsReopened() {
        printTestHeader("Failed extract is re-opened");
        String checksum = checksum();
        BatchRun failed = ledgerService.begin("payment", AS_OF, null, checksum).getBatch();
        ledgerService.complete(failed.getId(), BatchStatus.FAILED, "STALE_SNAPSHOT: boom");

        BatchStart retry = ledgerService.begin("payment", AS_OF, null, checksum);

        assertFalse(retry.isSkipped());
        assertEquals(failed.getId(), retry.getBatch().getId());
        assertEquals(BatchStatus.STARTED, retry.getBatch().getStatus());
        assertNull(retry.getBatch().getFinishedAt());
        printSuccess("Run " + failed.getId() + " re-opened");
    }

    @Test
    @DisplayName("A late retry is not stale and keeps the message of the failed attempt")
    void testReopen_LateRetryKeepsAuditAndIsNotStale() {
        printTestHeader("Late retry of a failed extract");
        String checksum = checksum();
        BatchRun failed = ledgerService.begin("employee", AS_OF, null, checksum).getBatch();
        ledgerService.complete(failed.getId(), BatchStatus.FAILED, "STORE_WRITE_FAILURE: connection reset");
        jdbcTemplate.update(
            "UPDATE etl.batch_run SET started_at = now() - interval '3 days' WHERE batch_id = ?", failed.getId());
        long staleBefore = ledgerService.countStaleStarted(Duration.ofHours(1));

        BatchRun retry = ledgerService.begin("employee", AS_OF, null, checksum).getBatch();

        assertEquals(staleBefore, ledgerService.countStaleStarted(Duration.ofHours(1)));
        assertEquals("Previous attempt: STORE_WRITE_FAILURE: connection reset", retry.getMessage());

        BatchRun done = ledgerService.complete(retry.getId(), BatchStatus.SUCCESS, "employee: 1 inserted");
        assertEquals("Previous attempt: STORE_WRITE_FAILURE: connection reset | employee: 1 inserted",
            done.getMessage());
        assertTrue(done.getStartedAt().isBefore(done.getFinishedAt().minus(Duration.ofDays(2))));
        printSuccess("Retry audited: " + done.getMessage());
    }

    @Test
    @DisplayName("A run STARTED long ago is reported as stale")
    void testCountStaleStarted_FindsStuckRun() {
        printTestHeader("Stuck run is stale");
        BatchRun stuck = ledgerService.begin("employee", AS_OF, null, checksum()).getBatch();
        long staleBefore = ledgerService.countStaleStarted(Duration.ofHours(1));

        jdbcTemplate.update(
            "UPDATE etl.batch_run SET started_at = now() - interval '3 hours' WHERE batch_id = ?", stuck.getId());

        assertEquals(staleBefore + 1, ledgerService.countStaleStarted(Duration.ofHours(1)));
        ledgerService.complete(stuck.getId(), BatchStatus.FAILED, "abandoned");
        printSuccess("Stuck run " + stuck.getId() + " detected");
    }

    @Test
    @DisplayName("Different checksums for the same date are different extracts")
    void testBegin_DifferentChecksumsAreIndependent() {
        printTestHeader("Different checksums are independent");
        BatchRun a = ledgerService.begin("employee", AS_OF, null, checksum()).getBatch();
        BatchRun b = ledgerService.begin("employee", AS_OF, null, checksum()).getBatch();

        assertNotEquals(a.getId(), b.getId());
        printSuccess("Two runs: " + a.getId() + ", " + b.getId());
    }

    @Test
    @DisplayName("A completed run cannot be completed again")
    void testComplete_OnlyOnce() {
        printTestHeader("Complete only once");
        BatchRun run = ledgerService.begin("employee", AS_OF, null, checksum()).getBatch();

        BatchRun completed = ledgerService.complete(run.getId(), BatchStatus.SUCCESS, "done");
        assertEquals(BatchStatus.SUCCESS, completed.getStatus());
        assertNotNull(completed.getFinishedAt());
        assertEquals("done", completed.getMessage());

        assertThrows(IllegalStateException.class,
            () -> ledgerService.complete(run.getId(), BatchStatus.FAILED, "late"));
        printSuccess("Second completion rejected");
    }

    @Test
    @DisplayName("Completing with a non-terminal status or an unknown id is rejected")
    void testComplete_RejectsInvalidInput() {
        printTestHeader("Invalid completion");
        BatchRun run = ledgerService.begin("employee", AS_OF, null, checksum()).getBatch();

        assertThrows(IllegalArgumentException.class,
            () -> ledgerService.complete(run.getId(), BatchStatus.STARTED, "again"));
        assertThrows(IllegalArgumentException.class,
            () -> ledgerService.complete(Long.MAX_VALUE, BatchStatus.SUCCESS, "ghost"));
        printSuccess("Invalid completions rejected");
    }

    @Test
    @DisplayName("Missing dataset, date or checksum is rejected")
    void testBegin_RequiresIdentity() {
        printTestHeader("Extract identity required");
        assertThrows(IllegalArgumentException.class, () -> ledgerService.begin(" ", AS_OF, null, checksum()));
        assertThrows(IllegalArgumentException.class, () -> ledgerService.begin("employee", null, null, checksum()));
        assertThrows(IllegalArgumentException.class, () -> ledgerService.begin("employee", AS_OF, null, null));
        printSuccess("Incomplete identities rejected");
    }

    @Test
    @DisplayName("Runs are listed newest first and the latest success is found")
    void testFindRuns() {
        printTestHeader("Run listing");
        LocalDate asOf = LocalDate.of(2031, 5, 17);
        BatchRun older = ledgerService.begin("employee", asOf, null, checksum()).getBatch();
        ledgerService.complete(older.getId(), BatchStatus.SUCCESS, "ok");
        BatchRun newer = ledgerService.begin("employee", asOf, null, checksum()).getBatch();
        ledgerService.complete(newer.getId(), BatchStatus.FAILED, "boom");

        assertEquals(2, ledgerService.findRuns("employee", asOf).size());
        assertEquals(newer.getId(), ledgerService.findRuns("employee", asOf).get(0).getId());
        assertEquals(older.getId(), ledgerService.findLatestSuccessful("employee", asOf).orElseThrow().getId());
        assertTrue(ledgerService.findById(newer.getId()).isPresent());
        assertEquals(0, ledgerService.countStaleStarted(Duration.ofDays(1)));
        printSuccess("Listing and lookups consistent");
    }
}

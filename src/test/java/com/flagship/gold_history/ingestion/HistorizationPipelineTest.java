package com.flagship.gold_history.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gold_history.batch.BatchLedgerService;
import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.batch.BatchStatus;
import com.flagship.gold_history.entity.AdvanceRequest;
import com.flagship.gold_history.entity.Employee;
import com.flagship.gold_history.entity.EntityDefinitions;
import com.flagship.gold_history.entity.Payment;
import com.flagship.gold_history.history.HistoryErrorCode;
import com.flagship.gold_history.history.HistoryQueryService;
import com.flagship.gold_history.history.HistoryRecord;
import com.flagship.gold_history.history.HistoryStore;
import com.flagship.gold_history.outbox.BatchCompletedEvent;
import com.flagship.gold_history.outbox.OutboxEvent;
import com.flagship.gold_history.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.flagship.gold_history.support.HistoryAssertions.assertPartitioned;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the historization pipeline against PostgreSQL.
 *
 * These tests verify:
 * - versions written by the JDBC store keep their intervals partitioned
 * - a failing batch leaves no history rows behind
 * - the ledger and the outbox follow the history transaction
 * - a failed extract is retried under its original run
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class HistorizationPipelineTest {

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

    private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate D3 = LocalDate.of(2024, 1, 3);
    private static final LocalDate D4 = LocalDate.of(2024, 1, 4);
    private static final LocalDate D5 = LocalDate.of(2024, 1, 5);

    @Autowired
    private HistorizationService historizationService;

    @Autowired
    private HistoryQueryService historyQueryService;

    @Autowired
    private HistoryStore historyStore;

    @Autowired
    private BatchLedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE gold.employee_history, gold.advance_request_history, "
            + "gold.payment_history, outbox_events, etl.batch_run CASCADE");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ " + message);
    }

    private static Employee employee(String ref, String lastName) {
        return Employee.builder().ref(ref).nationalId("N-" + ref).lastName(lastName).firstName("Ana").build();
    }

    private static AdvanceRequest request(String ref, String amount) {
        return AdvanceRequest.builder().ref(ref).employeeRef("E1").requestedAmount(new BigDecimal(amount)).build();
    }

    private static Payment payment(String ref, String requestRef, LocalDate date) {
        return Payment.builder().ref(ref).employeeRef("E1").paidAmount(new BigDecimal("500.00"))
            .employeeBankRef("BANK-1").paymentDate(date).requestRef(requestRef).build();
    }

    private HistorizationOutcome employees(LocalDate asOf, Employee... rows) {
        return historizationService.historizeEmployees(
            SnapshotSubmission.<Employee>builder().asOf(asOf).rows(List.of(rows)).build());
    }

    private HistorizationOutcome requests(LocalDate asOf, AdvanceRequest... rows) {
        return historizationService.historizeRequests(
            SnapshotSubmission.<AdvanceRequest>builder().asOf(asOf).rows(List.of(rows)).build());
    }

    private HistorizationOutcome payments(LocalDate asOf, Payment... rows) {
        return historizationService.historizePayments(
            SnapshotSubmission.<Payment>builder().asOf(asOf).rows(List.of(rows)).build());
    }

    private int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Attribute changes close the previous version and open a new one")
    void testEmployeeVersionChain() {
        printTestHeader("Employee version chain");

        assertEquals(HistorizationOutcome.Status.SUCCESS, employees(D1, employee("E1", "Diaz")).getStatus());
        assertEquals(HistorizationOutcome.Status.SUCCESS, employees(D2, employee("E1", "Diaz")).getStatus());
        assertEquals(HistorizationOutcome.Status.SUCCESS, employees(D3, employee("E1", "Diaz-Lopez")).getStatus());

        List<HistoryRecord<Employee>> versions = historyStore.findHistory(EntityDefinitions.EMPLOYEE, "E1");
        assertEquals(2, versions.size());
        assertPartitioned(versions);
        assertEquals(D3, versions.get(0).getValidTo());
        assertEquals("Diaz-Lopez", versions.get(1).getAttributes().getLastName());

        HistoryRecord<?> atD2 = historyQueryService.versionAt("employee", "E1", D2).orElseThrow();
        assertEquals(D1, atD2.getValidFrom());
        assertTrue(historyQueryService.versionAt("employee", "E1", LocalDate.of(2023, 12, 31)).isEmpty());
        printSuccess("Chain of " + versions.size() + " versions");
    }

    @Test
    @DisplayName("Scenario A: unchanged re-ingest is a no-op and a payment settles the request")
    void testScenarioA() {
        printTestHeader("Scenario A");
        employees(D1, employee("E1", "Diaz"));
        requests(D1, request("R1", "500.00"));
        employees(D2, employee("E1", "Diaz"));
        requests(D2, request("R1", "500.00"));

        assertEquals(1, countRows("gold.employee_history"));
        assertEquals(1, countRows("gold.advance_request_history"));

        HistorizationOutcome outcome = payments(D3, payment("P1", "R1", D3));

        assertEquals(HistorizationOutcome.Status.SUCCESS, outcome.getStatus());
        List<HistoryRecord<AdvanceRequest>> r1 = historyStore.findHistory(EntityDefinitions.ADVANCE_REQUEST, "R1");
        assertEquals(2, r1.size());
        assertPartitioned(r1);
        AdvanceRequest settled = r1.get(1).getAttributes();
        assertEquals(0, new BigDecimal("500.00").compareTo(settled.getPaidAmount()));
        assertEquals(D3, settled.getPaymentDate());
        assertEquals("P1", settled.getPaymentRef());
        assertEquals(outcome.getBatchId(), r1.get(1).getBatchId());
        printSuccess("R1 settled by P1 under batch " + outcome.getBatchId());
    }

    @Test
    @DisplayName("Scenario B: omitted request is tombstoned, then resurrected")
    void testScenarioB() {
        printTestHeader("Scenario B");
        requests(D1, request("R1", "500.00"), request("R2", "300.00"));
        requests(D4, request("R2", "300.00"));
        requests(D5, request("R1", "500.00"), request("R2", "300.00"));

        List<HistoryRecord<AdvanceRequest>> r1 = historyStore.findHistory(EntityDefinitions.ADVANCE_REQUEST, "R1");
        assertEquals(3, r1.size());
        assertPartitioned(r1);
        assertTrue(r1.get(1).isDeleted());
        assertEquals(D4, r1.get(1).getValidFrom());
        assertEquals(D5, r1.get(1).getValidTo());
        assertFalse(r1.get(2).isDeleted());
        assertNotEquals(r1.get(1).getRecordHash(), r1.get(2).getRecordHash());

        Integer currentRows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM gold.advance_request_history WHERE ref = 'R1' AND is_current", Integer.class);
        assertEquals(1, currentRows);
        printSuccess("R1 went live, deleted, live again");
    }

    @Test
    @DisplayName("A batch failing after its merge leaves no history rows")
    void testFailedBatchRollsBack() {
        printTestHeader("Failed batch rolls back");
        requests(D3, request("R1", "500.00"));

        // the payment merge succeeds, the settlement is stale against the D3 request version
        HistorizationOutcome outcome = payments(D1, payment("P1", "R1", D1));

        assertEquals(HistorizationOutcome.Status.FAILED, outcome.getStatus());
        assertEquals(HistoryErrorCode.STALE_SNAPSHOT, outcome.getErrorCode());
        assertFalse(outcome.isRetryable());
        assertEquals(0, countRows("gold.payment_history"));
        assertEquals(1, countRows("gold.advance_request_history"));

        BatchRun run = ledgerService.findById(outcome.getBatchId()).orElseThrow();
        assertEquals(BatchStatus.FAILED, run.getStatus());
        assertTrue(run.getMessage().startsWith("STALE_SNAPSHOT"));

        List<OutboxEvent> events = outboxService.getEventsForBatch(outcome.getBatchId());
        assertEquals(1, events.size());
        assertEquals(BatchCompletedEvent.FAILED, events.get(0).getEventType());
        printSuccess("Nothing of batch " + outcome.getBatchId() + " survived");
    }

    @Test
    @DisplayName("A committed batch is SUCCESS in the ledger with one BatchSucceeded event")
    void testSuccessWritesLedgerAndOutbox() throws Exception {
        printTestHeader("Ledger and outbox follow the commit");
        HistorizationOutcome outcome = employees(D1, employee("E1", "Diaz"));

        BatchRun run = ledgerService.findById(outcome.getBatchId()).orElseThrow();
        assertEquals(BatchStatus.SUCCESS, run.getStatus());
        assertNotNull(run.getFinishedAt());

        List<OutboxEvent> events = outboxService.getEventsForBatch(outcome.getBatchId());
        assertEquals(1, events.size());
        assertEquals(BatchCompletedEvent.SUCCEEDED, events.get(0).getEventType());
        JsonNode payload = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(outcome.getBatchId().longValue(), payload.get("batch_id").asLong());
        assertEquals("employee", payload.get("dataset").asText());
        printSuccess("Batch " + outcome.getBatchId() + " announced");
    }

    @Test
    @DisplayName("The same extract submitted twice is processed once")
    void testDuplicateExtractIsSkipped() {
        printTestHeader("Duplicate extract skipped");
        HistorizationOutcome first = employees(D1, employee("E1", "Diaz"));
        HistorizationOutcome second = employees(D1, employee("E1", "Diaz"));

        assertEquals(HistorizationOutcome.Status.SKIPPED, second.getStatus());
        assertEquals(first.getBatchId(), second.getBatchId());
        assertEquals(1, countRows("etl.batch_run"));
        assertEquals(1, countRows("outbox_events"));
        printSuccess("Second submission skipped");
    }

    @Test
    @DisplayName("A failed extract is retried under its original run")
    void testRetryReopensFailedRun() {
        printTestHeader("Retry re-opens failed run");
        BatchRun failed = ledgerService.begin("employee", D1, null, "extract-1").getBatch();
        ledgerService.complete(failed.getId(), BatchStatus.FAILED, "STORE_WRITE_FAILURE: connection reset");

        HistorizationOutcome retry = historizationService.historizeEmployees(SnapshotSubmission.<Employee>builder()
            .asOf(D1).checksum("extract-1").row(employee("E1", "Diaz")).build());

        assertEquals(HistorizationOutcome.Status.SUCCESS, retry.getStatus());
        assertEquals(failed.getId(), retry.getBatchId());
        assertEquals(BatchStatus.SUCCESS, ledgerService.findById(failed.getId()).orElseThrow().getStatus());
        assertEquals(failed.getId(),
            historyStore.findCurrentVersion(EntityDefinitions.EMPLOYEE, "E1").orElseThrow().getBatchId());
        printSuccess("Run " + failed.getId() + " completed on retry");
    }
}

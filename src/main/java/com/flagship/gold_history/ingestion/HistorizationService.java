package com.flagship.gold_history.ingestion;

import com.flagship.gold_history.batch.BatchLedgerService;
import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.batch.BatchStart;
import com.flagship.gold_history.batch.BatchStatus;
import com.flagship.gold_history.batch.LedgerConflictException;
import com.flagship.gold_history.entity.AdvanceRequest;
import com.flagship.gold_history.entity.Employee;
import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.entity.EntityDefinitions;
import com.flagship.gold_history.entity.Payment;
import com.flagship.gold_history.hashing.RecordHasher;
import com.flagship.gold_history.history.HistoryErrorCode;
import com.flagship.gold_history.history.HistoryException;
import com.flagship.gold_history.history.MergeResult;
import com.flagship.gold_history.history.RequestSettlementEnricher;
import com.flagship.gold_history.history.Scd2Merger;
import com.flagship.gold_history.observability.CorrelationContext;
import com.flagship.gold_history.observability.HistoryMetrics;
import com.flagship.gold_history.outbox.BatchCompletedEvent;
import com.flagship.gold_history.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the pipeline: one call per submitted snapshot.
 *
 * Each call goes through the ledger gate, then runs in one transaction:
 * <ol>
 *   <li>merge the snapshot (payments: merge payment history, then enrich requests)</li>
 *   <li>complete the batch as SUCCESS</li>
 *   <li>write the BatchSucceeded outbox event</li>
 * </ol>
 * If anything fails the transaction rolls back, so no history row of the
 * batch survives, and a second transaction records the batch as FAILED
 * with a BatchFailed event. Nothing is retried here; the outcome says
 * whether a retry can help.
 */
@Service
@Slf4j
public class HistorizationService {

    private final BatchLedgerService ledgerService;
    private final Scd2Merger merger;
    private final RequestSettlementEnricher enricher;
    private final RecordHasher recordHasher;
    private final OutboxService outboxService;
    private final HistoryMetrics metrics;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    public HistorizationService(BatchLedgerService ledgerService,
                                Scd2Merger merger,
                                RequestSettlementEnricher enricher,
                                RecordHasher recordHasher,
                                OutboxService outboxService,
                                HistoryMetrics metrics,
                                TransactionOperations historyTransactionTemplate,
                                Clock clock) {
        this.ledgerService = ledgerService;
        this.merger = merger;
        this.enricher = enricher;
        this.recordHasher = recordHasher;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionOperations = historyTransactionTemplate;
        this.clock = clock;
    }

    public HistorizationOutcome historizeEmployees(SnapshotSubmission<Employee> submission) {
        return historize(EntityDefinitions.EMPLOYEE, submission,
            batch -> List.of(merger.apply(EntityDefinitions.EMPLOYEE, submission.getAsOf(), submission.getRows(), batch)));
    }

    public HistorizationOutcome historizeRequests(SnapshotSubmission<AdvanceRequest> submission) {
        return historize(EntityDefinitions.ADVANCE_REQUEST, submission,
            batch -> List.of(merger.apply(EntityDefinitions.ADVANCE_REQUEST, submission.getAsOf(), submission.getRows(), batch)));
    }

    /**
     * Historizes payments and settles the requests they reference, both
     * under the payment batch.
     */
    public HistorizationOutcome historizePayments(SnapshotSubmission<Payment> submission) {
        return historize(EntityDefinitions.PAYMENT, submission, batch -> {
            MergeResult payments = merger.apply(EntityDefinitions.PAYMENT, submission.getAsOf(), submission.getRows(), batch);
            MergeResult settlements = enricher.enrich(submission.getAsOf(), submission.getRows(), batch);
            return List.of(payments, settlements);
        });
    }

    private <T> HistorizationOutcome historize(EntityDefinition<T> definition,
                                               SnapshotSubmission<T> submission,
                                               Function<BatchRun, List<MergeResult>> work) {
        String dataset = definition.getDataset();
        if (submission == null || submission.getAsOf() == null || submission.getRows() == null) {
            throw new IllegalArgumentException("A snapshot needs an as-of date and rows");
        }

        String checksum = submission.getChecksum() != null && !submission.getChecksum().isBlank()
            ? submission.getChecksum()
            : recordHasher.snapshotChecksum(definition, submission.getRows());

        HistorizationOutcome.HistorizationOutcomeBuilder outcome = HistorizationOutcome.builder()
            .dataset(dataset)
            .asOf(submission.getAsOf());

        BatchStart start;
        try {
            start = ledgerService.begin(dataset, submission.getAsOf(), submission.getSourceName(), checksum);
        } catch (LedgerConflictException e) {
            metrics.recordBatch(dataset, "conflict");
            return outcome.status(HistorizationOutcome.Status.CONFLICT)
                .errorCode(e.getCode())
                .retryable(true)
                .message(e.getMessage())
                .build();
        }

        BatchRun batch = start.getBatch();
        if (start.isSkipped()) {
            metrics.recordBatch(dataset, "skipped");
            return outcome.status(HistorizationOutcome.Status.SKIPPED)
                .batchId(batch.getId())
                .errorCode(HistoryErrorCode.DUPLICATE_BATCH)
                .message("Extract already processed by batch " + batch.getId())
                .build();
        }

        CorrelationContext.enterBatch(dataset, batch.getId());
        try {
            List<MergeResult> results = metrics.timeMerge(dataset, () ->
                transactionOperations.execute(status -> {
                    List<MergeResult> merged = work.apply(batch);
                    BatchRun completed = ledgerService.complete(batch.getId(), BatchStatus.SUCCESS, summarize(merged));
                    outboxService.saveBatchEvent(BatchCompletedEvent.succeeded(completed, merged, Instant.now(clock)));
                    return merged;
                }));

            results.forEach(metrics::recordMerge);
            metrics.recordBatch(dataset, "success");
            log.info("Batch {} committed: {}", batch.getId(), summarize(results));
            return outcome.status(HistorizationOutcome.Status.SUCCESS)
                .batchId(batch.getId())
                .results(results)
                .build();

        } catch (RuntimeException e) {
            HistoryErrorCode code = errorCodeOf(e);
            log.error("Batch {} failed with {}: {}", batch.getId(), code, e.getMessage(), e);
            recordFailure(batch, code, e);
            metrics.recordBatch(dataset, "failed");
            return outcome.status(HistorizationOutcome.Status.FAILED)
                .batchId(batch.getId())
                .errorCode(code)
                .retryable(code != null && code.isRetryable())
                .message(e.getMessage())
                .build();
        } finally {
            CorrelationContext.exitBatch();
        }
    }

    /**
     * Records the failure in its own transaction, the batch's one has
     * rolled back. If even that fails the run stays STARTED and shows up
     * in the ledger health check.
     */
    private void recordFailure(BatchRun batch, HistoryErrorCode code, RuntimeException cause) {
        String message = (code == null ? "UNEXPECTED" : code.name()) + ": " + cause.getMessage();
        try {
            transactionOperations.executeWithoutResult(status -> {
                BatchRun failed = ledgerService.complete(batch.getId(), BatchStatus.FAILED, message);
                outboxService.saveBatchEvent(BatchCompletedEvent.failed(failed, code, Instant.now(clock)));
            });
        } catch (RuntimeException e) {
            log.error("Could not record batch {} as FAILED, it stays STARTED", batch.getId(), e);
        }
    }

    static HistoryErrorCode errorCodeOf(RuntimeException e) {
        if (e instanceof HistoryException historyException) {
            return historyException.getCode();
        }
        if (e instanceof DataAccessException || e instanceof TransactionException) {
            return HistoryErrorCode.STORE_WRITE_FAILURE;
        }
        return null;
    }

    static String summarize(List<MergeResult> results) {
        return results.stream()
            .map(MergeResult::toString)
            .collect(Collectors.joining("; "));
    }
}

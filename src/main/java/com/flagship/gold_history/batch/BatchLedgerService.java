package com.flagship.gold_history.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The batch ledger: one etl.batch_run row per ingestion attempt.
 *
 * The ledger is the idempotency gate of the pipeline. An extract is
 * identified by (dataset, as-of date, checksum):
 * <ul>
 *   <li>already SUCCESS (or SKIPPED): the caller gets a skip and must not touch history</li>
 *   <li>STARTED elsewhere: {@link LedgerConflictException}</li>
 *   <li>FAILED earlier: the same run is re-opened for a retry</li>
 *   <li>unknown: a new STARTED run is inserted</li>
 * </ul>
 *
 * {@link #complete} joins the caller's transaction, so completing a run as
 * SUCCESS commits together with the history writes it covers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchLedgerService {

    public static final String DEFAULT_SOURCE = "erp";

    private final BatchRunRepository repository;
    private final Clock clock;

    /**
     * Opens a run for an extract.
     *
     * @param dataset dataset label (employee, advance_request, payment)
     * @param asOf logical date of the extract
     * @param sourceName source label, defaults to {@value #DEFAULT_SOURCE}
     * @param checksum content checksum of the extract
     * @return a started run, or a skip pointing at the run that already processed the extract
     * @throws LedgerConflictException if the extract is being processed concurrently
     */
    @Transactional
    public BatchStart begin(String dataset, LocalDate asOf, String sourceName, String checksum) {
        requireText(dataset, "dataset");
        requireText(checksum, "checksum");
        if (asOf == null) {
            throw new IllegalArgumentException("As-of date cannot be null");
        }
        String source = sourceName == null || sourceName.isBlank() ? DEFAULT_SOURCE : sourceName;

        Optional<BatchRunEntity> existing =
            repository.findByDatasetAndAsOfDateAndSourceChecksum(dataset, asOf, checksum);

        if (existing.isPresent()) {
            BatchRunEntity run = existing.get();
            if (run.getStatus().isProcessed()) {
                log.info("Extract already processed by batch {}, skipping: dataset={}, asOf={}",
                        run.getId(), dataset, asOf);
                return BatchStart.skipped(run.toDomain());
            }
            if (run.getStatus() == BatchStatus.STARTED) {
                log.warn("Batch {} still running for dataset={}, asOf={}", run.getId(), dataset, asOf);
                throw new LedgerConflictException(dataset, asOf, checksum);
            }
            return reopen(run, dataset, asOf, checksum);
        }

        try {
            BatchRunEntity saved = repository.saveAndFlush(
                BatchRunEntity.started(dataset, asOf, source, checksum, Instant.now(clock)));
            log.info("Started batch {}: dataset={}, asOf={}, source={}", saved.getId(), dataset, asOf, source);
            return BatchStart.started(saved.toDomain());
        } catch (DataIntegrityViolationException e) {
            throw new LedgerConflictException(dataset, asOf, checksum, e);
        }
    }

    /**
     * Moves a running batch to a terminal status.
     *
     * @throws IllegalArgumentException if the batch does not exist
     * @throws IllegalStateException if the batch is not STARTED
     */
    @Transactional
    public BatchRun complete(long batchId, BatchStatus status, String message) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("A batch can only be completed with a terminal status, got " + status);
        }
        int updated = repository.complete(batchId, status, Instant.now(clock), message, BatchStatus.STARTED);
        BatchRunEntity run = repository.findById(batchId)
            .orElseThrow(() -> new IllegalArgumentException("Batch not found: " + batchId));
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Batch %d is %s and cannot be completed as %s", batchId, run.getStatus(), status));
        }
        log.info("Completed batch {} as {}: {}", batchId, status, message);
        return run.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<BatchRun> findById(long batchId) {
        return repository.findById(batchId).map(BatchRunEntity::toDomain);
    }

    /**
     * Runs of a dataset, newest first; restricted to one as-of date when given.
     */
    @Transactional(readOnly = true)
    public List<BatchRun> findRuns(String dataset, LocalDate asOf) {
        List<BatchRunEntity> runs = asOf == null
            ? repository.findTop50ByDatasetOrderByIdDesc(dataset)
            : repository.findByDatasetAndAsOfDateOrderByIdDesc(dataset, asOf);
        return runs.stream().map(BatchRunEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public Optional<BatchRun> findLatestSuccessful(String dataset, LocalDate asOf) {
        return repository.findFirstByDatasetAndAsOfDateAndStatusOrderByIdDesc(dataset, asOf, BatchStatus.SUCCESS)
            .map(BatchRunEntity::toDomain);
    }

    /**
     * Number of STARTED runs whose current attempt began longer ago than the
     * given age: crashed or stuck runs. A retry counts from its re-opening.
     */
    @Transactional(readOnly = true)
    public long countStaleStarted(Duration olderThan) {
        return repository.countAttemptsStartedBefore(BatchStatus.STARTED, Instant.now(clock).minus(olderThan));
    }

    private BatchStart reopen(BatchRunEntity failed, String dataset, LocalDate asOf, String checksum) {
        int updated = repository.reopen(failed.getId(), BatchStatus.STARTED, Instant.now(clock), BatchStatus.FAILED);
        if (updated == 0) {
            throw new LedgerConflictException(dataset, asOf, checksum);
        }
        BatchRun reopened = repository.findById(failed.getId())
            .map(BatchRunEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException("Batch vanished while re-opening: " + failed.getId()));
        log.info("Re-opened failed batch {} for retry: dataset={}, asOf={}", reopened.getId(), dataset, asOf);
        return BatchStart.started(reopened);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}

package com.flagship.gold_history.batch;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for etl.batch_run.
 *
 * No setters: a row is created STARTED through {@link #started} and only
 * its status, finished_at, reopened_at and message change afterwards,
 * through the conditional updates of {@link BatchRunRepository}.
 */
@Entity
@Table(
    name = "batch_run",
    schema = "etl",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_batch_run_extract",
        columnNames = {"dataset", "as_of_date", "source_checksum"}),
    indexes = @Index(name = "ix_batch_run_dataset_date", columnList = "dataset, as_of_date")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BatchRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "batch_id", nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String dataset;

    @Column(name = "as_of_date", nullable = false, updatable = false)
    private LocalDate asOfDate;

    @Column(name = "source_name", nullable = false, updatable = false)
    private String sourceName;

    @Column(name = "source_checksum", nullable = false, updatable = false)
    private String sourceChecksum;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    /** Start of the latest retry of a FAILED run, null if never retried. */
    @Column(name = "reopened_at")
    private Instant reopenedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status;

    @Column(columnDefinition = "TEXT")
    private String message;

    public static BatchRunEntity started(String dataset, LocalDate asOfDate, String sourceName,
                                         String sourceChecksum, Instant startedAt) {
        BatchRunEntity entity = new BatchRunEntity();
        entity.dataset = dataset;
        entity.asOfDate = asOfDate;
        entity.sourceName = sourceName;
        entity.sourceChecksum = sourceChecksum;
        entity.startedAt = startedAt;
        entity.status = BatchStatus.STARTED;
        return entity;
    }

    public BatchRun toDomain() {
        return new BatchRun(id, dataset, asOfDate, sourceName, sourceChecksum,
            startedAt, finishedAt, status, message);
    }
}

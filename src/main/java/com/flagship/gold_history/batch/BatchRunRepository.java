package com.flagship.gold_history.batch;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the batch ledger.
 */
@Repository
public interface BatchRunRepository extends JpaRepository<BatchRunEntity, Long> {

    /**
     * The run of an exact extract, if any. At most one exists
     * (unique on dataset, as_of_date, source_checksum).
     */
    Optional<BatchRunEntity> findByDatasetAndAsOfDateAndSourceChecksum(
        String dataset, LocalDate asOfDate, String sourceChecksum);

    List<BatchRunEntity> findByDatasetAndAsOfDateOrderByIdDesc(String dataset, LocalDate asOfDate);

    List<BatchRunEntity> findTop50ByDatasetOrderByIdDesc(String dataset);

    Optional<BatchRunEntity> findFirstByDatasetAndAsOfDateAndStatusOrderByIdDesc(
        String dataset, LocalDate asOfDate, BatchStatus status);

    /**
     * Runs in the given status whose current attempt began before the
     * given instant. A re-opened run counts from its re-opening.
     */
    @Query("""
        SELECT COUNT(b) FROM BatchRunEntity b
        WHERE b.status = :status AND COALESCE(b.reopenedAt, b.startedAt) < :before
        """)
    long countAttemptsStartedBefore(@Param("status") BatchStatus status, @Param("before") Instant before);

    /**
     * Moves a run from STARTED to a terminal status. The message of an
     * earlier failed attempt is kept in front of the new one.
     *
     * @return 1 if the run was STARTED, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE BatchRunEntity b
        SET b.status = :status, b.finishedAt = :finishedAt,
            b.message = CASE WHEN b.message IS NULL THEN :message ELSE CONCAT(b.message, ' | ', :message) END
        WHERE b.id = :id AND b.status = :expected
        """)
    int complete(@Param("id") Long id,
                 @Param("status") BatchStatus status,
                 @Param("finishedAt") Instant finishedAt,
                 @Param("message") String message,
                 @Param("expected") BatchStatus expected);

    /**
     * Re-opens a FAILED run so the same extract can be retried. started_at
     * stays the first attempt's; the failure message is kept for audit.
     *
     * @return 1 if the run was FAILED, 0 if someone else re-opened it first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE BatchRunEntity b
        SET b.status = :started, b.reopenedAt = :reopenedAt, b.finishedAt = null,
            b.message = CONCAT('Previous attempt: ', COALESCE(b.message, 'FAILED'))
        WHERE b.id = :id AND b.status = :failed
        """)
    int reopen(@Param("id") Long id,
               @Param("started") BatchStatus started,
               @Param("reopenedAt") Instant reopenedAt,
               @Param("failed") BatchStatus failed);
}

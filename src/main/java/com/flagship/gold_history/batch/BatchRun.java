package com.flagship.gold_history.batch;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One ingestion attempt of a dataset for an as-of date.
 *
 * Every history version written by the attempt carries its id, which is
 * how a Gold row is traced back to the extract that produced it.
 */
@Value
public class BatchRun {
    Long id;
    String dataset;
    LocalDate asOfDate;
    String sourceName;
    String sourceChecksum;
    Instant startedAt;
    Instant finishedAt;
    BatchStatus status;
    String message;

    public boolean isRunning() {
        return status == BatchStatus.STARTED;
    }
}

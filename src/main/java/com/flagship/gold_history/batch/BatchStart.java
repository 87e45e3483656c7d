package com.flagship.gold_history.batch;

import lombok.Value;

/**
 * Result of opening a batch: either a running batch, or the earlier run
 * that already processed the same extract.
 */
@Value
public class BatchStart {
    BatchRun batch;
    boolean skipped;

    public static BatchStart started(BatchRun batch) {
        return new BatchStart(batch, false);
    }

    public static BatchStart skipped(BatchRun processedBy) {
        return new BatchStart(processedBy, true);
    }
}

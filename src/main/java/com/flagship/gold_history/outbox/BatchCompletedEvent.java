package com.flagship.gold_history.outbox;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.history.ChangeKind;
import com.flagship.gold_history.history.HistoryErrorCode;
import com.flagship.gold_history.history.MergeResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of the BatchSucceeded and BatchFailed events.
 *
 * Downstream consumers (reporting refreshes, the Silver layer) use it to
 * learn that a dataset moved to a new as-of date without polling the ledger.
 */
@Value
@Builder
public class BatchCompletedEvent {

    public static final String AGGREGATE_TYPE = "BatchRun";
    public static final String SUCCEEDED = "BatchSucceeded";
    public static final String FAILED = "BatchFailed";

    @JsonProperty("batch_id")
    Long batchId;

    @JsonProperty("dataset")
    String dataset;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("status")
    String status;

    @JsonProperty("changes")
    Map<ChangeKind, Integer> changes;

    @JsonProperty("anomalies")
    int anomalies;

    @JsonProperty("error_code")
    HistoryErrorCode errorCode;

    @JsonProperty("message")
    String message;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    public static BatchCompletedEvent succeeded(BatchRun batch, List<MergeResult> results, Instant at) {
        Map<ChangeKind, Integer> changes = new EnumMap<>(ChangeKind.class);
        int anomalies = 0;
        for (MergeResult result : results) {
            result.getChanges().forEach((kind, count) -> changes.merge(kind, count, Integer::sum));
            anomalies += result.getDiagnostics().size();
        }
        return BatchCompletedEvent.builder()
            .batchId(batch.getId())
            .dataset(batch.getDataset())
            .asOf(batch.getAsOfDate())
            .status(batch.getStatus().name())
            .changes(changes)
            .anomalies(anomalies)
            .message(batch.getMessage())
            .occurredAt(at)
            .build();
    }

    public static BatchCompletedEvent failed(BatchRun batch, HistoryErrorCode code, Instant at) {
        return BatchCompletedEvent.builder()
            .batchId(batch.getId())
            .dataset(batch.getDataset())
            .asOf(batch.getAsOfDate())
            .status(batch.getStatus().name())
            .changes(Map.of())
            .errorCode(code)
            .message(batch.getMessage())
            .occurredAt(at)
            .build();
    }

    public String eventType() {
        return "FAILED".equals(status) ? FAILED : SUCCEEDED;
    }
}

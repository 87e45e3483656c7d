package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.batch.BatchRun;
import com.flagship.gold_history.batch.BatchStatus;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
public class BatchRunResponse {

    @JsonProperty("batch_id")
    Long batchId;

    @JsonProperty("dataset")
    String dataset;

    @JsonProperty("as_of_date")
    LocalDate asOfDate;

    @JsonProperty("source_name")
    String sourceName;

    @JsonProperty("source_checksum")
    String sourceChecksum;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    @JsonProperty("status")
    BatchStatus status;

    @JsonProperty("message")
    String message;

    public static BatchRunResponse from(BatchRun run) {
        return new BatchRunResponse(run.getId(), run.getDataset(), run.getAsOfDate(), run.getSourceName(),
            run.getSourceChecksum(), run.getStartedAt(), run.getFinishedAt(), run.getStatus(), run.getMessage());
    }
}

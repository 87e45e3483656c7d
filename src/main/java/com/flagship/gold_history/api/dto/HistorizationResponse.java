package com.flagship.gold_history.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_history.history.ChangeKind;
import com.flagship.gold_history.history.HistoryErrorCode;
import com.flagship.gold_history.history.MergeResult;
import com.flagship.gold_history.history.RowDiagnostic;
import com.flagship.gold_history.ingestion.HistorizationOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class HistorizationResponse {

    @JsonProperty("status")
    HistorizationOutcome.Status status;

    @JsonProperty("dataset")
    String dataset;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("batch_id")
    Long batchId;

    @JsonProperty("error_code")
    HistoryErrorCode errorCode;

    @JsonProperty("retryable")
    boolean retryable;

    @JsonProperty("message")
    String message;

    @JsonProperty("changes")
    Map<ChangeKind, Integer> changes;

    @JsonProperty("rows_written")
    int rowsWritten;

    @JsonProperty("rows_closed")
    int rowsClosed;

    @JsonProperty("diagnostics")
    List<Diagnostic> diagnostics;

    @Value
    public static class Diagnostic {
        @JsonProperty("ref")
        String ref;
        @JsonProperty("code")
        HistoryErrorCode code;
        @JsonProperty("message")
        String message;
    }

    public static HistorizationResponse from(HistorizationOutcome outcome) {
        Map<ChangeKind, Integer> changes = new EnumMap<>(ChangeKind.class);
        int written = 0;
        int closed = 0;
        for (MergeResult result : outcome.getResults()) {
            result.getChanges().forEach((kind, count) -> changes.merge(kind, count, Integer::sum));
            written += result.getRowsWritten();
            closed += result.getRowsClosed();
        }
        List<Diagnostic> diagnostics = outcome.getDiagnostics().stream()
            .map(HistorizationResponse::toDiagnostic)
            .toList();

        return HistorizationResponse.builder()
            .status(outcome.getStatus())
            .dataset(outcome.getDataset())
            .asOf(outcome.getAsOf())
            .batchId(outcome.getBatchId())
            .errorCode(outcome.getErrorCode())
            .retryable(outcome.isRetryable())
            .message(outcome.getMessage())
            .changes(changes)
            .rowsWritten(written)
            .rowsClosed(closed)
            .diagnostics(diagnostics)
            .build();
    }

    private static Diagnostic toDiagnostic(RowDiagnostic diagnostic) {
        return new Diagnostic(diagnostic.getNaturalKey(), diagnostic.getCode(), diagnostic.getMessage());
    }
}

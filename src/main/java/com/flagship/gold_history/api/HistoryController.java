package com.flagship.gold_history.api;

import com.flagship.gold_history.api.dto.AdvanceRequestRow;
import com.flagship.gold_history.api.dto.EmployeeRow;
import com.flagship.gold_history.api.dto.HistorizationResponse;
import com.flagship.gold_history.api.dto.HistoryRecordResponse;
import com.flagship.gold_history.api.dto.PaymentRow;
import com.flagship.gold_history.api.dto.SnapshotRequest;
import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.entity.EntityDefinitions;
import com.flagship.gold_history.history.HistoryQueryService;
import com.flagship.gold_history.ingestion.HistorizationOutcome;
import com.flagship.gold_history.ingestion.HistorizationService;
import com.flagship.gold_history.ingestion.SnapshotSubmission;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Snapshot submission and history lookups.
 *
 * A submission answers 200 when the batch committed or was already
 * processed, 409 when the same extract is running elsewhere, 503 when the
 * batch failed but a retry can succeed, and 422 when it cannot.
 */
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@Slf4j
public class HistoryController {

    private final HistorizationService historizationService;
    private final HistoryQueryService historyQueryService;

    @PostMapping("/employees")
    public ResponseEntity<HistorizationResponse> submitEmployees(
            @Valid @RequestBody SnapshotRequest<EmployeeRow> request) {
        log.info("Received employee snapshot: asOf={}, rows={}", request.getAsOf(), request.getRows().size());
        return respond(historizationService.historizeEmployees(toSubmission(request, EmployeeRow::toEntity)));
    }

    @PostMapping("/requests")
    public ResponseEntity<HistorizationResponse> submitRequests(
            @Valid @RequestBody SnapshotRequest<AdvanceRequestRow> request) {
        log.info("Received request snapshot: asOf={}, rows={}", request.getAsOf(), request.getRows().size());
        return respond(historizationService.historizeRequests(toSubmission(request, AdvanceRequestRow::toEntity)));
    }

    @PostMapping("/payments")
    public ResponseEntity<HistorizationResponse> submitPayments(
            @Valid @RequestBody SnapshotRequest<PaymentRow> request) {
        log.info("Received payment snapshot: asOf={}, rows={}", request.getAsOf(), request.getRows().size());
        return respond(historizationService.historizePayments(toSubmission(request, PaymentRow::toEntity)));
    }

    /**
     * Version chain of a key, oldest first.
     */
    @GetMapping("/{dataset}/{ref}")
    public ResponseEntity<List<HistoryRecordResponse>> getHistory(@PathVariable("dataset") String dataset,
                                                                  @PathVariable("ref") String ref) {
        EntityDefinition<?> definition = definition(dataset);
        List<HistoryRecordResponse> versions = historyQueryService.history(dataset, ref).stream()
            .map(record -> HistoryRecordResponse.from(definition, record))
            .toList();
        if (versions.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(versions);
    }

    /**
     * The version valid at a date.
     */
    @GetMapping(value = "/{dataset}/{ref}", params = "at")
    public ResponseEntity<HistoryRecordResponse> getVersionAt(
            @PathVariable("dataset") String dataset,
            @PathVariable("ref") String ref,
            @RequestParam("at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate at) {
        EntityDefinition<?> definition = definition(dataset);
        return historyQueryService.versionAt(dataset, ref, at)
            .map(record -> ResponseEntity.ok(HistoryRecordResponse.from(definition, record)))
            .orElse(ResponseEntity.notFound().build());
    }

    static ResponseEntity<HistorizationResponse> respond(HistorizationOutcome outcome) {
        HttpStatus status = switch (outcome.getStatus()) {
            case SUCCESS, SKIPPED -> HttpStatus.OK;
            case CONFLICT -> HttpStatus.CONFLICT;
            case FAILED -> outcome.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return ResponseEntity.status(status).body(HistorizationResponse.from(outcome));
    }

    private static <R, T> SnapshotSubmission<T> toSubmission(SnapshotRequest<R> request, Function<R, T> mapper) {
        return SnapshotSubmission.<T>builder()
            .asOf(request.getAsOf())
            .sourceName(request.getSourceName())
            .checksum(request.getChecksum())
            .rows(request.getRows().stream().map(mapper).toList())
            .build();
    }

    private static EntityDefinition<?> definition(String dataset) {
        return EntityDefinitions.byDataset(dataset)
            .orElseThrow(() -> new IllegalArgumentException("Unknown dataset: " + dataset));
    }
}

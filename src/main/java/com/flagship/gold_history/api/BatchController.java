package com.flagship.gold_history.api;

import com.flagship.gold_history.api.dto.BatchRunResponse;
import com.flagship.gold_history.batch.BatchLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to the batch ledger.
 */
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class BatchController {

    private final BatchLedgerService ledgerService;

    @GetMapping("/{id}")
    public ResponseEntity<BatchRunResponse> getBatch(@PathVariable("id") long id) {
        return ledgerService.findById(id)
            .map(run -> ResponseEntity.ok(BatchRunResponse.from(run)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Runs of a dataset, newest first.
     */
    @GetMapping
    public List<BatchRunResponse> listBatches(
            @RequestParam("dataset") String dataset,
            @RequestParam(value = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return ledgerService.findRuns(dataset, asOf).stream()
            .map(BatchRunResponse::from)
            .toList();
    }
}

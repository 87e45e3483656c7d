package com.flagship.gold_history.observability;

import com.flagship.gold_history.history.ChangeKind;
import com.flagship.gold_history.history.MergeResult;
import com.flagship.gold_history.history.RowDiagnostic;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Metrics of the historization pipeline.
 *
 * - history.batches: batches by dataset and outcome
 * - history.versions: version changes by dataset and kind
 * - history.anomalies: row diagnostics by dataset and code
 * - history.merge.duration: time spent in one batch transaction
 */
@Component
public class HistoryMetrics {

    private final MeterRegistry registry;

    public HistoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatch(String dataset, String outcome) {
        registry.counter("history.batches",
                "dataset", sanitizeTag(dataset),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordMerge(MergeResult result) {
        for (Map.Entry<ChangeKind, Integer> change : result.getChanges().entrySet()) {
            if (change.getKey() == ChangeKind.UNCHANGED) {
                continue;
            }
            registry.counter("history.versions",
                    "dataset", sanitizeTag(result.getDataset()),
                    "kind", change.getKey().name().toLowerCase(Locale.ROOT)
            ).increment(change.getValue());
        }
        for (RowDiagnostic diagnostic : result.getDiagnostics()) {
            registry.counter("history.anomalies",
                    "dataset", sanitizeTag(result.getDataset()),
                    "code", diagnostic.getCode().name()
            ).increment();
        }
    }

    public <T> T timeMerge(String dataset, Supplier<T> operation) {
        return Timer.builder("history.merge.duration")
                .description("Time spent merging one batch")
                .tag("dataset", sanitizeTag(dataset))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(operation);
    }

    /**
     * Keeps tag values to a small alphabet to avoid cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.flagship.gold_history.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used while a batch runs.
 *
 * The correlation id comes from the HTTP request (or is generated); batchId
 * and dataset are set for the duration of one historization so every log
 * line of a batch can be found by its ledger id.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String BATCH_ID_MDC_KEY = "batchId";
    public static final String DATASET_MDC_KEY = "dataset";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short ids read better in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void enterBatch(String dataset, Long batchId) {
        MDC.put(DATASET_MDC_KEY, dataset);
        if (batchId != null) {
            MDC.put(BATCH_ID_MDC_KEY, String.valueOf(batchId));
        }
    }

    public static void exitBatch() {
        MDC.remove(DATASET_MDC_KEY);
        MDC.remove(BATCH_ID_MDC_KEY);
    }
}

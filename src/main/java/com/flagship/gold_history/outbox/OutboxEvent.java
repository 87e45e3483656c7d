package com.flagship.gold_history.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A batch notification waiting in the outbox.
 *
 * Written in the same transaction as the ledger completion it announces,
 * published to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "BatchRun"
    String aggregateId;        // batch id
    String eventType;          // "BatchSucceeded" or "BatchFailed"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

package com.flagship.gold_history.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes batch events to the outbox and tracks their publication.
 *
 * {@link #saveBatchEvent} joins the transaction that completes the batch:
 * if the ledger row commits, the event is guaranteed to be written, and a
 * rolled-back batch never announces itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Saves a batch event within the current transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException if no transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveBatchEvent(BatchCompletedEvent payload) {
        OutboxEvent event = OutboxEvent.create(
            BatchCompletedEvent.AGGREGATE_TYPE,
            String.valueOf(payload.getBatchId()),
            payload.eventType(),
            serializePayload(payload),
            Instant.now(clock));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, batchId={}", event.getEventType(), payload.getBatchId());
        return saved.toDomain();
    }

    /**
     * Unpublished events for the publisher, locked with SKIP LOCKED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.findUnpublishedEventsForUpdate(limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(Instant.now(clock));
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events announced for one batch, oldest first.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForBatch(long batchId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                BatchCompletedEvent.AGGREGATE_TYPE, String.valueOf(batchId))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}

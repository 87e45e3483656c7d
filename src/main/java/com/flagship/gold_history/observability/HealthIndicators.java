package com.flagship.gold_history.observability;

import com.flagship.gold_history.batch.BatchLedgerService;
import com.flagship.gold_history.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Actuator health indicators of the history service.
 */
public class HealthIndicators {

    /**
     * Unhealthy when batch events pile up in the outbox.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 100;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 1000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Reports batches stuck in STARTED: a crashed run blocks retries of its
     * extract until an operator marks it FAILED.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final BatchLedgerService ledgerService;
        private final Duration staleAfter;

        public LedgerHealthIndicator(BatchLedgerService ledgerService,
                                     @Value("${history.ledger.stale-after-minutes:120}") long staleAfterMinutes) {
            this.ledgerService = ledgerService;
            this.staleAfter = Duration.ofMinutes(staleAfterMinutes);
        }

        @Override
        public Health health() {
            try {
                long stale = ledgerService.countStaleStarted(staleAfter);
                Health.Builder builder = stale == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("staleStartedBatches", stale)
                        .withDetail("staleAfterMinutes", staleAfter.toMinutes())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    // batch events wait in the outbox, history writes are unaffected
                    return Health.status("DEGRADED")
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}

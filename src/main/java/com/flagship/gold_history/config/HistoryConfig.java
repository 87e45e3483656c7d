package com.flagship.gold_history.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Beans shared by the historization pipeline.
 */
@Configuration
public class HistoryConfig {

    /**
     * Clock used for started_at, finished_at and ingested_at. Tests swap it
     * for a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Transaction wrapping one batch: merge, ledger completion and outbox
     * event. The timeout bounds how long a batch can hold row locks.
     */
    @Bean
    public TransactionTemplate historyTransactionTemplate(
            PlatformTransactionManager transactionManager,
            @Value("${history.transaction.timeout-seconds:60}") int timeoutSeconds) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(timeoutSeconds);
        return template;
    }
}

package com.flagship.gold_history.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic carrying batch completion events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.batch-events:gold-batch-events}")
    private String batchEventsTopic;

    /**
     * One partition per dataset is plenty: events are keyed by batch id and
     * volumes are a handful of batches per day.
     */
    @Bean
    public NewTopic batchEventsTopic() {
        return TopicBuilder.name(batchEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

package com.flagship.bounty_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for task, submission and payment lifecycle events.
 *
 * Only declared when the outbox publisher runs; otherwise the broker is never contacted.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.bounty-events:bounty-events}")
    private String bountyEventsTopic;

    /**
     * Three partitions; events are keyed by aggregate id so per-aggregate order holds.
     */
    @Bean
    public NewTopic bountyEventsTopic() {
        return TopicBuilder.name(bountyEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

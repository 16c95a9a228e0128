package com.flagship.treasury_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by the treasury ledger: outgoing treasury events and
 * incoming external deposit notifications.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.treasury-events:treasury-events}")
    private String treasuryEventsTopic;

    @Value("${kafka.topic.deposits:treasury-deposits}")
    private String depositsTopic;

    @Bean
    public NewTopic treasuryEventsTopic() {
        return TopicBuilder.name(treasuryEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Deposits are keyed by account name, so per-account ordering holds
     * within a partition.
     */
    @Bean
    public NewTopic depositsTopic() {
        return TopicBuilder.name(depositsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

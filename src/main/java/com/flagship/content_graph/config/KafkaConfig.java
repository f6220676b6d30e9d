package com.flagship.content_graph.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.CommonErrorHandler;

/**
 * Kafka configuration for the ledger event topic.
 *
 * Configures:
 * - the ledger topic, with a single partition: events must be applied in
 *   the exact order the ledger emitted them
 * - the listener error handler
 */
@Configuration
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:content-directory-events}")
    private String ledgerEventsTopic;

    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }

    /**
     * Stops the listener container on the first exception thrown by the
     * listener, without redelivery and without committing the offset.
     * The listener only throws for fatal ingestion errors and store failures;
     * no later event may be applied past the failed one.
     *
     * Picked up by Spring Boot's default listener container factory.
     */
    @Bean
    public CommonErrorHandler ledgerListenerErrorHandler() {
        return new CommonContainerStoppingErrorHandler();
    }
}

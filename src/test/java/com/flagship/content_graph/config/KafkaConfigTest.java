package com.flagship.content_graph.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the listener container wiring of the ledger consumer.
 */
class KafkaConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KafkaAutoConfiguration.class))
            .withUserConfiguration(KafkaConfig.class)
            .withPropertyValues(
                    "spring.kafka.bootstrap-servers=localhost:9999",
                    "spring.kafka.admin.auto-create=false");

    @Test
    @DisplayName("Listener containers stop on the first failed record instead of retrying and skipping it")
    @SuppressWarnings({"rawtypes", "unchecked"})
    void testListenerContainer_StopsOnFailure() {
        contextRunner.run(context -> {
            assertInstanceOf(CommonContainerStoppingErrorHandler.class, context.getBean(CommonErrorHandler.class));

            ConcurrentKafkaListenerContainerFactory<?, ?> factory =
                    context.getBean("kafkaListenerContainerFactory", ConcurrentKafkaListenerContainerFactory.class);
            ConcurrentMessageListenerContainer<?, ?> container = factory.createContainer("content-directory-events");

            assertInstanceOf(CommonContainerStoppingErrorHandler.class, container.getCommonErrorHandler());
        });
    }

    @Test
    @DisplayName("No listener wiring when the consumer is disabled")
    void testConsumerDisabled_NoErrorHandler() {
        contextRunner.withPropertyValues("consumer.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(CommonErrorHandler.class).isEmpty()));
    }
}

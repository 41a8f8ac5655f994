package com.flagship.learning_platform.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the learning-events topic. Producer and consumer factories come
 * from Spring Boot auto-configuration (see spring.kafka.* in application.yml).
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.learning-events:learning-events}")
    private String learningEventsTopic;

    /**
     * Keyed by aggregate id, so all events of one enrollment, certificate or
     * registration land on the same partition in order.
     */
    @Bean
    public NewTopic learningEventsTopic() {
        return TopicBuilder.name(learningEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

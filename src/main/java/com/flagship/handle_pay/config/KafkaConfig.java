package com.flagship.handle_pay.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for protocol events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.events:handle-pay-events}")
    private String eventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Created if missing. Events are keyed by identity hash, so partitions
     * preserve per-identity order.
     */
    @Bean
    public NewTopic eventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}

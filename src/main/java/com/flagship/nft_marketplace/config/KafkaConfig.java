package com.flagship.nft_marketplace.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the market events topic.
 *
 * Events are keyed by token id, so three partitions still keep each token's
 * purchases and relistings in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.market-events:market-events}")
    private String marketEventsTopic;

    @Bean
    public NewTopic marketEventsTopic() {
        return TopicBuilder.name(marketEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

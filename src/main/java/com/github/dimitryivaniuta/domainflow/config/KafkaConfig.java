package com.github.dimitryivaniuta.domainflow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Campaign events topic, keyed by campaign id. Provisioned externally in real deployments; this
     * bean covers local runs.
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic campaignEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getCampaignEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}

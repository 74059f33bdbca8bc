package com.koni.thermoguard.infrastructure.messaging;

import com.koni.thermoguard.infrastructure.config.ThermoGuardProperties;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics exchanged with the IR transmitters.
 *
 * Commands are keyed by transmitter device id, so each transmitter sees its commands in order.
 */
@Configuration
@RequiredArgsConstructor
public class KafkaTopicConfig {

    private final ThermoGuardProperties properties;

    @Value("${thermoguard.kafka.partitions:3}")
    private int partitions;

    @Value("${thermoguard.kafka.replication-factor:1}")
    private short replicationFactor;

    @Bean
    public NewTopic irCommandTopic() {
        return TopicBuilder.name(properties.getKafka().getIrCommandTopic())
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }

    @Bean
    public NewTopic irRecordedTopic() {
        return TopicBuilder.name(properties.getKafka().getIrRecordedTopic())
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }

    @Bean
    public NewTopic irRecordedDlqTopic() {
        return TopicBuilder.name(properties.getKafka().getIrRecordedDlqTopic())
                .partitions(1)
                .replicas(replicationFactor)
                .build();
    }
}

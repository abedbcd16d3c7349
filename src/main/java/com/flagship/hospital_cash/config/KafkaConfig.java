package com.flagship.hospital_cash.config;

import com.flagship.hospital_cash.topic.Topic;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.Arrays;

/**
 * Declares one Kafka topic per {@link Topic.Channel}.
 */
@Configuration
public class KafkaConfig {

    @Value("${topic.prefix:hospital.}")
    private String topicPrefix;

    @Value("${topic.partitions:3}")
    private int partitions;

    @Bean
    public KafkaAdmin.NewTopics channelTopics() {
        NewTopic[] topics = Arrays.stream(Topic.Channel.values())
                .map(channel -> TopicBuilder.name(channel.topicName(topicPrefix))
                        .partitions(partitions)
                        .replicas(1)
                        .build())
                .toArray(NewTopic[]::new);

        return new KafkaAdmin.NewTopics(topics);
    }
}

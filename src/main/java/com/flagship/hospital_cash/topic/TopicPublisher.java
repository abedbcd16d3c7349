package com.flagship.hospital_cash.topic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes {@link TopicEvent}s to the Kafka topic behind a channel.
 *
 * Sends are asynchronous. The record key is the entity uuid so every event
 * about one record lands on the same partition. A failed delivery is logged;
 * by then the change it announces is already committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${topic.prefix:hospital.}")
    private String topicPrefix;

    /**
     * Sends the event without waiting for the broker. Never throws: the change
     * it announces is already committed, so failures are logged and dropped.
     */
    public void publish(Topic.Channel channel, TopicEvent event) {
        String topic = channel.topicName(topicPrefix);
        String key = event.getUuid().toString();

        try {
            kafkaTemplate.send(topic, key, serialize(event))
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            logFailure(topic, event, key, ex);
                        } else {
                            log.debug("Published event: topic={}, partition={}, offset={}, event={}, uuid={}",
                                    topic,
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset(),
                                    event.getEvent(),
                                    key);
                        }
                    });
        } catch (RuntimeException e) {
            logFailure(topic, event, key, e);
        }
    }

    private void logFailure(String topic, TopicEvent event, String key, Throwable ex) {
        log.error("Failed to publish event: topic={}, event={}, entity={}, uuid={}, error={}",
                topic, event.getEvent(), event.getEntity(), key, ex.getMessage());
    }

    private String serialize(TopicEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize topic event", e);
        }
    }
}

package com.flagship.hospital_cash.topic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka listener on the finance channel.
 *
 * Offsets are acknowledged manually after the handler returns. Unreadable
 * payloads are acknowledged and skipped; handler failures are rethrown so
 * the record is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FinanceEventConsumer {

    private final FinanceEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${topic.prefix:hospital.}finance",
        groupId = "${spring.kafka.consumer.group-id:hospital-finance-reporting}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        TopicEvent event;
        try {
            event = objectMapper.readValue(record.value(), TopicEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable finance event at offset {}: {}", record.offset(), e.getOriginalMessage());
            ack.acknowledge();
            return;
        }

        try {
            eventHandler.onEvent(event);
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error handling finance event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }
}

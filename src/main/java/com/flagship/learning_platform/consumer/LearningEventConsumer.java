package com.flagship.learning_platform.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.learning_platform.certificate.event.CertificateIssuedEvent;
import com.flagship.learning_platform.enrollment.event.EnrollmentCreatedEvent;
import com.flagship.learning_platform.event.EventRegisteredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes the learning-events topic and routes each event to
 * {@link LearningEventHandler}.
 *
 * Offsets are acknowledged manually after handling. Deduplication goes
 * through {@link IdempotentEventProcessor}, so a redelivered event never
 * sends a second message. Event types without a handler are recorded as
 * skipped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LearningEventConsumer {

    public static final String CONSUMER_GROUP = "learning-event-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final LearningEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.learning-events:learning-events}",
        groupId = "${spring.kafka.consumer.group-id:learning-platform-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        boolean processed = route(envelope, record.value());
        ack.acknowledge();

        if (processed) {
            log.info("Processed event: type={}, eventId={}, aggregateId={}",
                    envelope.eventType(), envelope.eventId(), envelope.aggregateId());
        }
    }

    boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case EnrollmentCreatedEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onEnrollmentCreated(deserialize(payload, EnrollmentCreatedEvent.class)));
            case EventRegisteredEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onEventRegistered(deserialize(payload, EventRegisteredEvent.class)));
            case CertificateIssuedEvent.EVENT_TYPE -> process(envelope, () ->
                eventHandler.onCertificateIssued(deserialize(payload, CertificateIssuedEvent.class)));
            default -> {
                log.debug("No handler for event type {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(
                    envelope.eventId(), envelope.eventType(),
                    envelope.aggregateType(), envelope.aggregateId(),
                    CONSUMER_GROUP, "No handler for event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, Runnable handler) {
        return eventProcessor.processEvent(
            envelope.eventId(), envelope.eventType(),
            envelope.aggregateType(), envelope.aggregateId(),
            CONSUMER_GROUP, handler);
    }

    EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                node.get("eventType").asText(),
                node.get("aggregateType").asText(),
                UUID.fromString(node.get("aggregateId").asText())
            );
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    record EventEnvelope(UUID eventId, String eventType, String aggregateType, UUID aggregateId) {}
}

package com.flagship.learning_platform.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has seen an event. One row per event id, so
 * a redelivered or replayed event is recognised and not handled again.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SUCCESS, null);
    }

    /**
     * An event this consumer has no handler for.
     */
    public static ProcessedEvent skipped(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}

package com.flagship.learning_platform.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event written to the outbox.
 *
 * The serialized payload always carries {@code eventId}, {@code eventType},
 * {@code aggregateType} and {@code aggregateId}, which is all a consumer needs
 * to route and deduplicate before reading the event-specific fields.
 */
public interface LearningEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    String getEventType();

    String getAggregateType();

    UUID getAggregateId();

    Instant getOccurredAt();
}

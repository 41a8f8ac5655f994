package com.flagship.learning_platform.event;

import com.flagship.learning_platform.outbox.LearningEvent;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Published when a seat is taken, by RSVP or by a completed event payment.
 * Drives the RSVP confirmation message.
 */
@Value
public class EventRegisteredEvent implements LearningEvent {
    UUID eventId;
    UUID registrationId;
    UUID userId;
    UUID liveEventId;
    String eventTitle;
    LocalDate eventDate;
    LocalTime eventTime;
    String location;
    String eventUrl;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EventRegistered";
    public static final String AGGREGATE_TYPE = "EventRegistration";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return registrationId;
    }

    public static EventRegisteredEvent of(EventRegistration registration, LiveEvent event) {
        return new EventRegisteredEvent(
            UUID.randomUUID(),
            registration.getId(),
            registration.getUserId(),
            event.getId(),
            event.getTitle(),
            event.getEventDate(),
            event.getEventTime(),
            event.getLocation(),
            event.getEventUrl(),
            Instant.now()
        );
    }
}

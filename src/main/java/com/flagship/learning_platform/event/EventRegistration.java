package com.flagship.learning_platform.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EventRegistration {
    UUID id;
    UUID userId;
    UUID eventId;
    RegistrationStatus status;
    Instant registeredAt;
}

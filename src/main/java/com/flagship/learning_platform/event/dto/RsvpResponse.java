package com.flagship.learning_platform.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.event.RegistrationResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RsvpResponse {

    @JsonProperty("message")
    String message;

    @JsonProperty("registration_id")
    UUID registrationId;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("status")
    String status;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static RsvpResponse from(RegistrationResult result) {
        return RsvpResponse.builder()
            .message("RSVP confirmed")
            .registrationId(result.getRegistration().getId())
            .eventId(result.getEvent().getId())
            .status(result.getRegistration().getStatus().name())
            .registeredAt(result.getRegistration().getRegisteredAt())
            .build();
    }
}

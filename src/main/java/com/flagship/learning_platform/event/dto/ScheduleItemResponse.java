package com.flagship.learning_platform.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.event.LiveEvent;
import com.flagship.learning_platform.event.ScheduledEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Value
@Builder
public class ScheduleItemResponse {

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("title")
    String title;

    @JsonProperty("event_date")
    LocalDate eventDate;

    @JsonProperty("event_time")
    LocalTime eventTime;

    @JsonProperty("duration")
    int duration;

    @JsonProperty("location")
    String location;

    @JsonProperty("event_url")
    String eventUrl;

    @JsonProperty("registration_id")
    UUID registrationId;

    @JsonProperty("registered_at")
    Instant registeredAt;

    public static ScheduleItemResponse from(ScheduledEvent scheduled) {
        LiveEvent event = scheduled.getEvent();
        return ScheduleItemResponse.builder()
            .eventId(event.getId())
            .title(event.getTitle())
            .eventDate(event.getEventDate())
            .eventTime(event.getEventTime())
            .duration(event.getDuration())
            .location(event.getLocation())
            .eventUrl(event.getEventUrl())
            .registrationId(scheduled.getRegistration().getId())
            .registeredAt(scheduled.getRegistration().getRegisteredAt())
            .build();
    }
}

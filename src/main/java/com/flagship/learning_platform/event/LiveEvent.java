package com.flagship.learning_platform.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * A scheduled session (workshop, webinar, meetup) users can RSVP to.
 * {@code registered} never exceeds {@code capacity}.
 */
@Value
public class LiveEvent {
    UUID id;
    String title;
    String description;
    LocalDate eventDate;
    LocalTime eventTime;
    int duration;
    String location;
    BigDecimal price;
    int capacity;
    int registered;
    String eventUrl;

    public boolean isFull() {
        return registered >= capacity;
    }

    public int getSeatsLeft() {
        return Math.max(0, capacity - registered);
    }
}

package com.flagship.learning_platform.event;

import lombok.Value;

/**
 * One entry of a user's schedule.
 */
@Value
public class ScheduledEvent {
    LiveEvent event;
    EventRegistration registration;
}

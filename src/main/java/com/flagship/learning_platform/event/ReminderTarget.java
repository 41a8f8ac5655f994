package com.flagship.learning_platform.event;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

/**
 * A confirmed registration claimed for its 24-hour reminder.
 */
@Value
public class ReminderTarget {
    UUID registrationId;
    UUID userId;
    String userName;
    String phone;
    String eventTitle;
    LocalDate eventDate;
    LocalTime eventTime;
}

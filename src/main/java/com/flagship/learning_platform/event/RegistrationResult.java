package com.flagship.learning_platform.event;

import lombok.Value;

/**
 * A registration with the event it belongs to, flagged with whether this call created it.
 */
@Value
public class RegistrationResult {
    EventRegistration registration;
    LiveEvent event;
    boolean created;
}

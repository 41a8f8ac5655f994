package com.flagship.learning_platform.event;

public enum RegistrationStatus {
    CONFIRMED,
    CANCELLED
}

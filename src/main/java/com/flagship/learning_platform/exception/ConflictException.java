package com.flagship.learning_platform.exception;

/**
 * Thrown when a create request collides with existing state and the operation
 * is not naturally idempotent (duplicate enrollment, duplicate RSVP, full event).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}

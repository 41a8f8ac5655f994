package com.flagship.learning_platform.exception;

/**
 * Thrown when a referenced course, lecture, event, enrollment, payment or
 * certificate does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String resource, Object id) {
        return new NotFoundException(resource + " not found: " + id);
    }
}

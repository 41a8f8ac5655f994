package com.flagship.learning_platform.exception;

/**
 * Thrown when the caller is not entitled to act on a resource, e.g. reporting
 * progress for a course they are not enrolled in.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}

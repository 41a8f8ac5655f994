package com.flagship.learning_platform.exception;

/**
 * Thrown when an action is requested before its prerequisite state holds,
 * e.g. asking for a certificate before the course is completed.
 */
public class PreconditionFailedException extends RuntimeException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}

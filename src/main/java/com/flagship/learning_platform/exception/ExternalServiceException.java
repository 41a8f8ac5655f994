package com.flagship.learning_platform.exception;

/**
 * Failure talking to a third-party service (payment gateway, messaging provider).
 * Domain state committed before the call is never rolled back because of it.
 */
public class ExternalServiceException extends RuntimeException {

    private final String service;

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public ExternalServiceException(String service, String message) {
        super(message);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}

package com.flagship.learning_platform.payment.gateway;

/**
 * The gateway did not confirm a reported payment (bad or missing signature).
 */
public class PaymentVerificationException extends RuntimeException {

    public PaymentVerificationException(String message) {
        super(message);
    }
}

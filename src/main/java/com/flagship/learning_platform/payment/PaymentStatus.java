package com.flagship.learning_platform.payment;

/**
 * Lifecycle of a checkout.
 *
 * PENDING -> COMPLETED, PENDING -> FAILED, COMPLETED -> REFUNDED.
 * FAILED and REFUNDED are terminal.
 */
public enum PaymentStatus {
    /**
     * Gateway order created, waiting for the client to pay and report back.
     */
    PENDING,

    /**
     * Signature verified; access to the course or event has been granted.
     */
    COMPLETED,

    /**
     * Verification failed or access could not be granted.
     */
    FAILED,

    REFUNDED
}

package com.flagship.learning_platform.payment;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a verified payment.
 *
 * {@code accessId} is the enrollment id for a course payment or the
 * registration id for an event payment. {@code accessGranted} is false when
 * the access already existed, e.g. on a repeated verify call.
 */
@Value
public class PaymentCompletion {
    Payment payment;
    UUID accessId;
    boolean accessGranted;
    boolean alreadyCompleted;
}

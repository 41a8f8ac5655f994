package com.flagship.learning_platform.payment;

import lombok.Value;

/**
 * Result of a checkout call. {@code replayed} is true when the Idempotency-Key
 * had been used before and the stored payment is returned instead of a new one.
 */
@Value
public class Checkout {
    Payment payment;
    boolean replayed;

    public String getOrderId() {
        return payment.getTransactionId();
    }

    static Checkout created(Payment payment) {
        return new Checkout(payment, false);
    }

    static Checkout replayed(Payment payment) {
        return new Checkout(payment, true);
    }
}

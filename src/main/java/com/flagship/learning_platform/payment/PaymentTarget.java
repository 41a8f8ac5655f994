package com.flagship.learning_platform.payment;

/**
 * What a payment buys. Exactly one of course or event is referenced.
 */
public enum PaymentTarget {
    COURSE,
    EVENT;

    public String tag() {
        return name().toLowerCase();
    }
}

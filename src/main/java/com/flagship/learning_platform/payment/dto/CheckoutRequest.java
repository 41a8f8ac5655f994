package com.flagship.learning_platform.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Exactly one of course_id and event_id must be present. The course price is
 * authoritative, so amount only matters for events without a list price.
 */
@Value
public class CheckoutRequest {

    @JsonProperty("course_id")
    UUID courseId;

    @JsonProperty("event_id")
    UUID eventId;

    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 50, message = "Payment method must be at most 50 characters")
    @JsonProperty("payment_method")
    String paymentMethod;
}

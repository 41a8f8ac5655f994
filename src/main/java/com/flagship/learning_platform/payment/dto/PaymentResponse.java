package com.flagship.learning_platform.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.payment.Payment;
import com.flagship.learning_platform.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("payment_method")
    String paymentMethod;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("course_id")
    UUID courseId;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .paymentMethod(payment.getPaymentMethod())
            .transactionId(payment.getTransactionId())
            .status(payment.getStatus())
            .failureReason(payment.getFailureReason())
            .courseId(payment.getCourseId())
            .eventId(payment.getEventId())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}

package com.flagship.learning_platform.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.payment.Payment;
import com.flagship.learning_platform.payment.PaymentCompletion;
import com.flagship.learning_platform.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class VerifyPaymentResponse {

    @JsonProperty("message")
    String message;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("course_id")
    UUID courseId;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("registration_id")
    UUID registrationId;

    public static VerifyPaymentResponse from(PaymentCompletion completion) {
        Payment payment = completion.getPayment();
        boolean course = payment.getCourseId() != null;
        return VerifyPaymentResponse.builder()
            .message("Payment verified successfully")
            .paymentId(payment.getId())
            .status(payment.getStatus())
            .courseId(payment.getCourseId())
            .eventId(payment.getEventId())
            .enrollmentId(course ? completion.getAccessId() : null)
            .registrationId(course ? null : completion.getAccessId())
            .build();
    }
}

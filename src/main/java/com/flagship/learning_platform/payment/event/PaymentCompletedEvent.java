package com.flagship.learning_platform.payment.event;

import com.flagship.learning_platform.outbox.LearningEvent;
import com.flagship.learning_platform.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per payment, on the PENDING to COMPLETED transition.
 */
@Value
public class PaymentCompletedEvent implements LearningEvent {
    UUID eventId;
    UUID paymentId;
    UUID userId;
    UUID courseId;
    UUID liveEventId;
    BigDecimal amount;
    String currency;
    String transactionId;
    String gatewayPaymentId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCompleted";
    public static final String AGGREGATE_TYPE = "Payment";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return paymentId;
    }

    public static PaymentCompletedEvent fromPayment(Payment payment) {
        return new PaymentCompletedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getUserId(),
            payment.getCourseId(),
            payment.getEventId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getTransactionId(),
            payment.getGatewayPaymentId(),
            Instant.now()
        );
    }
}

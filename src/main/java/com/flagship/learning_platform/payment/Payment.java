package com.flagship.learning_platform.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A checkout for one course or one event.
 *
 * Transitions return a new instance and reject moves the lifecycle does not
 * allow (see {@link PaymentStatus}).
 */
@Value
public class Payment {
    UUID id;
    UUID userId;
    UUID courseId;
    UUID eventId;
    BigDecimal amount;
    String currency;
    String paymentMethod;
    String transactionId;
    String gatewayPaymentId;
    PaymentStatus status;
    String failureReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A PENDING payment for a gateway order.
     *
     * @throws IllegalArgumentException unless exactly one of courseId and eventId is set
     */
    public static Payment initiate(UUID userId, UUID courseId, UUID eventId, BigDecimal amount,
                                   String currency, String paymentMethod, String transactionId) {
        if ((courseId == null) == (eventId == null)) {
            throw new IllegalArgumentException("Exactly one of course_id or event_id is required");
        }
        Instant now = Instant.now();
        return new Payment(
            UUID.randomUUID(),
            userId,
            courseId,
            eventId,
            amount,
            currency,
            paymentMethod,
            transactionId,
            null,
            PaymentStatus.PENDING,
            null,
            now,
            now
        );
    }

    public Payment complete(String gatewayPaymentId) {
        requireTransition(PaymentStatus.COMPLETED);
        return withStatus(PaymentStatus.COMPLETED, gatewayPaymentId, null);
    }

    public Payment fail(String reason) {
        requireTransition(PaymentStatus.FAILED);
        return withStatus(PaymentStatus.FAILED, gatewayPaymentId, reason);
    }

    public Payment refund() {
        requireTransition(PaymentStatus.REFUNDED);
        return withStatus(PaymentStatus.REFUNDED, gatewayPaymentId, failureReason);
    }

    public PaymentTarget getTarget() {
        return courseId != null ? PaymentTarget.COURSE : PaymentTarget.EVENT;
    }

    public boolean belongsTo(UUID callerId) {
        return userId.equals(callerId);
    }

    public boolean isTerminal() {
        return status == PaymentStatus.FAILED || status == PaymentStatus.REFUNDED;
    }

    /**
     * Same status counts as allowed so repeated reports stay idempotent.
     */
    public boolean canTransitionTo(PaymentStatus targetStatus) {
        if (this.status == targetStatus) {
            return true;
        }

        return switch (this.status) {
            case PENDING -> targetStatus == PaymentStatus.COMPLETED || targetStatus == PaymentStatus.FAILED;
            case COMPLETED -> targetStatus == PaymentStatus.REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }

    private void requireTransition(PaymentStatus targetStatus) {
        if (status == targetStatus || !canTransitionTo(targetStatus)) {
            throw new IllegalStateException(
                String.format("Cannot move payment %s from %s to %s", id, status, targetStatus));
        }
    }

    private Payment withStatus(PaymentStatus newStatus, String newGatewayPaymentId, String reason) {
        return new Payment(
            id,
            userId,
            courseId,
            eventId,
            amount,
            currency,
            paymentMethod,
            transactionId,
            newGatewayPaymentId,
            newStatus,
            reason,
            createdAt,
            Instant.now()
        );
    }
}

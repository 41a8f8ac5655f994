package com.flagship.learning_platform.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the payments table.
 *
 * No setters: state changes come from a {@link Payment} transition through
 * {@link #updateFromDomain(Payment)}. The idempotency key is a persistence
 * concern and is passed next to the domain object on creation.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "course_id", updatable = false)
    private UUID courseId;

    @Column(name = "event_id", updatable = false)
    private UUID eventId;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "payment_method", nullable = false, updatable = false)
    private String paymentMethod;

    @Column(name = "transaction_id", nullable = false, unique = true, updatable = false)
    private String transactionId;

    @Column(name = "gateway_payment_id")
    private String gatewayPaymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        return new PaymentEntity(
            payment.getId(),
            payment.getUserId(),
            payment.getCourseId(),
            payment.getEventId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getPaymentMethod(),
            payment.getTransactionId(),
            payment.getGatewayPaymentId(),
            payment.getStatus(),
            payment.getFailureReason(),
            idempotencyKey,
            null, // set by @PrePersist
            null
        );
    }

    public Payment toDomain() {
        return new Payment(
            id,
            userId,
            courseId,
            eventId,
            amount,
            currency,
            paymentMethod,
            transactionId,
            gatewayPaymentId,
            status,
            failureReason,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable fields (status, gateway payment id, failure reason).
     */
    void updateFromDomain(Payment payment) {
        this.status = payment.getStatus();
        this.gatewayPaymentId = payment.getGatewayPaymentId();
        this.failureReason = payment.getFailureReason();
    }
}

package com.flagship.learning_platform.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Payment} and {@link PaymentEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    /**
     * Inserts a new payment. Flushes so a duplicate idempotency key or
     * transaction id surfaces here as a DataIntegrityViolationException.
     */
    @Transactional
    public Payment save(Payment payment, String idempotencyKey) {
        PaymentEntity saved = paymentRepository.saveAndFlush(PaymentEntity.fromDomain(payment, idempotencyKey));
        log.debug("Saved payment {} with idempotency key {}", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByIdempotencyKey(String idempotencyKey) {
        return paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByTransactionId(String transactionId) {
        return paymentRepository.findByTransactionId(transactionId).map(PaymentEntity::toDomain);
    }

    /**
     * Payments of a user, newest first.
     */
    @Transactional(readOnly = true)
    public List<Payment> listForUser(UUID userId) {
        return paymentRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    /**
     * Row-locks a payment for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Payment> lock(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId).map(PaymentEntity::toDomain);
    }

    /**
     * Writes a transition produced by the domain object. Joins the caller's
     * transaction, which must already hold the row lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> new IllegalArgumentException("Payment not found: " + payment.getId()));
        existing.updateFromDomain(payment);
        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    /**
     * Marks a PENDING payment FAILED in its own transaction, so the failure
     * is recorded even though the caller is about to throw. Payments in any
     * other status are left untouched.
     *
     * @return the stored payment after the call
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Payment> markFailed(UUID paymentId, String reason) {
        return paymentRepository.findByIdForUpdate(paymentId).map(entity -> {
            Payment current = entity.toDomain();
            if (current.getStatus() != PaymentStatus.PENDING) {
                log.info("Payment {} is {}, not marking it failed", paymentId, current.getStatus());
                return current;
            }
            entity.updateFromDomain(current.fail(reason));
            PaymentEntity saved = paymentRepository.saveAndFlush(entity);
            log.warn("Payment {} marked FAILED: {}", paymentId, reason);
            return saved.toDomain();
        });
    }
}

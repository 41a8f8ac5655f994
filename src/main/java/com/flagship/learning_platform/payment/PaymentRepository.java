package com.flagship.learning_platform.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Lookup by gateway order id.
     */
    Optional<PaymentEntity> findByTransactionId(String transactionId);

    /**
     * Loads a payment with SELECT ... FOR UPDATE so concurrent completions of
     * the same order run one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    List<PaymentEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}

package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.exception.ForbiddenException;
import com.flagship.learning_platform.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Read side of payments as seen by their owner.
 */
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentPersistenceService persistenceService;

    /**
     * The caller's payments, newest first.
     */
    public List<Payment> listTransactions(UUID userId) {
        return persistenceService.listForUser(userId);
    }

    /**
     * @throws NotFoundException if the payment does not exist
     * @throws ForbiddenException if it belongs to another user
     */
    public Payment getPayment(UUID callerId, UUID paymentId) {
        Payment payment = persistenceService.findById(paymentId)
            .orElseThrow(() -> NotFoundException.of("Payment", paymentId));
        if (!payment.belongsTo(callerId)) {
            throw new ForbiddenException("Payment " + paymentId + " belongs to another user");
        }
        return payment;
    }
}

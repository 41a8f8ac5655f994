package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.ForbiddenException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.observability.CorrelationContext;
import com.flagship.learning_platform.observability.LearningMetrics;
import com.flagship.learning_platform.payment.gateway.PaymentGateway;
import com.flagship.learning_platform.payment.gateway.PaymentVerificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Payment-to-enrollment bridge.
 *
 * The signature check runs before any transaction is opened. If it throws,
 * for any reason, the payment is marked FAILED in a separate transaction and
 * the error is re-thrown to the caller. A verified payment is committed as
 * COMPLETED before access is granted, so an event that filled up while the
 * user was paying surfaces as a conflict on a COMPLETED payment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentCompletionService {

    private final PaymentPersistenceService persistenceService;
    private final PaymentFulfillmentService fulfillmentService;
    private final PaymentGateway paymentGateway;
    private final LearningMetrics metrics;

    /**
     * @param callerId the authenticated user; must own the payment
     * @param orderId gateway order id, stored as the payment's transaction id
     * @throws NotFoundException if no payment has this order id
     * @throws ForbiddenException if the payment belongs to another user
     * @throws PaymentVerificationException if the gateway signature does not match
     * @throws ConflictException if the paid event is full; the payment stays COMPLETED
     * @throws IllegalStateException if the payment already FAILED or was REFUNDED
     */
    public PaymentCompletion completePayment(UUID callerId, String orderId, String gatewayPaymentId, String signature) {
        long startTime = System.currentTimeMillis();

        Payment payment = persistenceService.findByTransactionId(orderId)
            .orElseThrow(() -> new NotFoundException("Payment record not found for order " + orderId));

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, payment.getId().toString());
        try {
            if (!payment.belongsTo(callerId)) {
                throw new ForbiddenException("Payment " + payment.getId() + " belongs to another user");
            }
            if (payment.isTerminal()) {
                throw new IllegalStateException("Payment " + payment.getId() + " is " + payment.getStatus());
            }

            String target = payment.getTarget().tag();
            try {
                paymentGateway.verifySignature(orderId, gatewayPaymentId, signature);
            } catch (RuntimeException e) {
                persistenceService.markFailed(payment.getId(), failureReason(e));
                metrics.recordPaymentCompleted(target, "verification_failed");
                throw e;
            }

            PaymentFulfillmentService.RecordedCompletion recorded =
                fulfillmentService.recordCompletion(payment.getId(), gatewayPaymentId);
            PaymentCompletion completion;
            try {
                completion = fulfillmentService.grantAccess(recorded);
            } catch (ConflictException e) {
                metrics.recordPaymentCompleted(target, "access_rejected");
                log.warn("Payment {} completed but access was not granted: {}", payment.getId(), e.getMessage());
                throw e;
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordPaymentCompleted(target, completion.isAlreadyCompleted() ? "duplicate" : "completed");
            metrics.recordLatency("payment_complete", duration);
            log.info("Payment completed: target={}, access={}, granted={}, duration={}ms",
                    target, completion.getAccessId(), completion.isAccessGranted(), duration);
            return completion;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private static String failureReason(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

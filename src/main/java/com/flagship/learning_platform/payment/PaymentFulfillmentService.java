package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.enrollment.EnrollmentLedger;
import com.flagship.learning_platform.enrollment.EnrollmentResult;
import com.flagship.learning_platform.event.EventRegistrationService;
import com.flagship.learning_platform.event.RegistrationResult;
import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.outbox.OutboxService;
import com.flagship.learning_platform.payment.event.PaymentCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Turns a verified payment into access, in two transactions.
 *
 * {@link #recordCompletion} locks the payment row, so concurrent verify calls
 * for the same order run one after another. The second one finds the payment
 * COMPLETED and writes no second PaymentCompleted event. {@link #grantAccess}
 * then runs the idempotent grant. A grant that fails (an event with no seat
 * left) rolls back only the grant; the captured payment stays COMPLETED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentFulfillmentService {

    private final PaymentPersistenceService persistenceService;
    private final EnrollmentLedger enrollmentLedger;
    private final EventRegistrationService registrationService;
    private final OutboxService outboxService;

    /**
     * @throws NotFoundException if the payment does not exist
     * @throws IllegalStateException if the payment is FAILED or REFUNDED
     */
    @Transactional
    public RecordedCompletion recordCompletion(UUID paymentId, String gatewayPaymentId) {
        Payment locked = persistenceService.lock(paymentId)
            .orElseThrow(() -> NotFoundException.of("Payment", paymentId));

        if (locked.getStatus() == PaymentStatus.COMPLETED) {
            log.info("Payment {} already completed, re-checking access", paymentId);
            return new RecordedCompletion(locked, true);
        }

        Payment completed = persistenceService.update(locked.complete(gatewayPaymentId));
        outboxService.saveEvent(PaymentCompletedEvent.fromPayment(completed));
        return new RecordedCompletion(completed, false);
    }

    /**
     * Enrolls the payer in the course or registers them for the event.
     *
     * @throws ConflictException if the paid event has no seat left
     */
    @Transactional
    public PaymentCompletion grantAccess(RecordedCompletion recorded) {
        Payment completed = recorded.getPayment();
        if (completed.getTarget() == PaymentTarget.COURSE) {
            EnrollmentResult result = enrollmentLedger.createIfAbsent(completed.getUserId(), completed.getCourseId());
            return new PaymentCompletion(completed, result.getEnrollment().getId(), result.isCreated(),
                recorded.isAlreadyCompleted());
        }

        RegistrationResult result = registrationService.registerIfAbsent(completed.getUserId(), completed.getEventId());
        return new PaymentCompletion(completed, result.getRegistration().getId(), result.isCreated(),
            recorded.isAlreadyCompleted());
    }

    @Value
    public static class RecordedCompletion {
        Payment payment;
        boolean alreadyCompleted;
    }
}

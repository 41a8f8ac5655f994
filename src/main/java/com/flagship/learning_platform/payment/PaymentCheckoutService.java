package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.catalog.CatalogService;
import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.enrollment.EnrollmentLedger;
import com.flagship.learning_platform.event.EventRegistrationService;
import com.flagship.learning_platform.event.LiveEvent;
import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.observability.CorrelationContext;
import com.flagship.learning_platform.observability.LearningMetrics;
import com.flagship.learning_platform.payment.gateway.GatewayOrder;
import com.flagship.learning_platform.payment.gateway.PaymentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts a payment for one course or one event.
 *
 * Not transactional. The gateway order is created first, outside any
 * database transaction, then the PENDING payment is inserted in its own short
 * transaction. A repeated Idempotency-Key returns the stored payment (Redis
 * fast path, payments.idempotency_key fallback); two concurrent first calls
 * with one key are settled by the unique index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentCheckoutService {

    static final String DEFAULT_PAYMENT_METHOD = "rupay";

    private final PaymentGateway paymentGateway;
    private final PaymentPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final CatalogService catalogService;
    private final EnrollmentLedger enrollmentLedger;
    private final EventRegistrationService registrationService;
    private final LearningProperties properties;
    private final LearningMetrics metrics;

    /**
     * @param amount used for event payments without a list price; ignored for courses
     * @throws IllegalArgumentException unless exactly one of courseId and eventId is given, or without a usable amount
     * @throws NotFoundException if the course or event does not exist
     * @throws ConflictException if the caller already has access, or the event is full
     */
    public Checkout checkout(UUID userId, UUID courseId, UUID eventId, BigDecimal amount,
                             String paymentMethod, String idempotencyKey) {
        long startTime = System.currentTimeMillis();

        if ((courseId == null) == (eventId == null)) {
            throw new IllegalArgumentException("Exactly one of course_id or event_id is required");
        }
        PaymentTarget target = courseId != null ? PaymentTarget.COURSE : PaymentTarget.EVENT;

        Optional<UUID> existingPaymentId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingPaymentId.isPresent()) {
            metrics.recordIdempotencyHit();
            Payment existing = persistenceService.findById(existingPaymentId.get())
                .orElseThrow(() -> new IllegalStateException(
                    "Payment found by idempotency key but not found by ID: " + existingPaymentId.get()));
            return replay(existing, userId);
        }
        metrics.recordIdempotencyMiss();

        try {
            BigDecimal price = target == PaymentTarget.COURSE
                ? coursePrice(userId, courseId)
                : eventPrice(userId, eventId, amount);
            String currency = properties.getPayment().getCurrency();
            String method = paymentMethod == null || paymentMethod.isBlank() ? DEFAULT_PAYMENT_METHOD : paymentMethod;

            GatewayOrder order = paymentGateway.createOrder(price, currency, UUID.randomUUID().toString());

            Payment payment = Payment.initiate(userId, courseId, eventId, price, currency, method, order.getOrderId());
            Payment saved;
            try {
                saved = persistenceService.save(payment, idempotencyKey);
            } catch (DataIntegrityViolationException e) {
                Payment winner = persistenceService.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
                log.info("Concurrent checkout with idempotency key {} resolved to payment {}",
                        idempotencyKey, winner.getId());
                return replay(winner, userId);
            }

            MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, saved.getId().toString());
            idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordCheckout(target.tag(), "created");
            metrics.recordLatency("checkout", duration);
            log.info("Checkout created: target={}, amount={} {}, order={}, duration={}ms",
                    target, price, currency, order.getOrderId(), duration);

            return Checkout.created(saved);
        } catch (RuntimeException e) {
            metrics.recordCheckout(target.tag(), "error");
            metrics.recordLatency("checkout", System.currentTimeMillis() - startTime);
            log.warn("Checkout failed: target={}, error={}", target, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }

    private Checkout replay(Payment existing, UUID userId) {
        if (!existing.belongsTo(userId)) {
            throw new ConflictException("Idempotency key already used by another request");
        }
        log.info("Idempotency key already used, returning payment {}", existing.getId());
        return Checkout.replayed(existing);
    }

    private BigDecimal coursePrice(UUID userId, UUID courseId) {
        BigDecimal price = catalogService.getCourse(courseId).getPrice();
        if (enrollmentLedger.find(userId, courseId).isPresent()) {
            throw new ConflictException("Already enrolled in course " + courseId);
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Course " + courseId + " is free and needs no payment");
        }
        return price;
    }

    private BigDecimal eventPrice(UUID userId, UUID eventId, BigDecimal requested) {
        LiveEvent event = registrationService.getEvent(eventId);
        if (registrationService.findRegistration(userId, eventId).isPresent()) {
            throw new ConflictException("Already registered for this event");
        }
        if (event.isFull()) {
            throw new ConflictException("Event is full");
        }
        BigDecimal price = event.getPrice() != null && event.getPrice().signum() > 0 ? event.getPrice() : requested;
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than 0");
        }
        return price;
    }
}

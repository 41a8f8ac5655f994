package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.enrollment.EnrollmentLedger;
import com.flagship.learning_platform.event.EventRegistrationService;
import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.ForbiddenException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.payment.gateway.GatewayOrder;
import com.flagship.learning_platform.payment.gateway.PaymentVerificationException;
import com.flagship.learning_platform.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentFlowTest extends IntegrationTestSupport {

    private static final String SIGNATURE = "valid-signature";

    @Autowired
    private PaymentCheckoutService checkoutService;

    @Autowired
    private PaymentCompletionService completionService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private EnrollmentLedger enrollmentLedger;

    @Autowired
    private EventRegistrationService registrationService;

    private UUID learnerId;
    private UUID courseId;

    @BeforeEach
    void setUp() {
        ValueOperations<String, String> valueOperations = mock();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(paymentGateway.createOrder(any(), anyString(), anyString())).thenAnswer(invocation -> new GatewayOrder(
            "order_" + UUID.randomUUID().toString().substring(0, 12),
            invocation.getArgument(0),
            invocation.getArgument(1),
            invocation.getArgument(2)));

        learnerId = createUser("Arjun", "+919800000005");
        courseId = createCourse("Microservices", new BigDecimal("1499.00"));
        addLecture(courseId, "Boundaries", 1);
    }

    private Checkout checkoutCourse(String idempotencyKey) {
        return checkoutService.checkout(learnerId, courseId, null, null, null, idempotencyKey);
    }

    private Payment reload(UUID paymentId) {
        return paymentService.getPayment(learnerId, paymentId);
    }

    @Nested
    @DisplayName("Checkout")
    class CheckoutTests {

        @Test
        @DisplayName("Course checkout charges the list price and stores a PENDING payment")
        void courseCheckout() {
            Checkout checkout = checkoutService.checkout(
                learnerId, courseId, null, new BigDecimal("1.00"), "upi", "key-" + UUID.randomUUID());

            Payment payment = checkout.getPayment();
            assertFalse(checkout.isReplayed());
            assertEquals(PaymentStatus.PENDING, payment.getStatus());
            assertEquals(0, new BigDecimal("1499.00").compareTo(payment.getAmount()));
            assertEquals("INR", payment.getCurrency());
            assertEquals("upi", payment.getPaymentMethod());
            assertTrue(payment.getTransactionId().startsWith("order_"));
        }

        @Test
        @DisplayName("Repeating the Idempotency-Key returns the original payment")
        void idempotentCheckout() {
            String key = "key-" + UUID.randomUUID();

            Checkout first = checkoutCourse(key);
            Checkout second = checkoutCourse(key);

            assertTrue(second.isReplayed());
            assertEquals(first.getPayment().getId(), second.getPayment().getId());
            verify(paymentGateway, times(1)).createOrder(any(), anyString(), anyString());
            assertEquals(1, countRows("SELECT COUNT(*) FROM payments"));
        }

        @Test
        @DisplayName("Another user's Idempotency-Key is a conflict")
        void keyOwnedByAnotherUser() {
            String key = "key-" + UUID.randomUUID();
            checkoutCourse(key);
            UUID otherUser = createUser("Other", null);

            assertThrows(ConflictException.class, () ->
                checkoutService.checkout(otherUser, courseId, null, null, null, key));
        }

        @Test
        @DisplayName("Both or neither target is rejected before the gateway is called")
        void exactlyOneTarget() {
            UUID eventId = createEvent("Meetup", 10, new BigDecimal("99.00"));

            assertThrows(IllegalArgumentException.class, () ->
                checkoutService.checkout(learnerId, courseId, eventId, null, null, "key-both"));
            assertThrows(IllegalArgumentException.class, () ->
                checkoutService.checkout(learnerId, null, null, new BigDecimal("10.00"), null, "key-neither"));
            verify(paymentGateway, never()).createOrder(any(), anyString(), anyString());
        }

        @Test
        @DisplayName("Unknown course is not found")
        void unknownCourse() {
            assertThrows(NotFoundException.class, () ->
                checkoutService.checkout(learnerId, UUID.randomUUID(), null, null, null, "key-unknown"));
        }

        @Test
        @DisplayName("An enrolled learner cannot pay for the course again")
        void alreadyEnrolled() {
            enrollmentLedger.create(learnerId, courseId);

            assertThrows(ConflictException.class, () -> checkoutCourse("key-" + UUID.randomUUID()));
        }
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("A verified course payment completes and enrolls the learner")
        void completesCoursePayment() {
            Checkout checkout = checkoutCourse("key-" + UUID.randomUUID());

            PaymentCompletion completion = completionService.completePayment(
                learnerId, checkout.getOrderId(), "pay_123", SIGNATURE);

            assertEquals(PaymentStatus.COMPLETED, completion.getPayment().getStatus());
            assertEquals("pay_123", completion.getPayment().getGatewayPaymentId());
            assertTrue(completion.isAccessGranted());
            assertEquals(completion.getAccessId(),
                enrollmentLedger.find(learnerId, courseId).orElseThrow().getId());
            assertEquals(1, countRows("SELECT students_count FROM courses WHERE id = ?", courseId));
            assertEquals(1, countRows("SELECT COUNT(*) FROM outbox_events WHERE event_type = 'PaymentCompleted'"));
            assertEquals(1, countRows("SELECT COUNT(*) FROM outbox_events WHERE event_type = 'EnrollmentCreated'"));
        }

        @Test
        @DisplayName("Concurrent verify calls for one order enroll exactly once")
        void concurrentCompletion() throws Exception {
            Checkout checkout = checkoutCourse("key-" + UUID.randomUUID());
            int threads = 5;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            List<Future<PaymentCompletion>> results = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return completionService.completePayment(learnerId, checkout.getOrderId(), "pay_456", SIGNATURE);
                }));
            }
            start.countDown();

            int granted = 0;
            for (Future<PaymentCompletion> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isAccessGranted()) {
                    granted++;
                }
            }
            executor.shutdown();

            assertEquals(1, granted);
            assertEquals(1, countRows("SELECT COUNT(*) FROM enrollments WHERE user_id = ?", learnerId));
            assertEquals(1, countRows("SELECT students_count FROM courses WHERE id = ?", courseId));
            assertEquals(1, countRows("SELECT COUNT(*) FROM outbox_events WHERE event_type = 'PaymentCompleted'"));
        }

        @Test
        @DisplayName("A bad signature fails the payment and surfaces the error")
        void badSignature() {
            Checkout checkout = checkoutCourse("key-" + UUID.randomUUID());
            doThrow(new PaymentVerificationException("Invalid payment signature"))
                .when(paymentGateway).verifySignature(eq(checkout.getOrderId()), anyString(), eq("forged"));

            assertThrows(PaymentVerificationException.class, () ->
                completionService.completePayment(learnerId, checkout.getOrderId(), "pay_789", "forged"));

            Payment failed = reload(checkout.getPayment().getId());
            assertEquals(PaymentStatus.FAILED, failed.getStatus());
            assertEquals("Invalid payment signature", failed.getFailureReason());
            assertTrue(enrollmentLedger.find(learnerId, courseId).isEmpty());

            assertThrows(IllegalStateException.class, () ->
                completionService.completePayment(learnerId, checkout.getOrderId(), "pay_789", SIGNATURE));
        }

        @Test
        @DisplayName("An event that filled up during payment keeps the payment completed and reports a conflict")
        void eventFilledDuringPayment() {
            UUID eventId = createEvent("Sold Out Soon", 1, new BigDecimal("250.00"));
            Checkout checkout = checkoutService.checkout(learnerId, null, eventId, null, null, "key-" + UUID.randomUUID());
            registrationService.rsvp(createUser("Quick", null), eventId);

            assertThrows(ConflictException.class, () ->
                completionService.completePayment(learnerId, checkout.getOrderId(), "pay_evt", SIGNATURE));

            Payment stored = reload(checkout.getPayment().getId());
            assertEquals(PaymentStatus.COMPLETED, stored.getStatus());
            assertEquals("pay_evt", stored.getGatewayPaymentId());
            assertTrue(registrationService.findRegistration(learnerId, eventId).isEmpty());
            assertEquals(1, countRows("SELECT registered FROM events WHERE id = ?", eventId));
            assertEquals(1, countRows("SELECT COUNT(*) FROM outbox_events WHERE event_type = 'PaymentCompleted'"));

            assertThrows(ConflictException.class, () ->
                completionService.completePayment(learnerId, checkout.getOrderId(), "pay_evt", SIGNATURE));
            assertEquals(1, countRows("SELECT COUNT(*) FROM outbox_events WHERE event_type = 'PaymentCompleted'"));
        }

        @Test
        @DisplayName("A verified event payment registers the learner")
        void completesEventPayment() {
            UUID eventId = createEvent("Paid Workshop", 10, new BigDecimal("250.00"));
            Checkout checkout = checkoutService.checkout(learnerId, null, eventId, null, null, "key-" + UUID.randomUUID());

            PaymentCompletion completion = completionService.completePayment(
                learnerId, checkout.getOrderId(), "pay_evt", SIGNATURE);

            assertEquals(0, new BigDecimal("250.00").compareTo(completion.getPayment().getAmount()));
            assertEquals(completion.getAccessId(),
                registrationService.findRegistration(learnerId, eventId).orElseThrow().getId());
        }

        @Test
        @DisplayName("Only the payer can verify, and unknown orders are not found")
        void ownershipAndUnknownOrder() {
            Checkout checkout = checkoutCourse("key-" + UUID.randomUUID());
            UUID intruder = createUser("Intruder", null);

            assertThrows(ForbiddenException.class, () ->
                completionService.completePayment(intruder, checkout.getOrderId(), "pay_x", SIGNATURE));
            assertThrows(NotFoundException.class, () ->
                completionService.completePayment(learnerId, "order_missing", "pay_x", SIGNATURE));
            assertEquals(PaymentStatus.PENDING, reload(checkout.getPayment().getId()).getStatus());
        }

        @Test
        @DisplayName("Transactions list the caller's payments newest first")
        void listTransactions() {
            Checkout first = checkoutCourse("key-" + UUID.randomUUID());
            UUID eventId = createEvent("Meetup", 10, new BigDecimal("99.00"));
            Checkout second = checkoutService.checkout(learnerId, null, eventId, null, null, "key-" + UUID.randomUUID());

            List<Payment> transactions = paymentService.listTransactions(learnerId);

            assertEquals(List.of(second.getPayment().getId(), first.getPayment().getId()),
                transactions.stream().map(Payment::getId).toList());
        }
    }
}

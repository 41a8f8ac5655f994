package com.flagship.learning_platform.failure;

import com.flagship.learning_platform.exception.ExternalServiceException;
import com.flagship.learning_platform.outbox.OutboxService;
import com.flagship.learning_platform.payment.Checkout;
import com.flagship.learning_platform.payment.PaymentCheckoutService;
import com.flagship.learning_platform.payment.PaymentCompletion;
import com.flagship.learning_platform.payment.PaymentCompletionService;
import com.flagship.learning_platform.payment.PaymentStatus;
import com.flagship.learning_platform.payment.gateway.GatewayOrder;
import com.flagship.learning_platform.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Behaviour of checkout and fulfilment when the cache, the broker or the
 * payment provider misbehave. Kafka is unreachable for the whole class
 * (bootstrap servers point at a closed port and the publisher is off).
 */
class FailureScenarioTest extends IntegrationTestSupport {

    @Autowired
    private PaymentCheckoutService checkoutService;

    @Autowired
    private PaymentCompletionService completionService;

    @Autowired
    private OutboxService outboxService;

    private ValueOperations<String, String> valueOperations;
    private UUID learnerId;
    private UUID courseId;

    @BeforeEach
    void setUp() {
        valueOperations = mock();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(paymentGateway.createOrder(any(), anyString(), anyString())).thenAnswer(invocation -> new GatewayOrder(
            "order_" + UUID.randomUUID().toString().substring(0, 12),
            invocation.getArgument(0),
            invocation.getArgument(1),
            invocation.getArgument(2)));

        learnerId = createUser("Lakshmi", "+919800000010");
        courseId = createCourse("Resilience Patterns", new BigDecimal("899.00"));
        addLecture(courseId, "Timeouts", 1);
    }

    @Nested
    @DisplayName("Redis unavailable")
    class RedisFailures {

        @BeforeEach
        void redisDown() {
            when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("Connection refused"));
            doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        }

        @Test
        @DisplayName("Checkout still succeeds")
        void checkoutWorks() {
            Checkout checkout = checkoutService.checkout(learnerId, courseId, null, null, "card", "redis-down-1");

            assertEquals(PaymentStatus.PENDING, checkout.getPayment().getStatus());
            assertEquals(1, countRows("SELECT COUNT(*) FROM payments"));
        }

        @Test
        @DisplayName("Idempotency falls back to the payments table")
        void databaseFallback() {
            Checkout first = checkoutService.checkout(learnerId, courseId, null, null, "card", "redis-down-2");
            Checkout replay = checkoutService.checkout(learnerId, courseId, null, null, "card", "redis-down-2");

            assertTrue(replay.isReplayed());
            assertEquals(first.getPayment().getId(), replay.getPayment().getId());
            verify(paymentGateway, times(1)).createOrder(any(), anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("Kafka unavailable")
    class KafkaFailures {

        @Test
        @DisplayName("A completed payment grants access and keeps its events in the outbox")
        void eventsWaitInOutbox() {
            Checkout checkout = checkoutService.checkout(learnerId, courseId, null, null, "card", "kafka-down-1");

            PaymentCompletion completion = completionService.completePayment(
                learnerId, checkout.getPayment().getTransactionId(), "pay_k1", "sig");

            assertTrue(completion.isAccessGranted());
            assertEquals(1, countRows("SELECT COUNT(*) FROM enrollments WHERE user_id = ?", learnerId));
            assertEquals(2, outboxService.countUnpublished());
            assertEquals(1, countRows(
                "SELECT COUNT(*) FROM outbox_events WHERE event_type = 'PaymentCompleted' AND published_at IS NULL"));
        }

        @Test
        @DisplayName("Replaying a completion adds no events")
        void replayAddsNothing() {
            Checkout checkout = checkoutService.checkout(learnerId, courseId, null, null, "card", "kafka-down-2");
            String orderId = checkout.getPayment().getTransactionId();

            completionService.completePayment(learnerId, orderId, "pay_k2", "sig");
            long events = outboxService.countUnpublished();
            PaymentCompletion replay = completionService.completePayment(learnerId, orderId, "pay_k2", "sig");

            assertTrue(replay.isAlreadyCompleted());
            assertEquals(events, outboxService.countUnpublished());
        }
    }

    @Nested
    @DisplayName("Payment provider unavailable")
    class GatewayFailures {

        @Test
        @DisplayName("A failed order creation stores nothing")
        void orderCreationFails() {
            when(paymentGateway.createOrder(any(), anyString(), anyString()))
                .thenThrow(new ExternalServiceException("razorpay", "Payment initialization failed: timeout"));

            assertThrows(ExternalServiceException.class,
                () -> checkoutService.checkout(learnerId, courseId, null, null, "card", "gateway-down-1"));

            assertEquals(0, countRows("SELECT COUNT(*) FROM payments"));
            assertEquals(0, outboxService.countUnpublished());
        }

        @Test
        @DisplayName("The same key works once the provider recovers")
        void retryAfterRecovery() {
            when(paymentGateway.createOrder(any(), anyString(), anyString()))
                .thenThrow(new ExternalServiceException("razorpay", "Payment initialization failed: timeout"))
                .thenReturn(new GatewayOrder("order_recovered", new BigDecimal("899.00"), "INR", "r"));

            assertThrows(ExternalServiceException.class,
                () -> checkoutService.checkout(learnerId, courseId, null, null, "card", "gateway-down-2"));
            Checkout checkout = checkoutService.checkout(learnerId, courseId, null, null, "card", "gateway-down-2");

            assertFalse(checkout.isReplayed());
            assertEquals("order_recovered", checkout.getPayment().getTransactionId());
        }
    }
}

package com.flagship.learning_platform.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentTest {

    private final UUID userId = UUID.randomUUID();

    private Payment pendingCoursePayment() {
        return Payment.initiate(userId, UUID.randomUUID(), null, new BigDecimal("499.00"), "INR", "upi", "order_1");
    }

    @Nested
    @DisplayName("Initiation")
    class Initiation {

        @Test
        @DisplayName("Starts pending with the gateway order as transaction id")
        void pending() {
            Payment payment = pendingCoursePayment();

            assertEquals(PaymentStatus.PENDING, payment.getStatus());
            assertEquals("order_1", payment.getTransactionId());
            assertEquals(PaymentTarget.COURSE, payment.getTarget());
            assertTrue(payment.belongsTo(userId));
            assertFalse(payment.belongsTo(UUID.randomUUID()));
        }

        @Test
        @DisplayName("Rejects a payment for both a course and an event")
        void bothTargets() {
            assertThrows(IllegalArgumentException.class, () -> Payment.initiate(
                userId, UUID.randomUUID(), UUID.randomUUID(), BigDecimal.TEN, "INR", null, "order_2"));
        }

        @Test
        @DisplayName("Rejects a payment for nothing")
        void noTarget() {
            assertThrows(IllegalArgumentException.class, () -> Payment.initiate(
                userId, null, null, BigDecimal.TEN, "INR", null, "order_3"));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Pending completes with the gateway payment id")
        void complete() {
            Payment completed = pendingCoursePayment().complete("pay_1");

            assertEquals(PaymentStatus.COMPLETED, completed.getStatus());
            assertEquals("pay_1", completed.getGatewayPaymentId());
            assertFalse(completed.isTerminal());
        }

        @Test
        @DisplayName("Pending fails with a reason and becomes terminal")
        void fail() {
            Payment failed = pendingCoursePayment().fail("Invalid payment signature");

            assertEquals(PaymentStatus.FAILED, failed.getStatus());
            assertEquals("Invalid payment signature", failed.getFailureReason());
            assertTrue(failed.isTerminal());
            assertThrows(IllegalStateException.class, () -> failed.complete("pay_2"));
        }

        @Test
        @DisplayName("Only completed payments can be refunded")
        void refund() {
            assertThrows(IllegalStateException.class, () -> pendingCoursePayment().refund());

            Payment refunded = pendingCoursePayment().complete("pay_3").refund();
            assertEquals(PaymentStatus.REFUNDED, refunded.getStatus());
            assertFalse(refunded.canTransitionTo(PaymentStatus.COMPLETED));
        }

        @Test
        @DisplayName("Completing twice is rejected")
        void completeTwice() {
            Payment completed = pendingCoursePayment().complete("pay_4");

            assertTrue(completed.canTransitionTo(PaymentStatus.COMPLETED));
            assertThrows(IllegalStateException.class, () -> completed.complete("pay_4"));
        }
    }
}

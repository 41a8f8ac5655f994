package com.flagship.learning_platform.payment;

import com.flagship.learning_platform.exception.ForbiddenException;
import com.flagship.learning_platform.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PaymentServiceTest {

    private PaymentPersistenceService persistenceService;
    private PaymentService paymentService;

    private final UUID ownerId = UUID.randomUUID();
    private Payment payment;

    @BeforeEach
    void setUp() {
        persistenceService = mock(PaymentPersistenceService.class);
        paymentService = new PaymentService(persistenceService);
        payment = Payment.initiate(ownerId, UUID.randomUUID(), null, new BigDecimal("250.00"), "INR", "upi", "order_s1");
        when(persistenceService.findById(payment.getId())).thenReturn(Optional.of(payment));
    }

    @Test
    @DisplayName("Owners can read their payment")
    void owner() {
        assertSame(payment, paymentService.getPayment(ownerId, payment.getId()));
    }

    @Test
    @DisplayName("Other users are forbidden")
    void otherUser() {
        assertThrows(ForbiddenException.class, () -> paymentService.getPayment(UUID.randomUUID(), payment.getId()));
    }

    @Test
    @DisplayName("Unknown payments are not found")
    void unknown() {
        UUID missing = UUID.randomUUID();
        when(persistenceService.findById(missing)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> paymentService.getPayment(ownerId, missing));
    }

    @Test
    @DisplayName("Transactions are listed for the caller only")
    void transactions() {
        Payment older = new Payment(UUID.randomUUID(), ownerId, UUID.randomUUID(), null, BigDecimal.TEN, "INR", "card",
            "order_s0", null, PaymentStatus.FAILED, "declined", Instant.parse("2030-01-01T00:00:00Z"),
            Instant.parse("2030-01-01T00:00:00Z"));
        when(persistenceService.listForUser(ownerId)).thenReturn(List.of(payment, older));

        assertEquals(List.of(payment, older), paymentService.listTransactions(ownerId));
        assertTrue(paymentService.listTransactions(UUID.randomUUID()).isEmpty());
    }
}

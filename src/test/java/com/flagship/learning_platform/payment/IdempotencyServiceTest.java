package com.flagship.learning_platform.payment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class IdempotencyServiceTest {

    private PaymentRepository paymentRepository;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        paymentRepository = mock(PaymentRepository.class);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock();
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        idempotencyService = new IdempotencyService(paymentRepository, Optional.of(redisTemplate));
    }

    private PaymentEntity storedPayment() {
        Payment payment = Payment.initiate(UUID.randomUUID(), UUID.randomUUID(), null,
            BigDecimal.ONE, "INR", "upi", "order_" + UUID.randomUUID());
        return PaymentEntity.fromDomain(payment, "key-1");
    }

    @Test
    @DisplayName("A Redis hit skips the database")
    void redisHit() {
        UUID paymentId = UUID.randomUUID();
        when(valueOps.get("idempotency:checkout:key-1")).thenReturn(paymentId.toString());

        assertEquals(Optional.of(paymentId), idempotencyService.checkIdempotencyKey("key-1"));
        verifyNoInteractions(paymentRepository);
    }

    @Test
    @DisplayName("A Redis miss falls back to the payments table and warms the cache")
    void redisMiss() {
        PaymentEntity entity = storedPayment();
        when(paymentRepository.findByIdempotencyKey("key-1")).thenReturn(Optional.of(entity));

        assertEquals(Optional.of(entity.getId()), idempotencyService.checkIdempotencyKey("key-1"));
        verify(valueOps).set(eq("idempotency:checkout:key-1"), eq(entity.getId().toString()), any(Duration.class));
    }

    @Test
    @DisplayName("Redis outages fall back to the database without failing")
    void redisDown() {
        PaymentEntity entity = storedPayment();
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
            .when(valueOps).set(anyString(), anyString(), any(Duration.class));
        when(paymentRepository.findByIdempotencyKey("key-1")).thenReturn(Optional.of(entity));

        assertEquals(Optional.of(entity.getId()), idempotencyService.checkIdempotencyKey("key-1"));
        assertDoesNotThrow(() -> idempotencyService.storeIdempotencyKey("key-2", UUID.randomUUID()));
    }

    @Test
    @DisplayName("Works without Redis at all")
    void noRedis() {
        IdempotencyService databaseOnly = new IdempotencyService(paymentRepository, Optional.empty());
        when(paymentRepository.findByIdempotencyKey("key-3")).thenReturn(Optional.empty());

        assertTrue(databaseOnly.checkIdempotencyKey("key-3").isEmpty());
    }

    @Test
    @DisplayName("Blank keys are rejected")
    void blankKey() {
        assertThrows(IllegalArgumentException.class, () -> idempotencyService.checkIdempotencyKey(" "));
        assertThrows(IllegalArgumentException.class, () -> idempotencyService.storeIdempotencyKey("k", null));
    }
}

package com.flagship.learning_platform.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps checkout Idempotency-Key headers to payment ids.
 *
 * Redis is the fast path; payments.idempotency_key is the source of truth and
 * is consulted whenever Redis misses or is unavailable. Redis errors are
 * logged and never fail a checkout.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String REDIS_KEY_PREFIX = "idempotency:checkout:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the payment id previously stored for this key
     * @throws IllegalArgumentException if the key is blank
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String paymentId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (paymentId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(paymentId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = paymentRepository.findByIdempotencyKey(idempotencyKey)
            .map(PaymentEntity::getId);
        stored.ifPresent(paymentId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, paymentId);
        });
        return stored;
    }

    /**
     * Caches the mapping in Redis. The database row written with the payment
     * already holds it.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID paymentId) {
        requireKey(idempotencyKey);
        if (paymentId == null) {
            throw new IllegalArgumentException("Payment ID cannot be null");
        }
        cache(idempotencyKey, paymentId);
    }

    private void cache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}

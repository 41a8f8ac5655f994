package com.flagship.learning_platform.observability;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.notification.DisabledNotificationClient;
import com.flagship.learning_platform.notification.NotificationClient;
import com.flagship.learning_platform.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the platform's supporting infrastructure.
 *
 * Redis and WhatsApp are optional: checkout idempotency falls back to the
 * payments table and notifications are dropped, so both report DEGRADED
 * rather than DOWN.
 */
public class HealthIndicators {

    private static final String DEGRADED = "DEGRADED";

    private HealthIndicators() {
    }

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long pending = outboxRepository.countUnpublished();

                Health.Builder builder;
                if (pending < BACKLOG_WARNING_THRESHOLD) {
                    builder = Health.up();
                } else if (pending < BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.down();
                }

                return builder
                        .withDetail("pendingEvents", pending)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    @Component("idempotencyCacheHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No Redis connection factory configured");
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String reply = connection.ping();
                if ("PONG".equals(reply)) {
                    return Health.up().withDetail("response", reply).build();
                }
                return degraded("Unexpected ping reply: " + reply);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String error) {
            return Health.status(DEGRADED)
                    .withDetail("error", error)
                    .withDetail("fallback", "checkout idempotency keys are resolved from the payments table")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka producer metrics available")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .withDetail("topic", "learning-events")
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    @Component("whatsappHealth")
    public static class NotificationHealthIndicator implements HealthIndicator {

        private final NotificationClient notificationClient;
        private final LearningProperties properties;

        public NotificationHealthIndicator(NotificationClient notificationClient, LearningProperties properties) {
            this.notificationClient = notificationClient;
            this.properties = properties;
        }

        @Override
        public Health health() {
            if (notificationClient instanceof DisabledNotificationClient) {
                return Health.status(DEGRADED)
                        .withDetail("provider", "disabled")
                        .withDetail("reason", "Twilio credentials not configured")
                        .build();
            }
            return Health.up()
                    .withDetail("provider", "twilio")
                    .withDetail("from", properties.getNotification().getTwilio().getFromNumber())
                    .build();
        }
    }
}

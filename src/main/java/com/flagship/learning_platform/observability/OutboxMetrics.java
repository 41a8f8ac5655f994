package com.flagship.learning_platform.observability;

import com.flagship.learning_platform.consumer.LearningEventConsumer;
import com.flagship.learning_platform.consumer.ProcessedEvent;
import com.flagship.learning_platform.consumer.ProcessedEventRepository;
import com.flagship.learning_platform.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over the learning-events outbox and the notification consumer's
 * ledger of processed events.
 *
 * Values are cached and refreshed by {@link MetricsScheduler}, so a Prometheus
 * scrape never reaches the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final ProcessedEventRepository processedEventRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pendingEvents = new AtomicLong(0);
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredEvents = new AtomicLong(0);
    private final AtomicLong failedDeliveries = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("learning.outbox.pending", pendingEvents, AtomicLong::get)
                .description("Learning events written but not yet published to Kafka")
                .register(meterRegistry);

        Gauge.builder("learning.outbox.oldest.pending.seconds", oldestPendingAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished learning event")
                .register(meterRegistry);

        Gauge.builder("learning.outbox.dead_lettered", deadLetteredEvents, AtomicLong::get)
                .description("Learning events that used up their publish retries")
                .register(meterRegistry);

        Gauge.builder("learning.consumer.failed", failedDeliveries, AtomicLong::get)
                .description("Consumed learning events whose handler failed")
                .tag("consumer_group", LearningEventConsumer.CONSUMER_GROUP)
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long pending = outboxRepository.countUnpublished();
            pendingEvents.set(pending);

            long oldestAge = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L);
            oldestPendingAgeSeconds.set(oldestAge);

            deadLetteredEvents.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));
            failedDeliveries.set(processedEventRepository.countByConsumerGroupAndProcessingResult(
                    LearningEventConsumer.CONSUMER_GROUP, ProcessedEvent.ProcessingResult.FAILED));

            log.debug("Outbox gauges refreshed: pending={}, oldestAge={}s, deadLettered={}, failedDeliveries={}",
                    pending, oldestAge, deadLetteredEvents.get(), failedDeliveries.get());
        } catch (Exception e) {
            log.warn("Could not refresh outbox gauges: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("learning.outbox.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("learning.outbox.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("learning.outbox.dead_lettered.skipped",
                "event_type", eventType
        ).increment();
    }
}

package com.flagship.learning_platform.consumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Runs an event handler at most once per (event, consumer group).
 *
 * The event is claimed first, by inserting its processed_events row in a
 * short transaction of its own. The handler then runs with no transaction
 * open, so a slow messaging provider never holds a database connection. If
 * the handler throws, the row is flipped to FAILED and the exception is
 * re-thrown so Kafka redelivers; the redelivery finds the row and skips.
 * Handlers that must not lose work are expected to be idempotent themselves
 * and never throw.
 *
 * <pre>
 * eventProcessor.processEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
 *     () -> notificationService.sendCertificate(...));
 * </pre>
 */
@Service
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final TransactionTemplate transactionTemplate;

    public IdempotentEventProcessor(ProcessedEventRepository repository,
                                    PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @return true if the handler ran, false if the event had been seen before
     */
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (!claim(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup))) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage(), e);
            transactionTemplate.executeWithoutResult(status ->
                repository.findById(eventId).ifPresent(entity -> {
                    entity.markFailed(e.getMessage());
                    repository.save(entity);
                }));
            throw e;
        }
    }

    /**
     * Records an event this consumer does not handle, so replays skip it cheaply.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private boolean claim(ProcessedEvent event) {
        try {
            Boolean claimed = transactionTemplate.execute(status -> {
                if (repository.existsById(event.getEventId())) {
                    return false;
                }
                repository.saveAndFlush(ProcessedEventEntity.fromDomain(event));
                return true;
            });
            return Boolean.TRUE.equals(claimed);
        } catch (DataIntegrityViolationException e) {
            log.debug("Event {} claimed concurrently by another consumer", event.getEventId());
            return false;
        }
    }
}

package com.flagship.learning_platform.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    List<ProcessedEventEntity> findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(
        String aggregateType, UUID aggregateId);

    long countByConsumerGroup(String consumerGroup);

    long countByConsumerGroupAndProcessingResult(String consumerGroup, ProcessedEvent.ProcessingResult result);
}

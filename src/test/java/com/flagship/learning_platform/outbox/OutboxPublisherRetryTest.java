package com.flagship.learning_platform.outbox;

import com.flagship.learning_platform.observability.OutboxMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OutboxPublisherRetryTest {

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock();
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "learningEventsTopic", "learning-events");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private OutboxEvent pending(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Enrollment", UUID.randomUUID(), "EnrollmentCreated",
            "{}", Instant.now(), null, retryCount, null, 1L);
    }

    @Test
    @DisplayName("A broker failure bumps the retry counter")
    void sendFailure() {
        OutboxEvent event = pending(0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), contains("broker unavailable"));
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("EnrollmentCreated");
    }

    @Test
    @DisplayName("Events past the retry limit are left as dead letters")
    void deadLetter() {
        OutboxEvent event = pending(3);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));

        publisher.publishPendingEvents();

        verifyNoInteractions(kafkaTemplate);
        verify(outboxMetrics).recordEventDeadLettered("EnrollmentCreated");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("A failing poll does not escape the scheduler")
    void pollFailure() {
        when(outboxService.findUnpublishedEvents(100)).thenThrow(new IllegalStateException("database down"));

        publisher.publishPendingEvents();

        verifyNoInteractions(kafkaTemplate, outboxMetrics);
    }
}

package com.flagship.learning_platform.enrollment.event;

import com.flagship.learning_platform.enrollment.Enrollment;
import com.flagship.learning_platform.outbox.LearningEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per enrollment, on the first transition to completed.
 */
@Value
public class CourseCompletedEvent implements LearningEvent {
    UUID eventId;
    UUID enrollmentId;
    UUID userId;
    UUID courseId;
    Instant completedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CourseCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return EnrollmentCreatedEvent.AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return enrollmentId;
    }

    public static CourseCompletedEvent of(Enrollment enrollment) {
        return new CourseCompletedEvent(
            UUID.randomUUID(),
            enrollment.getId(),
            enrollment.getUserId(),
            enrollment.getCourseId(),
            enrollment.getCompletedAt(),
            Instant.now()
        );
    }
}

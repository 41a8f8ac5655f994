package com.flagship.learning_platform.enrollment.event;

import com.flagship.learning_platform.catalog.Course;
import com.flagship.learning_platform.enrollment.Enrollment;
import com.flagship.learning_platform.outbox.LearningEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a user gains access to a course, either directly or through a completed payment.
 */
@Value
public class EnrollmentCreatedEvent implements LearningEvent {
    UUID eventId;
    UUID enrollmentId;
    UUID userId;
    UUID courseId;
    String courseTitle;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EnrollmentCreated";
    public static final String AGGREGATE_TYPE = "Enrollment";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return enrollmentId;
    }

    public static EnrollmentCreatedEvent of(Enrollment enrollment, Course course) {
        return new EnrollmentCreatedEvent(
            UUID.randomUUID(),
            enrollment.getId(),
            enrollment.getUserId(),
            course.getId(),
            course.getTitle(),
            Instant.now()
        );
    }
}

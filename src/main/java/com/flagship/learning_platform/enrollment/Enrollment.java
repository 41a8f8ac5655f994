package com.flagship.learning_platform.enrollment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's access record for one course.
 *
 * {@code progress} is the share of the course's lectures completed under this
 * enrollment, 0 to 100 with two decimals. Once {@code completed} is set it is
 * never cleared and {@code completedAt} keeps its first value.
 */
@Value
public class Enrollment {
    UUID id;
    UUID userId;
    UUID courseId;
    BigDecimal progress;
    boolean completed;
    Instant completedAt;
    Instant enrolledAt;
    Instant updatedAt;

    public boolean belongsTo(UUID candidateUserId) {
        return userId.equals(candidateUserId);
    }
}

package com.flagship.learning_platform.progress;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of a lecture progress upsert: the row touched and the enrollment
 * aggregate right after the recompute.
 */
@Value
public class ProgressUpdate {
    UUID lectureProgressId;
    BigDecimal overallProgress;
    boolean courseCompleted;
}

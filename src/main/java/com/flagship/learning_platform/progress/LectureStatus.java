package com.flagship.learning_platform.progress;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One lecture of a course as seen by one enrollment. Lectures without a
 * progress row read as not completed, zero seconds watched.
 */
@Value
public class LectureStatus {
    UUID lectureId;
    String title;
    int duration;
    int order;
    boolean completed;
    int watchedDuration;
    Instant completedAt;
}

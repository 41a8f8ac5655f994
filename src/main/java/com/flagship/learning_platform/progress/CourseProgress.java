package com.flagship.learning_platform.progress;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class CourseProgress {
    UUID courseId;
    UUID enrollmentId;
    BigDecimal progress;
    boolean completed;
    Instant completedAt;
    List<LectureStatus> lectures;

    public int getTotalLectures() {
        return lectures.size();
    }

    public long getCompletedLectures() {
        return lectures.stream().filter(LectureStatus::isCompleted).count();
    }
}

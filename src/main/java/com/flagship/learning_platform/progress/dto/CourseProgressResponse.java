package com.flagship.learning_platform.progress.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.progress.CourseProgress;
import com.flagship.learning_platform.progress.LectureStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CourseProgressResponse {

    @JsonProperty("course_id")
    UUID courseId;

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("progress")
    BigDecimal progress;

    @JsonProperty("completed")
    boolean completed;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("total_lectures")
    int totalLectures;

    @JsonProperty("completed_lectures")
    long completedLectures;

    @JsonProperty("lectures")
    List<LectureItem> lectures;

    @Value
    @Builder
    public static class LectureItem {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("title")
        String title;

        @JsonProperty("duration")
        int duration;

        @JsonProperty("order")
        int order;

        @JsonProperty("completed")
        boolean completed;

        @JsonProperty("watched_duration")
        int watchedDuration;

        @JsonProperty("completed_at")
        Instant completedAt;

        static LectureItem from(LectureStatus status) {
            return LectureItem.builder()
                .id(status.getLectureId())
                .title(status.getTitle())
                .duration(status.getDuration())
                .order(status.getOrder())
                .completed(status.isCompleted())
                .watchedDuration(status.getWatchedDuration())
                .completedAt(status.getCompletedAt())
                .build();
        }
    }

    public static CourseProgressResponse from(CourseProgress progress) {
        return CourseProgressResponse.builder()
            .courseId(progress.getCourseId())
            .enrollmentId(progress.getEnrollmentId())
            .progress(progress.getProgress())
            .completed(progress.isCompleted())
            .completedAt(progress.getCompletedAt())
            .totalLectures(progress.getTotalLectures())
            .completedLectures(progress.getCompletedLectures())
            .lectures(progress.getLectures().stream().map(LectureItem::from).toList())
            .build();
    }
}

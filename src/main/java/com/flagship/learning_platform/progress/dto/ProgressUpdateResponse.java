package com.flagship.learning_platform.progress.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.progress.ProgressUpdate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ProgressUpdateResponse {

    @JsonProperty("message")
    String message;

    @JsonProperty("lecture_progress_id")
    UUID lectureProgressId;

    @JsonProperty("overall_progress")
    BigDecimal overallProgress;

    @JsonProperty("course_completed")
    boolean courseCompleted;

    public static ProgressUpdateResponse from(ProgressUpdate update) {
        return ProgressUpdateResponse.builder()
            .message("Progress updated successfully")
            .lectureProgressId(update.getLectureProgressId())
            .overallProgress(update.getOverallProgress())
            .courseCompleted(update.isCourseCompleted())
            .build();
    }
}

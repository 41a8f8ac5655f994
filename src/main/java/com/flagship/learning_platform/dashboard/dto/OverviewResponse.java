package com.flagship.learning_platform.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.dashboard.DashboardOverview;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class OverviewResponse {

    @JsonProperty("total_courses")
    int totalCourses;

    @JsonProperty("completed_courses")
    int completedCourses;

    @JsonProperty("in_progress_courses")
    int inProgressCourses;

    @JsonProperty("upcoming_events")
    long upcomingEvents;

    @JsonProperty("certificates_earned")
    long certificatesEarned;

    @JsonProperty("average_progress")
    BigDecimal averageProgress;

    @JsonProperty("badges")
    List<String> badges;

    public static OverviewResponse from(DashboardOverview overview) {
        return OverviewResponse.builder()
            .totalCourses(overview.getTotalCourses())
            .completedCourses(overview.getCompletedCourses())
            .inProgressCourses(overview.getInProgressCourses())
            .upcomingEvents(overview.getRegisteredEvents())
            .certificatesEarned(overview.getCertificatesEarned())
            .averageProgress(overview.getAverageProgress())
            .badges(overview.getBadges())
            .build();
    }
}

package com.flagship.learning_platform.dashboard;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class DashboardOverview {
    int totalCourses;
    int completedCourses;
    int inProgressCourses;
    long registeredEvents;
    long certificatesEarned;
    BigDecimal averageProgress;
    List<String> badges;
}

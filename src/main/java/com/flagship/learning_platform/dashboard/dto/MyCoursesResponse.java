package com.flagship.learning_platform.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.dashboard.EnrolledCourse;
import com.flagship.learning_platform.enrollment.Enrollment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class MyCoursesResponse {

    @JsonProperty("data")
    List<Item> data;

    @JsonProperty("total")
    int total;

    public static MyCoursesResponse from(List<EnrolledCourse> courses) {
        List<Item> items = courses.stream().map(Item::from).toList();
        return new MyCoursesResponse(items, items.size());
    }

    @Value
    public static class Item {

        @JsonProperty("enrollment_id")
        UUID enrollmentId;

        @JsonProperty("course_id")
        UUID courseId;

        @JsonProperty("title")
        String title;

        @JsonProperty("progress")
        BigDecimal progress;

        @JsonProperty("completed")
        boolean completed;

        @JsonProperty("enrolled_at")
        Instant enrolledAt;

        static Item from(EnrolledCourse course) {
            Enrollment enrollment = course.getEnrollment();
            return new Item(
                enrollment.getId(),
                enrollment.getCourseId(),
                course.getCourseTitle(),
                enrollment.getProgress(),
                enrollment.isCompleted(),
                enrollment.getEnrolledAt()
            );
        }
    }
}

package com.flagship.learning_platform.dashboard;

import com.flagship.learning_platform.enrollment.Enrollment;
import lombok.Value;

/**
 * An enrollment with the course title resolved, for the "my courses" list.
 */
@Value
public class EnrolledCourse {
    Enrollment enrollment;
    String courseTitle;
}

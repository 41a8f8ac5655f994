package com.flagship.learning_platform.enrollment;

import lombok.Value;

/**
 * Outcome of an idempotent enrollment create: the row, and whether this call inserted it.
 */
@Value
public class EnrollmentResult {
    Enrollment enrollment;
    boolean created;

    static EnrollmentResult created(Enrollment enrollment) {
        return new EnrollmentResult(enrollment, true);
    }

    static EnrollmentResult existing(Enrollment enrollment) {
        return new EnrollmentResult(enrollment, false);
    }
}

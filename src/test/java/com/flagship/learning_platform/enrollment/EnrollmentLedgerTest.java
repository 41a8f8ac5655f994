package com.flagship.learning_platform.enrollment;

import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EnrollmentLedgerTest extends IntegrationTestSupport {

    @Autowired
    private EnrollmentLedger enrollmentLedger;

    private UUID learnerId;
    private UUID courseId;

    @BeforeEach
    void setUp() {
        learnerId = createUser("Meera", "+919800000002");
        courseId = createCourse("Kafka in Practice", new BigDecimal("999.00"));
    }

    private int studentsCount() {
        return countRows("SELECT students_count FROM courses WHERE id = ?", courseId);
    }

    @Test
    @DisplayName("New enrollment starts at zero, bumps the student counter and writes EnrollmentCreated")
    void createEnrollment() {
        Enrollment enrollment = enrollmentLedger.create(learnerId, courseId);

        assertEquals(0, BigDecimal.ZERO.compareTo(enrollment.getProgress()));
        assertFalse(enrollment.isCompleted());
        assertNull(enrollment.getCompletedAt());
        assertEquals(1, studentsCount());
        assertEquals(1, countRows(
            "SELECT COUNT(*) FROM outbox_events WHERE event_type = 'EnrollmentCreated' AND aggregate_id = ?",
            enrollment.getId()));
    }

    @Test
    @DisplayName("Enrolling twice is a conflict and leaves the counter alone")
    void duplicateEnrollment() {
        enrollmentLedger.create(learnerId, courseId);

        assertThrows(ConflictException.class, () -> enrollmentLedger.create(learnerId, courseId));
        assertEquals(1, studentsCount());
        assertEquals(1, countRows("SELECT COUNT(*) FROM enrollments WHERE user_id = ?", learnerId));
    }

    @Test
    @DisplayName("createIfAbsent returns the existing enrollment without side effects")
    void createIfAbsentIsIdempotent() {
        EnrollmentResult first = enrollmentLedger.createIfAbsent(learnerId, courseId);
        EnrollmentResult second = enrollmentLedger.createIfAbsent(learnerId, courseId);

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals(first.getEnrollment().getId(), second.getEnrollment().getId());
        assertEquals(1, studentsCount());
        assertEquals(1, countRows("SELECT COUNT(*) FROM outbox_events WHERE event_type = 'EnrollmentCreated'"));
    }

    @Test
    @DisplayName("Unknown course is not found")
    void unknownCourse() {
        assertThrows(NotFoundException.class, () -> enrollmentLedger.create(learnerId, UUID.randomUUID()));
    }

    @Test
    @DisplayName("A course without lectures recomputes to zero and stays incomplete")
    void emptyCourseRecompute() {
        Enrollment enrollment = enrollmentLedger.create(learnerId, courseId);

        Enrollment recomputed = enrollmentLedger.recompute(enrollment.getId());

        assertEquals(0, BigDecimal.ZERO.compareTo(recomputed.getProgress()));
        assertFalse(recomputed.isCompleted());
    }
}

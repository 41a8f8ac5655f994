package com.flagship.learning_platform.enrollment;

import com.flagship.learning_platform.catalog.CatalogService;
import com.flagship.learning_platform.catalog.Course;
import com.flagship.learning_platform.enrollment.event.CourseCompletedEvent;
import com.flagship.learning_platform.enrollment.event.EnrollmentCreatedEvent;
import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.observability.LearningMetrics;
import com.flagship.learning_platform.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns enrollment rows: creation, the aggregate progress figure and completion.
 *
 * Invariants held here, backed by the schema:
 * - at most one enrollment per (user, course), via uq_enrollments_user_course
 * - progress = completed lectures / lectures of the course * 100, 0 for an empty course
 * - completed becomes true when every lecture is completed and never reverts;
 *   completed_at is stamped once on that transition
 *
 * Writes go through single SQL statements (INSERT ... ON CONFLICT, UPDATE with
 * correlated counts) so concurrent requests race safely in the database rather
 * than in application code.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentLedger {

    private static final String INSERT_IF_ABSENT_SQL =
        "INSERT INTO enrollments (id, user_id, course_id, progress, completed, enrolled_at, updated_at) " +
        "VALUES (?, ?, ?, 0, FALSE, now(), now()) " +
        "ON CONFLICT (user_id, course_id) DO NOTHING " +
        "RETURNING " + EnrollmentRowMapper.COLUMNS;

    private static final String RECOMPUTE_SQL = """
        WITH counts AS (
            SELECT
                (SELECT COUNT(*) FROM course_lectures l
                  WHERE l.course_id = en.course_id) AS total,
                (SELECT COUNT(*) FROM lecture_progress lp
                   JOIN course_lectures l ON l.id = lp.lecture_id
                  WHERE lp.enrollment_id = en.id
                    AND lp.completed
                    AND l.course_id = en.course_id) AS done
            FROM enrollments en
            WHERE en.id = ?
        )
        UPDATE enrollments e SET
            progress = CASE WHEN c.total = 0 THEN 0
                            ELSE ROUND(c.done * 100.0 / c.total, 2) END,
            completed = e.completed OR (c.total > 0 AND c.done = c.total),
            completed_at = CASE WHEN e.completed THEN e.completed_at
                                WHEN c.total > 0 AND c.done = c.total THEN now()
                                ELSE NULL END,
            updated_at = now()
        FROM counts c
        WHERE e.id = ?
        RETURNING e.id, e.user_id, e.course_id, e.progress, e.completed,
                  e.completed_at, e.enrolled_at, e.updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final CatalogService catalogService;
    private final OutboxService outboxService;
    private final LearningMetrics metrics;

    /**
     * Enrolls a user in a course.
     *
     * @throws NotFoundException if the course does not exist
     * @throws ConflictException if the user is already enrolled
     */
    @Transactional
    public Enrollment create(UUID userId, UUID courseId) {
        Course course = catalogService.getCourse(courseId);

        Enrollment enrollment = insertIfAbsent(userId, courseId)
            .orElseThrow(() -> new ConflictException("Already enrolled in course " + courseId));

        onCreated(enrollment, course, "direct");
        return enrollment;
    }

    /**
     * Idempotent enrollment used when a payment completes. An existing row,
     * including one inserted concurrently by another request, is returned as is
     * without touching the course's student counter.
     *
     * @throws NotFoundException if the course does not exist
     */
    @Transactional
    public EnrollmentResult createIfAbsent(UUID userId, UUID courseId) {
        Course course = catalogService.getCourse(courseId);

        Optional<Enrollment> inserted = insertIfAbsent(userId, courseId);
        if (inserted.isPresent()) {
            onCreated(inserted.get(), course, "payment");
            return EnrollmentResult.created(inserted.get());
        }

        Enrollment existing = find(userId, courseId)
            .orElseThrow(() -> new IllegalStateException(
                "Enrollment conflict reported but no row found for user " + userId + ", course " + courseId));
        log.info("User {} already enrolled in course {}, enrollment {}", userId, courseId, existing.getId());
        return EnrollmentResult.existing(existing);
    }

    /**
     * Recomputes progress and completion from the lecture progress rows in one
     * statement. The enrollment row stays locked until the caller's transaction
     * ends, so concurrent updates on other lectures of the same enrollment
     * apply one after another.
     */
    @Transactional
    public Enrollment recompute(UUID enrollmentId) {
        Enrollment before = lock(enrollmentId)
            .orElseThrow(() -> NotFoundException.of("Enrollment", enrollmentId));

        Enrollment after = jdbcTemplate.queryForObject(
            RECOMPUTE_SQL, EnrollmentRowMapper.INSTANCE, enrollmentId, enrollmentId);

        if (!before.isCompleted() && after.isCompleted()) {
            outboxService.saveEvent(CourseCompletedEvent.of(after));
            metrics.recordCourseCompleted();
            log.info("Enrollment {} completed course {}", after.getId(), after.getCourseId());
        }

        log.debug("Recomputed enrollment {}: progress={}, completed={}",
                after.getId(), after.getProgress(), after.isCompleted());
        return after;
    }

    /**
     * Takes the row lock for an enrollment. Must run inside a transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Enrollment> lock(UUID enrollmentId) {
        return jdbcTemplate.query(
            "SELECT " + EnrollmentRowMapper.COLUMNS + " FROM enrollments WHERE id = ? FOR UPDATE",
            EnrollmentRowMapper.INSTANCE,
            enrollmentId
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Enrollment> find(UUID userId, UUID courseId) {
        return jdbcTemplate.query(
            "SELECT " + EnrollmentRowMapper.COLUMNS + " FROM enrollments WHERE user_id = ? AND course_id = ?",
            EnrollmentRowMapper.INSTANCE,
            userId,
            courseId
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<Enrollment> findById(UUID enrollmentId) {
        return jdbcTemplate.query(
            "SELECT " + EnrollmentRowMapper.COLUMNS + " FROM enrollments WHERE id = ?",
            EnrollmentRowMapper.INSTANCE,
            enrollmentId
        ).stream().findFirst();
    }

    /**
     * All enrollments of a user, most recent first.
     */
    @Transactional(readOnly = true)
    public List<Enrollment> listForUser(UUID userId) {
        return jdbcTemplate.query(
            "SELECT " + EnrollmentRowMapper.COLUMNS + " FROM enrollments WHERE user_id = ? ORDER BY enrolled_at DESC",
            EnrollmentRowMapper.INSTANCE,
            userId
        );
    }

    private Optional<Enrollment> insertIfAbsent(UUID userId, UUID courseId) {
        return jdbcTemplate.query(
            INSERT_IF_ABSENT_SQL,
            EnrollmentRowMapper.INSTANCE,
            UUID.randomUUID(),
            userId,
            courseId
        ).stream().findFirst();
    }

    private void onCreated(Enrollment enrollment, Course course, String source) {
        jdbcTemplate.update(
            "UPDATE courses SET students_count = students_count + 1 WHERE id = ?",
            course.getId()
        );
        outboxService.saveEvent(EnrollmentCreatedEvent.of(enrollment, course));
        metrics.recordEnrollmentCreated(source);
        log.info("Enrolled user {} in course {} ({}), enrollment {}",
                enrollment.getUserId(), course.getId(), source, enrollment.getId());
    }
}

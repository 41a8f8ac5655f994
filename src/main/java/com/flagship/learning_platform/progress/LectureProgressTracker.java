package com.flagship.learning_platform.progress;

import com.flagship.learning_platform.catalog.CatalogService;
import com.flagship.learning_platform.catalog.Lecture;
import com.flagship.learning_platform.enrollment.Enrollment;
import com.flagship.learning_platform.enrollment.EnrollmentLedger;
import com.flagship.learning_platform.exception.ForbiddenException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.observability.CorrelationContext;
import com.flagship.learning_platform.observability.LearningMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.RoundingMode;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.UUID;

/**
 * Per-lecture watch state within an enrollment.
 *
 * An upsert and the enrollment recompute it triggers run in one transaction
 * that holds the enrollment row lock, so two lectures of the same enrollment
 * reported at once cannot leave a stale aggregate behind.
 *
 * completed_at on a lecture row is written once, on the first transition to
 * completed, and survives a later completed=false update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LectureProgressTracker {

    private static final String UPSERT_SQL = """
        INSERT INTO lecture_progress
            (id, enrollment_id, lecture_id, watched_duration, completed, completed_at, created_at, updated_at)
        VALUES (?, ?, ?,
                COALESCE(CAST(? AS INTEGER), 0),
                COALESCE(CAST(? AS BOOLEAN), FALSE),
                CASE WHEN COALESCE(CAST(? AS BOOLEAN), FALSE) THEN now() END,
                now(), now())
        ON CONFLICT (enrollment_id, lecture_id) DO UPDATE SET
            watched_duration = COALESCE(CAST(? AS INTEGER), lecture_progress.watched_duration),
            completed = COALESCE(CAST(? AS BOOLEAN), lecture_progress.completed),
            completed_at = COALESCE(lecture_progress.completed_at,
                                    CASE WHEN COALESCE(CAST(? AS BOOLEAN), lecture_progress.completed)
                                         THEN now() END),
            updated_at = now()
        RETURNING id
        """;

    private static final String COURSE_PROGRESS_SQL = """
        SELECT l.id, l.title, l.duration, l.lecture_order,
               COALESCE(lp.completed, FALSE) AS completed,
               COALESCE(lp.watched_duration, 0) AS watched_duration,
               lp.completed_at
        FROM course_lectures l
        LEFT JOIN lecture_progress lp
               ON lp.lecture_id = l.id AND lp.enrollment_id = ?
        WHERE l.course_id = ?
        ORDER BY l.lecture_order ASC, l.id ASC
        """;

    private static final RowMapper<LectureStatus> LECTURE_STATUS_MAPPER = (rs, rowNum) -> {
        Timestamp completedAt = rs.getTimestamp("completed_at");
        return new LectureStatus(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getInt("duration"),
            rs.getInt("lecture_order"),
            rs.getBoolean("completed"),
            rs.getInt("watched_duration"),
            completedAt != null ? completedAt.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;
    private final CatalogService catalogService;
    private final EnrollmentLedger enrollmentLedger;
    private final LearningMetrics metrics;

    /**
     * Records watch state for one lecture and recomputes the enrollment.
     *
     * @param callerId the authenticated user
     * @param lectureId lecture being reported
     * @param change fields to write; a null field keeps its stored value
     * @return the progress row id with the enrollment's new aggregate
     * @throws IllegalArgumentException if the change carries nothing or a negative duration
     * @throws NotFoundException if the lecture does not exist
     * @throws ForbiddenException if the caller is not enrolled in the lecture's course
     */
    @Transactional
    public ProgressUpdate upsertProgress(UUID callerId, UUID lectureId, ProgressChange change) {
        long startTime = System.currentTimeMillis();
        change.validate();

        Lecture lecture = catalogService.findLecture(lectureId)
            .orElseThrow(() -> NotFoundException.of("Lecture", lectureId));

        Enrollment enrollment = enrollmentLedger.find(callerId, lecture.getCourseId())
            .orElseThrow(() -> new ForbiddenException("Not enrolled in course " + lecture.getCourseId()));

        Enrollment locked = enrollmentLedger.lock(enrollment.getId())
            .orElseThrow(() -> NotFoundException.of("Enrollment", enrollment.getId()));
        if (!locked.belongsTo(callerId)) {
            throw new ForbiddenException("Enrollment " + locked.getId() + " belongs to another user");
        }

        MDC.put(CorrelationContext.ENROLLMENT_ID_MDC_KEY, locked.getId().toString());
        try {
            SqlParameterValue watched = new SqlParameterValue(Types.INTEGER, change.getWatchedDuration());
            SqlParameterValue completed = new SqlParameterValue(Types.BOOLEAN, change.getCompleted());

            UUID lectureProgressId = jdbcTemplate.queryForObject(
                UPSERT_SQL,
                UUID.class,
                UUID.randomUUID(), locked.getId(), lectureId,
                watched, completed, completed,
                watched, completed, completed
            );

            Enrollment recomputed = enrollmentLedger.recompute(locked.getId());

            metrics.recordProgressUpdate(Boolean.TRUE.equals(change.getCompleted()));
            metrics.recordLatency("progress_upsert", System.currentTimeMillis() - startTime);
            log.info("Lecture {} progress updated: watched={}, completed={}, overall={}, courseCompleted={}",
                    lectureId, change.getWatchedDuration(), change.getCompleted(),
                    recomputed.getProgress(), recomputed.isCompleted());

            return new ProgressUpdate(
                lectureProgressId,
                recomputed.getProgress().setScale(2, RoundingMode.HALF_UP),
                recomputed.isCompleted()
            );
        } finally {
            MDC.remove(CorrelationContext.ENROLLMENT_ID_MDC_KEY);
        }
    }

    /**
     * Every lecture of the course in display order with this caller's state.
     *
     * @throws NotFoundException if the caller is not enrolled in the course
     */
    @Transactional(readOnly = true)
    public CourseProgress getProgress(UUID callerId, UUID courseId) {
        Enrollment enrollment = enrollmentLedger.find(callerId, courseId)
            .orElseThrow(() -> new NotFoundException("Not enrolled in course " + courseId));

        List<LectureStatus> lectures = jdbcTemplate.query(
            COURSE_PROGRESS_SQL, LECTURE_STATUS_MAPPER, enrollment.getId(), courseId);

        return new CourseProgress(
            courseId,
            enrollment.getId(),
            enrollment.getProgress().setScale(2, RoundingMode.HALF_UP),
            enrollment.isCompleted(),
            enrollment.getCompletedAt(),
            lectures
        );
    }
}

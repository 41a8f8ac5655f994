package com.flagship.learning_platform.catalog;

import com.flagship.learning_platform.exception.NotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to users, courses and lectures.
 *
 * The catalog tables are owned by the content side of the platform; this
 * service only reads them, apart from the {@code students_count} counter the
 * enrollment ledger maintains.
 */
@Service
@Transactional(readOnly = true)
public class CatalogService {

    private static final RowMapper<Course> COURSE_MAPPER = (rs, rowNum) -> new Course(
        rs.getObject("id", UUID.class),
        rs.getString("title"),
        rs.getBigDecimal("price"),
        rs.getInt("students_count")
    );

    private static final RowMapper<Lecture> LECTURE_MAPPER = (rs, rowNum) -> new Lecture(
        rs.getObject("id", UUID.class),
        rs.getObject("course_id", UUID.class),
        rs.getString("title"),
        rs.getInt("duration"),
        rs.getInt("lecture_order")
    );

    private static final RowMapper<LearnerProfile> LEARNER_MAPPER = (rs, rowNum) -> new LearnerProfile(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("role")
    );

    private final JdbcTemplate jdbcTemplate;

    public CatalogService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Course> findCourse(UUID courseId) {
        return jdbcTemplate.query(
            "SELECT id, title, price, students_count FROM courses WHERE id = ?",
            COURSE_MAPPER,
            courseId
        ).stream().findFirst();
    }

    /**
     * @throws NotFoundException if the course does not exist
     */
    public Course getCourse(UUID courseId) {
        return findCourse(courseId).orElseThrow(() -> NotFoundException.of("Course", courseId));
    }

    public Optional<Lecture> findLecture(UUID lectureId) {
        return jdbcTemplate.query(
            "SELECT id, course_id, title, duration, lecture_order FROM course_lectures WHERE id = ?",
            LECTURE_MAPPER,
            lectureId
        ).stream().findFirst();
    }

    /**
     * Lectures of a course in display order.
     */
    public List<Lecture> lecturesOf(UUID courseId) {
        return jdbcTemplate.query(
            "SELECT id, course_id, title, duration, lecture_order FROM course_lectures " +
            "WHERE course_id = ? ORDER BY lecture_order ASC, id ASC",
            LECTURE_MAPPER,
            courseId
        );
    }

    public Optional<LearnerProfile> findLearner(UUID userId) {
        return jdbcTemplate.query(
            "SELECT id, name, email, phone, role FROM users WHERE id = ?",
            LEARNER_MAPPER,
            userId
        ).stream().findFirst();
    }
}

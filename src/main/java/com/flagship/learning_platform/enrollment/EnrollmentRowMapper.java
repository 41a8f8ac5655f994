package com.flagship.learning_platform.enrollment;

import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

class EnrollmentRowMapper implements RowMapper<Enrollment> {

    static final String COLUMNS =
        "id, user_id, course_id, progress, completed, completed_at, enrolled_at, updated_at";

    static final EnrollmentRowMapper INSTANCE = new EnrollmentRowMapper();

    @Override
    public Enrollment mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Enrollment(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getObject("course_id", UUID.class),
            rs.getBigDecimal("progress"),
            rs.getBoolean("completed"),
            toInstant(rs.getTimestamp("completed_at")),
            toInstant(rs.getTimestamp("enrolled_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}

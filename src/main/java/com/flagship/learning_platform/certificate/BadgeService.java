package com.flagship.learning_platform.certificate;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.observability.LearningMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Achievement badges. A badge name is awarded to a user at most once
 * (uq_user_badges_user_name).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadgeService {

    private static final RowMapper<UserBadge> BADGE_MAPPER = (rs, rowNum) -> {
        Timestamp awardedAt = rs.getTimestamp("awarded_at");
        return new UserBadge(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getString("badge_name"),
            rs.getString("badge_description"),
            rs.getString("badge_icon"),
            awardedAt != null ? awardedAt.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;
    private final LearningProperties properties;
    private final LearningMetrics metrics;

    /**
     * Awards the configured first-course badge. Runs inside the certificate
     * issue transaction.
     *
     * @return true if the badge was inserted by this call
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean awardFirstCourseBadge(UUID userId) {
        LearningProperties.Badge badge = properties.getCertificate().getFirstBadge();
        int inserted = jdbcTemplate.update(
            "INSERT INTO user_badges (id, user_id, badge_name, badge_description, badge_icon, awarded_at) " +
            "VALUES (?, ?, ?, ?, ?, now()) " +
            "ON CONFLICT (user_id, badge_name) DO NOTHING",
            UUID.randomUUID(),
            userId,
            badge.getName(),
            badge.getDescription(),
            badge.getIcon()
        );

        if (inserted == 1) {
            metrics.recordBadgeAwarded(badge.getName());
            log.info("Awarded badge '{}' to user {}", badge.getName(), userId);
            return true;
        }
        return false;
    }

    @Transactional(readOnly = true)
    public List<UserBadge> listForUser(UUID userId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, badge_name, badge_description, badge_icon, awarded_at " +
            "FROM user_badges WHERE user_id = ? ORDER BY awarded_at ASC",
            BADGE_MAPPER,
            userId
        );
    }
}

package com.flagship.learning_platform.dashboard;

import com.flagship.learning_platform.catalog.CatalogService;
import com.flagship.learning_platform.catalog.Course;
import com.flagship.learning_platform.certificate.BadgeService;
import com.flagship.learning_platform.certificate.CertificateIssuer;
import com.flagship.learning_platform.certificate.UserBadge;
import com.flagship.learning_platform.enrollment.Enrollment;
import com.flagship.learning_platform.enrollment.EnrollmentLedger;
import com.flagship.learning_platform.event.EventRegistrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.UUID;

/**
 * Read-only summaries of a learner's activity. Every figure is derived from
 * the owning component, nothing is cached here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DashboardService {

    private final EnrollmentLedger enrollmentLedger;
    private final EventRegistrationService registrationService;
    private final CertificateIssuer certificateIssuer;
    private final BadgeService badgeService;
    private final CatalogService catalogService;

    @Transactional(readOnly = true)
    public DashboardOverview overview(UUID userId) {
        List<Enrollment> enrollments = enrollmentLedger.listForUser(userId);

        int completed = (int) enrollments.stream().filter(Enrollment::isCompleted).count();
        List<String> badges = badgeService.listForUser(userId).stream()
            .map(UserBadge::getName)
            .toList();

        DashboardOverview overview = new DashboardOverview(
            enrollments.size(),
            completed,
            enrollments.size() - completed,
            registrationService.countForUser(userId),
            certificateIssuer.countForUser(userId),
            averageProgress(enrollments),
            badges
        );
        log.debug("Dashboard overview for user {}: {}", userId, overview);
        return overview;
    }

    @Transactional(readOnly = true)
    public List<EnrolledCourse> myCourses(UUID userId) {
        return enrollmentLedger.listForUser(userId).stream()
            .map(enrollment -> new EnrolledCourse(
                enrollment,
                catalogService.findCourse(enrollment.getCourseId()).map(Course::getTitle).orElse(null)))
            .toList();
    }

    static BigDecimal averageProgress(List<Enrollment> enrollments) {
        if (enrollments.isEmpty()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal total = enrollments.stream()
            .map(Enrollment::getProgress)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(enrollments.size()), 2, RoundingMode.HALF_UP);
    }
}

package com.flagship.learning_platform.certificate;

import com.flagship.learning_platform.catalog.CatalogService;
import com.flagship.learning_platform.catalog.Course;
import com.flagship.learning_platform.catalog.LearnerProfile;
import com.flagship.learning_platform.certificate.event.CertificateIssuedEvent;
import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.enrollment.Enrollment;
import com.flagship.learning_platform.enrollment.EnrollmentLedger;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.exception.PreconditionFailedException;
import com.flagship.learning_platform.observability.LearningMetrics;
import com.flagship.learning_platform.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues at most one certificate per (user, course) for completed enrollments.
 *
 * Only the request that actually inserts the row has side effects: the
 * first-course badge check and the CertificateIssued outbox event, both in the
 * same transaction. The WhatsApp message is sent later by the event consumer,
 * so a messaging outage never affects issuance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateIssuer {

    static final int MAX_NUMBER_ATTEMPTS = 5;

    private final CertificateRepository certificateRepository;
    private final CertificateNumberGenerator numberGenerator;
    private final EnrollmentLedger enrollmentLedger;
    private final CatalogService catalogService;
    private final BadgeService badgeService;
    private final OutboxService outboxService;
    private final LearningProperties properties;
    private final LearningMetrics metrics;

    /**
     * @throws NotFoundException if the user is not enrolled in the course
     * @throws PreconditionFailedException if the enrollment is not completed
     */
    @Transactional
    public CertificateIssue issue(UUID userId, UUID courseId) {
        Enrollment enrollment = enrollmentLedger.find(userId, courseId)
            .orElseThrow(() -> new NotFoundException("Not enrolled in course " + courseId));

        if (!enrollment.isCompleted()) {
            throw new PreconditionFailedException(
                "Course not completed yet (progress " + enrollment.getProgress() + "%)");
        }

        Optional<CertificateEntity> existing = certificateRepository.findByUserIdAndCourseId(userId, courseId);
        if (existing.isPresent()) {
            metrics.recordCertificateIssued(false);
            log.info("Certificate already exists for user {} course {}: {}",
                    userId, courseId, existing.get().getCertificateNumber());
            return new CertificateIssue(existing.get().toDomain(), false);
        }

        Course course = catalogService.getCourse(courseId);

        for (int attempt = 1; attempt <= MAX_NUMBER_ATTEMPTS; attempt++) {
            String number = numberGenerator.next();
            int inserted = certificateRepository.insertIfAbsent(
                UUID.randomUUID(), userId, courseId, number, certificateUrl(number));

            if (inserted == 1) {
                Certificate certificate = certificateRepository.findByUserIdAndCourseId(userId, courseId)
                    .map(CertificateEntity::toDomain)
                    .orElseThrow(() -> new IllegalStateException("Inserted certificate not visible: " + number));
                onIssued(certificate, course);
                return new CertificateIssue(certificate, true);
            }

            // Either another request issued this pair first, or the number collided.
            Optional<CertificateEntity> winner = certificateRepository.findByUserIdAndCourseId(userId, courseId);
            if (winner.isPresent()) {
                metrics.recordCertificateIssued(false);
                log.info("Concurrent issue for user {} course {} resolved to {}",
                        userId, courseId, winner.get().getCertificateNumber());
                return new CertificateIssue(winner.get().toDomain(), false);
            }
            log.warn("Certificate number {} already taken, regenerating (attempt {})", number, attempt);
        }

        throw new IllegalStateException(
            "Could not allocate a unique certificate number after " + MAX_NUMBER_ATTEMPTS + " attempts");
    }

    /**
     * Public lookup by certificate number.
     *
     * @throws NotFoundException if no certificate has this number
     */
    @Transactional(readOnly = true)
    public CertificateVerification verify(String certificateNumber) {
        Certificate certificate = certificateRepository.findByCertificateNumber(certificateNumber)
            .map(CertificateEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Certificate", certificateNumber));

        String holderName = catalogService.findLearner(certificate.getUserId())
            .map(LearnerProfile::getName)
            .orElse(null);
        String courseTitle = catalogService.findCourse(certificate.getCourseId())
            .map(Course::getTitle)
            .orElse(null);

        return new CertificateVerification(
            certificate.getCertificateNumber(),
            holderName,
            courseTitle,
            certificate.getIssuedAt()
        );
    }

    /**
     * Certificates of a user, newest first, with course titles.
     */
    @Transactional(readOnly = true)
    public List<CertificateSummary> listForUser(UUID userId) {
        Map<UUID, String> titles = new HashMap<>();
        return certificateRepository.findByUserIdOrderByIssuedAtDesc(userId).stream()
            .map(CertificateEntity::toDomain)
            .map(certificate -> new CertificateSummary(
                certificate,
                titles.computeIfAbsent(certificate.getCourseId(),
                    id -> catalogService.findCourse(id).map(Course::getTitle).orElse(null))))
            .toList();
    }

    @Transactional(readOnly = true)
    public long countForUser(UUID userId) {
        return certificateRepository.countByUserId(userId);
    }

    private void onIssued(Certificate certificate, Course course) {
        if (certificateRepository.countByUserId(certificate.getUserId()) == 1) {
            badgeService.awardFirstCourseBadge(certificate.getUserId());
        }

        outboxService.saveEvent(CertificateIssuedEvent.of(certificate, course.getTitle()));
        metrics.recordCertificateIssued(true);
        log.info("Issued certificate {} to user {} for course {}",
                certificate.getCertificateNumber(), certificate.getUserId(), course.getId());
    }

    private String certificateUrl(String certificateNumber) {
        String baseUrl = properties.getCertificate().getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/" + certificateNumber + ".pdf";
    }
}

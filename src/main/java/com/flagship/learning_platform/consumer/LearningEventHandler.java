package com.flagship.learning_platform.consumer;

import com.flagship.learning_platform.catalog.CatalogService;
import com.flagship.learning_platform.catalog.LearnerProfile;
import com.flagship.learning_platform.certificate.event.CertificateIssuedEvent;
import com.flagship.learning_platform.enrollment.event.EnrollmentCreatedEvent;
import com.flagship.learning_platform.event.EventRegisteredEvent;
import com.flagship.learning_platform.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Sends the WhatsApp message that follows each user-facing learning event.
 *
 * Called by {@link LearningEventConsumer} after the deduplication check.
 * Nothing here throws on a messaging failure; {@link NotificationService}
 * absorbs those.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LearningEventHandler {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final CatalogService catalogService;
    private final NotificationService notificationService;

    public void onEnrollmentCreated(EnrollmentCreatedEvent event) {
        log.info("Handling EnrollmentCreated: enrollmentId={}, courseId={}",
                event.getEnrollmentId(), event.getCourseId());

        learner(event.getUserId()).ifPresent(learner ->
            notificationService.sendEnrollment(learner.getPhone(), learner.getName(), event.getCourseTitle()));
    }

    public void onEventRegistered(EventRegisteredEvent event) {
        log.info("Handling EventRegistered: registrationId={}, eventId={}",
                event.getRegistrationId(), event.getLiveEventId());

        learner(event.getUserId()).ifPresent(learner ->
            notificationService.sendEventRsvp(
                learner.getPhone(),
                learner.getName(),
                event.getEventTitle(),
                event.getEventDate() != null ? DATE_FORMAT.format(event.getEventDate()) : "TBA",
                event.getEventTime() != null ? TIME_FORMAT.format(event.getEventTime()) : "TBA",
                event.getEventUrl()
            ));
    }

    public void onCertificateIssued(CertificateIssuedEvent event) {
        log.info("Handling CertificateIssued: certificate={}, courseId={}",
                event.getCertificateNumber(), event.getCourseId());

        learner(event.getUserId()).ifPresent(learner ->
            notificationService.sendCertificate(
                learner.getPhone(), learner.getName(), event.getCourseTitle(), event.getCertificateUrl()));
    }

    private Optional<LearnerProfile> learner(UUID userId) {
        Optional<LearnerProfile> learner = catalogService.findLearner(userId);
        if (learner.isEmpty()) {
            log.warn("User {} not found, no notification sent", userId);
        }
        return learner;
    }
}

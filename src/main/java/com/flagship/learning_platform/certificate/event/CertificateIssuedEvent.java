package com.flagship.learning_platform.certificate.event;

import com.flagship.learning_platform.certificate.Certificate;
import com.flagship.learning_platform.outbox.LearningEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a certificate row is first inserted. Drives the
 * certificate notification.
 */
@Value
public class CertificateIssuedEvent implements LearningEvent {
    UUID eventId;
    UUID certificateId;
    UUID userId;
    UUID courseId;
    String courseTitle;
    String certificateNumber;
    String certificateUrl;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CertificateIssued";
    public static final String AGGREGATE_TYPE = "Certificate";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return certificateId;
    }

    public static CertificateIssuedEvent of(Certificate certificate, String courseTitle) {
        return new CertificateIssuedEvent(
            UUID.randomUUID(),
            certificate.getId(),
            certificate.getUserId(),
            certificate.getCourseId(),
            courseTitle,
            certificate.getCertificateNumber(),
            certificate.getCertificateUrl(),
            Instant.now()
        );
    }
}

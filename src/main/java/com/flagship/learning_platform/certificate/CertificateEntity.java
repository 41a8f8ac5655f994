package com.flagship.learning_platform.certificate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Read mapping of the certificates table. Rows are inserted through
 * {@link CertificateRepository#insertIfAbsent} and never updated.
 */
@Entity
@Table(name = "certificates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CertificateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "course_id", nullable = false, updatable = false)
    private UUID courseId;

    @Column(name = "certificate_number", nullable = false, updatable = false, length = 32)
    private String certificateNumber;

    @Column(name = "certificate_url", nullable = false, updatable = false, length = 512)
    private String certificateUrl;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    public Certificate toDomain() {
        return new Certificate(id, userId, courseId, certificateNumber, certificateUrl, issuedAt);
    }
}

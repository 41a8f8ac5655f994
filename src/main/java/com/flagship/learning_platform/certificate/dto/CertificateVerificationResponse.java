package com.flagship.learning_platform.certificate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.certificate.CertificateVerification;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Public view of a certificate. Carries no user or course identifiers.
 */
@Value
@Builder
public class CertificateVerificationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("certificate_number")
    String certificateNumber;

    @JsonProperty("user_name")
    String userName;

    @JsonProperty("course_title")
    String courseTitle;

    @JsonProperty("issued_at")
    Instant issuedAt;

    public static CertificateVerificationResponse from(CertificateVerification verification) {
        return CertificateVerificationResponse.builder()
            .valid(true)
            .certificateNumber(verification.getCertificateNumber())
            .userName(verification.getHolderName())
            .courseTitle(verification.getCourseTitle())
            .issuedAt(verification.getIssuedAt())
            .build();
    }
}

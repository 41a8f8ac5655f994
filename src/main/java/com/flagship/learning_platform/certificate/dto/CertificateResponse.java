package com.flagship.learning_platform.certificate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.certificate.Certificate;
import com.flagship.learning_platform.certificate.CertificateSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CertificateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("course_id")
    UUID courseId;

    @JsonProperty("course_title")
    String courseTitle;

    @JsonProperty("certificate_number")
    String certificateNumber;

    @JsonProperty("certificate_url")
    String certificateUrl;

    @JsonProperty("issued_at")
    Instant issuedAt;

    public static CertificateResponse from(Certificate certificate) {
        return CertificateResponse.builder()
            .id(certificate.getId())
            .courseId(certificate.getCourseId())
            .certificateNumber(certificate.getCertificateNumber())
            .certificateUrl(certificate.getCertificateUrl())
            .issuedAt(certificate.getIssuedAt())
            .build();
    }

    public static CertificateResponse from(CertificateSummary summary) {
        Certificate certificate = summary.getCertificate();
        return CertificateResponse.builder()
            .id(certificate.getId())
            .courseId(certificate.getCourseId())
            .courseTitle(summary.getCourseTitle())
            .certificateNumber(certificate.getCertificateNumber())
            .certificateUrl(certificate.getCertificateUrl())
            .issuedAt(certificate.getIssuedAt())
            .build();
    }
}

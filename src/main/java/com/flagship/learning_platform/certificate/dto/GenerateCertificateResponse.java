package com.flagship.learning_platform.certificate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.certificate.CertificateIssue;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GenerateCertificateResponse {

    @JsonProperty("message")
    String message;

    @JsonProperty("newly_issued")
    boolean newlyIssued;

    @JsonProperty("certificate")
    CertificateResponse certificate;

    public static GenerateCertificateResponse from(CertificateIssue issue) {
        return GenerateCertificateResponse.builder()
            .message(issue.isNewlyIssued() ? "Certificate generated successfully" : "Certificate already exists")
            .newlyIssued(issue.isNewlyIssued())
            .certificate(CertificateResponse.from(issue.getCertificate()))
            .build();
    }
}

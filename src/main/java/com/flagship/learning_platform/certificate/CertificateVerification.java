package com.flagship.learning_platform.certificate;

import lombok.Value;

import java.time.Instant;

@Value
public class CertificateVerification {
    String certificateNumber;
    String holderName;
    String courseTitle;
    Instant issuedAt;
}

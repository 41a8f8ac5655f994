package com.flagship.learning_platform.certificate;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof of completion for one (user, course) pair.
 */
@Value
public class Certificate {
    UUID id;
    UUID userId;
    UUID courseId;
    String certificateNumber;
    String certificateUrl;
    Instant issuedAt;
}

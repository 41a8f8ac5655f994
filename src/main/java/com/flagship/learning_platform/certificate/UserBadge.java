package com.flagship.learning_platform.certificate;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class UserBadge {
    UUID id;
    UUID userId;
    String name;
    String description;
    String icon;
    Instant awardedAt;
}

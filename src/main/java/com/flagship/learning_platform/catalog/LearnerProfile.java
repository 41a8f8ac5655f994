package com.flagship.learning_platform.catalog;

import lombok.Value;

import java.util.UUID;

@Value
public class LearnerProfile {
    UUID id;
    String name;
    String email;
    String phone;
    String role;
}

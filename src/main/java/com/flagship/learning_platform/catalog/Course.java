package com.flagship.learning_platform.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Course as seen by this service. {@code studentsCount} is a cached counter
 * maintained by the enrollment ledger.
 */
@Value
public class Course {
    UUID id;
    String title;
    BigDecimal price;
    int studentsCount;
}

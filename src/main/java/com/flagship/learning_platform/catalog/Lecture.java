package com.flagship.learning_platform.catalog;

import lombok.Value;

import java.util.UUID;

/**
 * One ordered unit of course content. Duration is in minutes.
 */
@Value
public class Lecture {
    UUID id;
    UUID courseId;
    String title;
    int duration;
    int order;
}

package com.flagship.learning_platform.progress;

import lombok.Value;

/**
 * The fields a learner may change on a lecture progress row. A null field
 * keeps its stored value.
 */
@Value
public class ProgressChange {
    Integer watchedDuration;
    Boolean completed;

    /**
     * @throws IllegalArgumentException if nothing would change or the duration is negative
     */
    public void validate() {
        if (watchedDuration == null && completed == null) {
            throw new IllegalArgumentException("Nothing to update: provide watched_duration and/or completed");
        }
        if (watchedDuration != null && watchedDuration < 0) {
            throw new IllegalArgumentException("watched_duration must not be negative");
        }
    }
}

package com.flagship.learning_platform.progress.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.learning_platform.progress.ProgressChange;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Body of a lecture progress report. Only these two fields are accepted;
 * either may be omitted.
 */
@Value
public class UpdateProgressRequest {

    @PositiveOrZero(message = "Watched duration must not be negative")
    @JsonProperty("watched_duration")
    Integer watchedDuration;

    @JsonProperty("completed")
    Boolean completed;

    public ProgressChange toChange() {
        return new ProgressChange(watchedDuration, completed);
    }
}

package com.flagship.learning_platform.progress;

import com.flagship.learning_platform.observability.CorrelationContext;
import com.flagship.learning_platform.progress.dto.CourseProgressResponse;
import com.flagship.learning_platform.progress.dto.ProgressUpdateResponse;
import com.flagship.learning_platform.progress.dto.UpdateProgressRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/progress")
@RequiredArgsConstructor
@Slf4j
public class ProgressController {

    private final LectureProgressTracker progressTracker;

    @PostMapping("/lectures/{lectureId}")
    public ResponseEntity<ProgressUpdateResponse> updateLectureProgress(
            @PathVariable("lectureId") UUID lectureId,
            @Valid @RequestBody UpdateProgressRequest request,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        log.info("Progress report for lecture {}: watched={}, completed={}",
                lectureId, request.getWatchedDuration(), request.getCompleted());

        ProgressUpdate update = progressTracker.upsertProgress(userId, lectureId, request.toChange());
        return ResponseEntity.ok(ProgressUpdateResponse.from(update));
    }

    @GetMapping("/courses/{courseId}")
    public ResponseEntity<CourseProgressResponse> getCourseProgress(
            @PathVariable("courseId") UUID courseId,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        return ResponseEntity.ok(CourseProgressResponse.from(progressTracker.getProgress(userId, courseId)));
    }
}

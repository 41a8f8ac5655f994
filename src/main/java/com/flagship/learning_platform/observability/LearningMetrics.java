package com.flagship.learning_platform.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer counters and timers for the learning flows.
 *
 * Metrics exposed:
 * - enrollment.created (source)
 * - progress.updates (lecture_completed)
 * - course.completed
 * - certificate.issued (result = issued | existing)
 * - badge.awarded (badge)
 * - payments.checkout / payments.completed (target, status)
 * - event.rsvp (status)
 * - notification.sent (template, outcome)
 * - idempotency.cache (result)
 * - learning.latency (operation)
 */
@Component
public class LearningMetrics {

    private final MeterRegistry registry;
    private final Counter coursesCompleted;

    public LearningMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.coursesCompleted = Counter.builder("course.completed")
                .description("Enrollments that reached 100% for the first time")
                .register(registry);
    }

    public void recordEnrollmentCreated(String source) {
        registry.counter("enrollment.created", "source", sanitizeTag(source)).increment();
    }

    public void recordProgressUpdate(boolean lectureCompleted) {
        registry.counter("progress.updates",
                "lecture_completed", String.valueOf(lectureCompleted)
        ).increment();
    }

    public void recordCourseCompleted() {
        coursesCompleted.increment();
    }

    public void recordCertificateIssued(boolean newlyIssued) {
        registry.counter("certificate.issued",
                "result", newlyIssued ? "issued" : "existing"
        ).increment();
    }

    public void recordBadgeAwarded(String badgeName) {
        registry.counter("badge.awarded", "badge", sanitizeTag(badgeName)).increment();
    }

    public void recordCheckout(String target, String status) {
        registry.counter("payments.checkout",
                "target", sanitizeTag(target),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPaymentCompleted(String target, String status) {
        registry.counter("payments.completed",
                "target", sanitizeTag(target),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordRsvp(String status) {
        registry.counter("event.rsvp", "status", sanitizeTag(status)).increment();
    }

    public void recordNotification(String template, String outcome) {
        registry.counter("notification.sent",
                "template", sanitizeTag(template),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("learning.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of special characters so free-form
     * input cannot blow up series cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

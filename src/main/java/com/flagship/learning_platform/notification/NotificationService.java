package com.flagship.learning_platform.notification;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.observability.LearningMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort WhatsApp messages.
 *
 * Never throws: a missing phone number is skipped, and any client failure
 * (timeout, provider error, bad template data) is logged and counted. Callers
 * run after the domain change has committed, so nothing here can undo it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationClient client;
    private final LearningProperties properties;
    private final LearningMetrics metrics;

    public Optional<String> sendEnrollment(String phone, String userName, String courseTitle) {
        Map<String, String> data = new HashMap<>();
        data.put(NotificationTemplate.USER_NAME, userName);
        data.put(NotificationTemplate.COURSE_TITLE, courseTitle);
        data.put(NotificationTemplate.DASHBOARD_LINK, properties.getNotification().getDashboardUrl());
        return send(phone, NotificationTemplate.ENROLLMENT, data);
    }

    public Optional<String> sendEventRsvp(String phone, String userName, String eventTitle,
                                          String eventDate, String eventTime, String eventLink) {
        Map<String, String> data = new HashMap<>();
        data.put(NotificationTemplate.USER_NAME, userName);
        data.put(NotificationTemplate.EVENT_TITLE, eventTitle);
        data.put(NotificationTemplate.EVENT_DATE, eventDate);
        data.put(NotificationTemplate.EVENT_TIME, eventTime);
        data.put(NotificationTemplate.EVENT_LINK, eventLink);
        return send(phone, NotificationTemplate.EVENT_RSVP, data);
    }

    public Optional<String> sendCertificate(String phone, String userName, String courseTitle, String certificateUrl) {
        Map<String, String> data = new HashMap<>();
        data.put(NotificationTemplate.USER_NAME, userName);
        data.put(NotificationTemplate.COURSE_TITLE, courseTitle);
        data.put(NotificationTemplate.CERTIFICATE_URL, certificateUrl);
        return send(phone, NotificationTemplate.CERTIFICATE, data);
    }

    public Optional<String> sendEventReminder(String phone, String userName, String eventTitle, String eventTime) {
        Map<String, String> data = new HashMap<>();
        data.put(NotificationTemplate.USER_NAME, userName);
        data.put(NotificationTemplate.EVENT_TITLE, eventTitle);
        data.put(NotificationTemplate.EVENT_TIME, eventTime);
        return send(phone, NotificationTemplate.EVENT_REMINDER, data);
    }

    private Optional<String> send(String phone, NotificationTemplate template, Map<String, String> data) {
        if (phone == null || phone.isBlank()) {
            log.info("No phone number on file, skipping {} message", template);
            metrics.recordNotification(template.tag(), "skipped");
            return Optional.empty();
        }

        long startTime = System.currentTimeMillis();
        try {
            Optional<String> messageId = client.send(phone, template, data);
            metrics.recordNotification(template.tag(), messageId.isPresent() ? "sent" : "not_sent");
            return messageId;
        } catch (Exception e) {
            log.error("Failed to send {} WhatsApp message: {}", template, e.getMessage());
            metrics.recordNotification(template.tag(), "failed");
            return Optional.empty();
        } finally {
            metrics.recordLatency("notification_send", System.currentTimeMillis() - startTime);
        }
    }
}

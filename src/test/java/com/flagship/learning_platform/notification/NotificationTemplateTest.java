package com.flagship.learning_platform.notification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTemplateTest {

    @Test
    @DisplayName("RSVP message includes the join link only when one exists")
    void rsvpLink() {
        Map<String, String> data = new HashMap<>(Map.of(
            NotificationTemplate.USER_NAME, "Meera",
            NotificationTemplate.EVENT_TITLE, "System Design Live",
            NotificationTemplate.EVENT_DATE, "March 14, 2030",
            NotificationTemplate.EVENT_TIME, "17:00"));

        String withoutLink = NotificationTemplate.EVENT_RSVP.render(data);
        assertTrue(withoutLink.contains("You're registered for: System Design Live"));
        assertFalse(withoutLink.contains("Join here"));

        data.put(NotificationTemplate.EVENT_LINK, "https://meet.example.test/sd");
        assertTrue(NotificationTemplate.EVENT_RSVP.render(data).contains("Join here: https://meet.example.test/sd"));
    }

    @Test
    @DisplayName("Certificate message names the course and download link")
    void certificate() {
        String body = NotificationTemplate.CERTIFICATE.render(Map.of(
            NotificationTemplate.USER_NAME, "Meera",
            NotificationTemplate.COURSE_TITLE, "Kafka in Practice",
            NotificationTemplate.CERTIFICATE_URL, "https://certificates.lotplatform.com/CERT-20300101-ABC123.pdf"));

        assertTrue(body.startsWith("Certificate Earned!"));
        assertTrue(body.contains("Congratulations Meera!"));
        assertTrue(body.contains("https://certificates.lotplatform.com/CERT-20300101-ABC123.pdf"));
    }

    @Test
    @DisplayName("A missing value is rejected with its key")
    void missingValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> NotificationTemplate.ENROLLMENT.render(Map.of(NotificationTemplate.USER_NAME, "Meera")));
        assertTrue(e.getMessage().contains("course_title"));
    }

    @Test
    @DisplayName("Metric tags are lower case template names")
    void tag() {
        assertEquals("event_reminder", NotificationTemplate.EVENT_REMINDER.tag());
    }
}

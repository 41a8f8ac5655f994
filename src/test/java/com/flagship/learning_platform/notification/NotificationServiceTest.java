package com.flagship.learning_platform.notification;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.exception.ExternalServiceException;
import com.flagship.learning_platform.observability.LearningMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationClient client;

    @Captor
    private ArgumentCaptor<Map<String, String>> data;

    private SimpleMeterRegistry registry;
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        notificationService = new NotificationService(client, new LearningProperties(), new LearningMetrics(registry));
    }

    private double count(String template, String outcome) {
        return registry.counter("notification.sent", "template", template, "outcome", outcome).count();
    }

    @Test
    @DisplayName("Enrollment message carries the dashboard link")
    void enrollment() {
        when(client.send(eq("+919800000001"), eq(NotificationTemplate.ENROLLMENT), anyMap()))
            .thenReturn(Optional.of("SM123"));

        Optional<String> sid = notificationService.sendEnrollment("+919800000001", "Asha", "Java Basics");

        assertEquals(Optional.of("SM123"), sid);
        verify(client).send(eq("+919800000001"), eq(NotificationTemplate.ENROLLMENT), data.capture());
        assertEquals("https://lotplatform.com/dashboard", data.getValue().get(NotificationTemplate.DASHBOARD_LINK));
        assertEquals(1.0, count("enrollment", "sent"));
    }

    @Test
    @DisplayName("Learners without a phone number are skipped")
    void noPhone() {
        Optional<String> sid = notificationService.sendCertificate(" ", "Asha", "Java Basics", "https://x/1.pdf");

        assertTrue(sid.isEmpty());
        verifyNoInteractions(client);
        assertEquals(1.0, count("certificate", "skipped"));
    }

    @Test
    @DisplayName("Provider failures are logged and counted, never thrown")
    void providerFailure() {
        when(client.send(any(), any(), anyMap()))
            .thenThrow(new ExternalServiceException("twilio", "Failed to send WhatsApp message: timeout"));

        Optional<String> sid = assertDoesNotThrow(() -> notificationService.sendEventRsvp(
            "+919800000002", "Ravi", "Meetup", "March 14, 2030", "17:00", null));

        assertTrue(sid.isEmpty());
        assertEquals(1.0, count("event_rsvp", "failed"));
    }

    @Test
    @DisplayName("A disabled client reports the message as not sent")
    void disabledClient() {
        notificationService = new NotificationService(
            new DisabledNotificationClient(), new LearningProperties(), new LearningMetrics(registry));

        assertTrue(notificationService.sendEventReminder("+919800000003", "Ravi", "Meetup", "Thu 14 Mar, 17:00").isEmpty());
        assertEquals(1.0, count("event_reminder", "not_sent"));
    }
}

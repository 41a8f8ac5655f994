package com.flagship.learning_platform.event;

import com.flagship.learning_platform.config.LearningProperties;
import com.flagship.learning_platform.notification.NotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Sends the WhatsApp reminder once per registration when its event is less
 * than a day away. Event dates and times are stored without a zone; "now" is
 * taken in {@code learning.notification.event-time-zone}, not the JVM default.
 */
@Component
@ConditionalOnProperty(name = "learning.notification.reminders.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EventReminderJob {

    private static final Duration LEAD_TIME = Duration.ofHours(24);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("EEE d MMM, HH:mm", Locale.ENGLISH);

    private final EventRegistrationService registrationService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Autowired
    public EventReminderJob(EventRegistrationService registrationService, NotificationService notificationService,
                            LearningProperties properties) {
        this(registrationService, notificationService,
            Clock.system(properties.getNotification().getEventTimeZone()));
    }

    EventReminderJob(EventRegistrationService registrationService, NotificationService notificationService,
                     Clock clock) {
        this.registrationService = registrationService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${learning.notification.reminders.interval-ms:900000}")
    public void sendDueReminders() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ReminderTarget> due;
        try {
            due = registrationService.claimDueReminders(now, now.plus(LEAD_TIME));
        } catch (Exception e) {
            log.error("Failed to claim event reminders", e);
            return;
        }

        if (due.isEmpty()) {
            return;
        }
        log.info("Sending {} event reminders", due.size());

        for (ReminderTarget target : due) {
            notificationService.sendEventReminder(
                target.getPhone(),
                target.getUserName(),
                target.getEventTitle(),
                TIME_FORMAT.format(LocalDateTime.of(target.getEventDate(), target.getEventTime()))
            );
        }
    }
}

package com.flagship.learning_platform.notification;

import java.util.Map;

/**
 * WhatsApp message bodies. Each template reads its values from the data map;
 * a missing required value is an IllegalArgumentException.
 */
public enum NotificationTemplate {

    ENROLLMENT {
        @Override
        public String render(Map<String, String> data) {
            return """
                Welcome to %s!

                Hi %s,

                Congratulations on enrolling!

                Access your course here: %s

                Need help? Just reply to this message!

                Happy Learning!""".formatted(
                required(data, COURSE_TITLE), required(data, USER_NAME), required(data, DASHBOARD_LINK));
        }
    },

    EVENT_RSVP {
        @Override
        public String render(Map<String, String> data) {
            String link = data.get(EVENT_LINK);
            String linkText = link == null || link.isBlank() ? "" : "\n\nJoin here: " + link;
            return """
                Event Registration Confirmed!

                Hi %s,

                You're registered for: %s

                Date: %s
                Time: %s%s

                We'll send you a reminder before the event!

                See you there!""".formatted(
                required(data, USER_NAME), required(data, EVENT_TITLE),
                required(data, EVENT_DATE), required(data, EVENT_TIME), linkText);
        }
    },

    CERTIFICATE {
        @Override
        public String render(Map<String, String> data) {
            return """
                Certificate Earned!

                Congratulations %s!

                You've successfully completed: %s

                Download your certificate: %s

                Share your achievement!""".formatted(
                required(data, USER_NAME), required(data, COURSE_TITLE), required(data, CERTIFICATE_URL));
        }
    },

    EVENT_REMINDER {
        @Override
        public String render(Map<String, String> data) {
            return """
                Event Reminder!

                Hi %s,

                Don't forget! "%s" starts in 24 hours.

                Time: %s

                See you soon!""".formatted(
                required(data, USER_NAME), required(data, EVENT_TITLE), required(data, EVENT_TIME));
        }
    };

    public static final String USER_NAME = "user_name";
    public static final String COURSE_TITLE = "course_title";
    public static final String DASHBOARD_LINK = "dashboard_link";
    public static final String EVENT_TITLE = "event_title";
    public static final String EVENT_DATE = "event_date";
    public static final String EVENT_TIME = "event_time";
    public static final String EVENT_LINK = "event_link";
    public static final String CERTIFICATE_URL = "certificate_url";

    public abstract String render(Map<String, String> data);

    public String tag() {
        return name().toLowerCase();
    }

    private static String required(Map<String, String> data, String key) {
        String value = data.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing template value '" + key + "'");
        }
        return value;
    }
}

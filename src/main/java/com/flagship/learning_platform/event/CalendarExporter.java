package com.flagship.learning_platform.event;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders an event as an iCalendar (RFC 5545) document with a single VEVENT.
 *
 * Event date and time are stored without a zone, so DTSTART is written as
 * floating local time.
 */
@Component
public class CalendarExporter {

    public static final String CONTENT_TYPE = "text/calendar; charset=utf-8";

    private static final String CRLF = "\r\n";
    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final DateTimeFormatter UTC_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private final Clock clock;

    public CalendarExporter() {
        this(Clock.systemUTC());
    }

    CalendarExporter(Clock clock) {
        this.clock = clock;
    }

    public String render(LiveEvent event) {
        LocalDateTime start = LocalDateTime.of(event.getEventDate(), event.getEventTime());
        LocalDateTime stamp = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));

        StringBuilder ics = new StringBuilder();
        line(ics, "BEGIN:VCALENDAR");
        line(ics, "VERSION:2.0");
        line(ics, "PRODID:-//Learning Platform//Events//EN");
        line(ics, "CALSCALE:GREGORIAN");
        line(ics, "METHOD:PUBLISH");
        line(ics, "BEGIN:VEVENT");
        line(ics, "UID:" + event.getId() + "@learning-platform");
        line(ics, "DTSTAMP:" + UTC_FORMAT.format(stamp));
        line(ics, "DTSTART:" + LOCAL_FORMAT.format(start));
        line(ics, "DURATION:PT" + event.getDuration() + "M");
        line(ics, "SUMMARY:" + escape(event.getTitle()));
        if (event.getDescription() != null && !event.getDescription().isBlank()) {
            line(ics, "DESCRIPTION:" + escape(event.getDescription()));
        }
        if (event.getLocation() != null && !event.getLocation().isBlank()) {
            line(ics, "LOCATION:" + escape(event.getLocation()));
        }
        if (event.getEventUrl() != null && !event.getEventUrl().isBlank()) {
            line(ics, "URL:" + event.getEventUrl());
        }
        line(ics, "END:VEVENT");
        line(ics, "END:VCALENDAR");
        return ics.toString();
    }

    public String fileName(LiveEvent event) {
        String slug = event.getTitle() == null ? "" : event.getTitle().toLowerCase().replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("(^-+)|(-+$)", "");
        return (slug.isEmpty() ? "event" : slug) + ".ics";
    }

    private static void line(StringBuilder ics, String content) {
        ics.append(content).append(CRLF);
    }

    // TEXT values escape backslash, semicolon, comma and newlines.
    static String escape(String value) {
        return value
            .replace("\\", "\\\\")
            .replace(";", "\\;")
            .replace(",", "\\,")
            .replace("\r\n", "\\n")
            .replace("\n", "\\n");
    }
}

package com.flagship.learning_platform.event;

import com.flagship.learning_platform.event.dto.RsvpResponse;
import com.flagship.learning_platform.event.dto.ScheduleItemResponse;
import com.flagship.learning_platform.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventController {

    private final EventRegistrationService registrationService;
    private final CalendarExporter calendarExporter;

    @PostMapping("/{eventId}/rsvp")
    public ResponseEntity<RsvpResponse> rsvp(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        log.info("RSVP request for event {}", eventId);
        RegistrationResult result = registrationService.rsvp(userId, eventId);
        return ResponseEntity.status(HttpStatus.CREATED).body(RsvpResponse.from(result));
    }

    @GetMapping("/my-schedule")
    public ResponseEntity<List<ScheduleItemResponse>> mySchedule(
            @RequestHeader(CorrelationContext.USER_ID_HEADER) UUID userId) {

        return ResponseEntity.ok(registrationService.mySchedule(userId).stream()
            .map(ScheduleItemResponse::from)
            .toList());
    }

    @GetMapping("/{eventId}/calendar")
    public ResponseEntity<String> calendar(@PathVariable("eventId") UUID eventId) {
        LiveEvent event = registrationService.getEvent(eventId);

        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(CalendarExporter.CONTENT_TYPE))
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(calendarExporter.fileName(event)).build().toString())
            .body(calendarExporter.render(event));
    }
}

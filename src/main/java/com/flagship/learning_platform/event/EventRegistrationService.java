package com.flagship.learning_platform.event;

import com.flagship.learning_platform.exception.ConflictException;
import com.flagship.learning_platform.exception.NotFoundException;
import com.flagship.learning_platform.observability.LearningMetrics;
import com.flagship.learning_platform.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Seat allocation for live events.
 *
 * A seat is taken with one conditional UPDATE (registered < capacity), so two
 * concurrent RSVPs for the last seat cannot both succeed; chk_events_registered
 * backs this in the schema. The registration row is inserted in the same
 * transaction and a failed seat increment rolls it back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventRegistrationService {

    private static final String EVENT_COLUMNS =
        "id, title, description, event_date, event_time, duration, location, price, capacity, registered, event_url";

    private static final String REGISTRATION_COLUMNS = "id, user_id, event_id, status, registered_at";

    private static final RowMapper<LiveEvent> EVENT_MAPPER = (rs, rowNum) -> new LiveEvent(
        rs.getObject("id", UUID.class),
        rs.getString("title"),
        rs.getString("description"),
        rs.getDate("event_date").toLocalDate(),
        rs.getTime("event_time").toLocalTime(),
        rs.getInt("duration"),
        rs.getString("location"),
        rs.getBigDecimal("price"),
        rs.getInt("capacity"),
        rs.getInt("registered"),
        rs.getString("event_url")
    );

    private static final RowMapper<EventRegistration> REGISTRATION_MAPPER = (rs, rowNum) -> {
        Timestamp registeredAt = rs.getTimestamp("registered_at");
        return new EventRegistration(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getObject("event_id", UUID.class),
            RegistrationStatus.valueOf(rs.getString("status")),
            registeredAt != null ? registeredAt.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;
    private final LearningMetrics metrics;

    /**
     * Registers the caller for an event.
     *
     * @throws NotFoundException if the event does not exist
     * @throws ConflictException if the caller is already registered or the event is full
     */
    @Transactional
    public RegistrationResult rsvp(UUID userId, UUID eventId) {
        LiveEvent event = getEvent(eventId);

        if (findRegistration(userId, eventId).isPresent()) {
            metrics.recordRsvp("duplicate");
            throw new ConflictException("Already registered for this event");
        }

        EventRegistration registration = takeSeat(userId, event)
            .orElseThrow(() -> {
                metrics.recordRsvp("duplicate");
                return new ConflictException("Already registered for this event");
            });

        metrics.recordRsvp("confirmed");
        return new RegistrationResult(registration, event, true);
    }

    /**
     * Seat allocation after a completed event payment. An existing registration
     * is returned unchanged.
     *
     * @throws NotFoundException if the event does not exist
     * @throws ConflictException if the event is full
     */
    @Transactional
    public RegistrationResult registerIfAbsent(UUID userId, UUID eventId) {
        LiveEvent event = getEvent(eventId);

        Optional<EventRegistration> existing = findRegistration(userId, eventId);
        if (existing.isPresent()) {
            log.info("User {} already registered for event {}", userId, eventId);
            return new RegistrationResult(existing.get(), event, false);
        }

        Optional<EventRegistration> inserted = takeSeat(userId, event);
        if (inserted.isEmpty()) {
            EventRegistration concurrent = findRegistration(userId, eventId)
                .orElseThrow(() -> new IllegalStateException(
                    "Registration conflict reported but no row found for user " + userId + ", event " + eventId));
            return new RegistrationResult(concurrent, event, false);
        }

        metrics.recordRsvp("payment");
        return new RegistrationResult(inserted.get(), event, true);
    }

    @Transactional(readOnly = true)
    public Optional<LiveEvent> findEvent(UUID eventId) {
        return jdbcTemplate.query(
            "SELECT " + EVENT_COLUMNS + " FROM events WHERE id = ?",
            EVENT_MAPPER,
            eventId
        ).stream().findFirst();
    }

    /**
     * @throws NotFoundException if the event does not exist
     */
    @Transactional(readOnly = true)
    public LiveEvent getEvent(UUID eventId) {
        return findEvent(eventId).orElseThrow(() -> NotFoundException.of("Event", eventId));
    }

    @Transactional(readOnly = true)
    public Optional<EventRegistration> findRegistration(UUID userId, UUID eventId) {
        return jdbcTemplate.query(
            "SELECT " + REGISTRATION_COLUMNS + " FROM event_registrations WHERE user_id = ? AND event_id = ?",
            REGISTRATION_MAPPER,
            userId,
            eventId
        ).stream().findFirst();
    }

    /**
     * Confirmed registrations of a user, soonest event first.
     */
    @Transactional(readOnly = true)
    public List<ScheduledEvent> mySchedule(UUID userId) {
        return jdbcTemplate.query(
            "SELECT e.id, e.title, e.description, e.event_date, e.event_time, e.duration, e.location, " +
            "       e.price, e.capacity, e.registered, e.event_url, " +
            "       r.id AS registration_id, r.user_id, r.event_id, r.status, r.registered_at " +
            "FROM event_registrations r JOIN events e ON e.id = r.event_id " +
            "WHERE r.user_id = ? AND r.status = 'CONFIRMED' " +
            "ORDER BY e.event_date ASC, e.event_time ASC",
            (rs, rowNum) -> {
                Timestamp registeredAt = rs.getTimestamp("registered_at");
                return new ScheduledEvent(
                    EVENT_MAPPER.mapRow(rs, rowNum),
                    new EventRegistration(
                        rs.getObject("registration_id", UUID.class),
                        rs.getObject("user_id", UUID.class),
                        rs.getObject("event_id", UUID.class),
                        RegistrationStatus.valueOf(rs.getString("status")),
                        registeredAt != null ? registeredAt.toInstant() : null
                    )
                );
            },
            userId
        );
    }

    @Transactional(readOnly = true)
    public long countForUser(UUID userId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM event_registrations WHERE user_id = ? AND status = 'CONFIRMED'",
            Long.class,
            userId
        );
        return count != null ? count : 0L;
    }

    /**
     * Marks confirmed registrations for events starting in [from, to] as
     * reminded and returns them. A registration is claimed once, so a crash
     * between claim and send loses that reminder rather than repeating it.
     */
    @Transactional
    public List<ReminderTarget> claimDueReminders(LocalDateTime from, LocalDateTime to) {
        return jdbcTemplate.query(
            "UPDATE event_registrations r SET reminder_sent_at = now() " +
            "FROM events e, users u " +
            "WHERE e.id = r.event_id AND u.id = r.user_id " +
            "  AND r.status = 'CONFIRMED' AND r.reminder_sent_at IS NULL " +
            "  AND (e.event_date + e.event_time) BETWEEN ? AND ? " +
            "RETURNING r.id, r.user_id, u.name, u.phone, e.title, e.event_date, e.event_time",
            (rs, rowNum) -> new ReminderTarget(
                rs.getObject("id", UUID.class),
                rs.getObject("user_id", UUID.class),
                rs.getString("name"),
                rs.getString("phone"),
                rs.getString("title"),
                rs.getDate("event_date").toLocalDate(),
                rs.getTime("event_time").toLocalTime()
            ),
            Timestamp.valueOf(from),
            Timestamp.valueOf(to)
        );
    }

    /**
     * Inserts the registration and takes a seat. Returns empty when a row for
     * the pair already exists, which includes one committed concurrently.
     */
    private Optional<EventRegistration> takeSeat(UUID userId, LiveEvent event) {
        Optional<EventRegistration> inserted = jdbcTemplate.query(
            "INSERT INTO event_registrations (id, user_id, event_id, status, registered_at) " +
            "VALUES (?, ?, ?, 'CONFIRMED', now()) " +
            "ON CONFLICT (user_id, event_id) DO NOTHING " +
            "RETURNING " + REGISTRATION_COLUMNS,
            REGISTRATION_MAPPER,
            UUID.randomUUID(),
            userId,
            event.getId()
        ).stream().findFirst();

        if (inserted.isEmpty()) {
            return Optional.empty();
        }

        int updated = jdbcTemplate.update(
            "UPDATE events SET registered = registered + 1 WHERE id = ? AND registered < capacity",
            event.getId()
        );
        if (updated == 0) {
            metrics.recordRsvp("full");
            log.info("Event {} is full ({} seats), rejecting user {}", event.getId(), event.getCapacity(), userId);
            throw new ConflictException("Event is full");
        }

        EventRegistration registration = inserted.get();
        outboxService.saveEvent(EventRegisteredEvent.of(registration, event));
        log.info("Registered user {} for event {}, registration {}", userId, event.getId(), registration.getId());
        return inserted;
    }
}

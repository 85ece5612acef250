package de.bycsitsm.calsync.store;

import de.bycsitsm.calsync.model.Calendar;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import de.bycsitsm.calsync.model.ServerConnection;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link CalendarStore} keeping everything in memory. Used when no database
 * backed store is configured, and in tests.
 */
@Component
public class InMemoryCalendarStore implements CalendarStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCalendarStore.class);

    private final Map<Long, Calendar> calendars = new ConcurrentHashMap<>();
    private final Map<Long, CalendarEventRecord> events = new ConcurrentHashMap<>();
    private final Map<Long, ServerConnection> connections = new ConcurrentHashMap<>();
    private final AtomicLong calendarIds = new AtomicLong();
    private final AtomicLong eventIds = new AtomicLong();

    @Override
    public List<Calendar> getCalendars(long userId) {
        return calendars.values().stream()
                .filter(calendar -> calendar.userId() == userId)
                .sorted(Comparator.comparing(Calendar::id))
                .toList();
    }

    @Override
    public @Nullable Calendar getCalendar(long calendarId) {
        return calendars.get(calendarId);
    }

    @Override
    public Calendar createCalendar(Calendar calendar) {
        var created = calendar.withId(calendarIds.incrementAndGet());
        calendars.put(created.id(), created);
        log.debug("Created calendar {} '{}' for user {}", created.id(), created.name(), created.userId());
        return created;
    }

    @Override
    public Calendar updateCalendar(Calendar calendar) {
        var id = Objects.requireNonNull(calendar.id(), "calendar id");
        if (calendars.replace(id, calendar) == null) {
            throw new IllegalArgumentException("Unknown calendar " + id);
        }
        return calendar;
    }

    @Override
    public List<CalendarEventRecord> getEvents(long calendarId) {
        return events.values().stream()
                .filter(event -> Objects.equals(event.getCalendarId(), calendarId))
                .sorted(Comparator.comparing(CalendarEventRecord::getId))
                .map(CalendarEventRecord::copy)
                .toList();
    }

    @Override
    public @Nullable CalendarEventRecord getEvent(long eventId) {
        var event = events.get(eventId);
        return event == null ? null : event.copy();
    }

    @Override
    public @Nullable CalendarEventRecord getEventByUid(long userId, String uid) {
        return events.values().stream()
                .filter(event -> event.getUid().equals(uid))
                .filter(event -> belongsTo(event, userId))
                .min(Comparator.comparing(CalendarEventRecord::getId))
                .map(CalendarEventRecord::copy)
                .orElse(null);
    }

    @Override
    public CalendarEventRecord createEvent(CalendarEventRecord event) {
        var created = event.copy();
        created.setId(eventIds.incrementAndGet());
        events.put(created.getId(), created);
        return created.copy();
    }

    @Override
    public CalendarEventRecord updateEvent(CalendarEventRecord event) {
        var id = Objects.requireNonNull(event.getId(), "event id");
        var updated = events.computeIfPresent(id, (key, stored) -> {
            var copy = event.copy();
            copy.setUid(stored.getUid());
            return copy;
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown event " + id);
        }
        return updated.copy();
    }

    @Override
    public @Nullable CalendarEventRecord updateEventIfUnchanged(CalendarEventRecord event, long expectedRevision) {
        var id = Objects.requireNonNull(event.getId(), "event id");
        var applied = new boolean[1];
        var result = events.computeIfPresent(id, (key, stored) -> {
            if (stored.getRevision() != expectedRevision) {
                return stored;
            }
            var copy = event.copy();
            copy.setUid(stored.getUid());
            applied[0] = true;
            return copy;
        });
        return result != null && applied[0] ? result.copy() : null;
    }

    @Override
    public @Nullable CalendarEventRecord modifyEvent(long eventId, Consumer<CalendarEventRecord> change) {
        var result = events.computeIfPresent(eventId, (key, stored) -> {
            var copy = stored.copy();
            change.accept(copy);
            copy.setId(stored.getId());
            copy.setUid(stored.getUid());
            return copy;
        });
        return result != null ? result.copy() : null;
    }

    @Override
    public boolean deleteEvent(long eventId) {
        return events.remove(eventId) != null;
    }

    @Override
    public @Nullable ServerConnection getServerConnection(long userId) {
        return connections.get(userId);
    }

    @Override
    public ServerConnection updateServerConnection(ServerConnection connection) {
        connections.put(connection.userId(), connection);
        return connection;
    }

    private boolean belongsTo(CalendarEventRecord event, long userId) {
        if (event.getCalendarId() == null) {
            return false;
        }
        var calendar = calendars.get(event.getCalendarId());
        return calendar != null && calendar.userId() == userId;
    }
}

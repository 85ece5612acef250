package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.CalSyncProperties;
import de.bycsitsm.calsync.caldav.CalDavAdapter;
import de.bycsitsm.calsync.caldav.CalDavCredentials;
import de.bycsitsm.calsync.caldav.CalDavException;
import de.bycsitsm.calsync.ics.EventUids;
import de.bycsitsm.calsync.ics.IcsCancellationTransformer;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import de.bycsitsm.calsync.model.SyncStatus;
import de.bycsitsm.calsync.store.CalendarStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Local mutations of events. Each mutation is stored first and then picked up
 * by a calendar-scoped sync pass.
 */
@Service
public class CalendarEventService {

    private static final Logger log = LoggerFactory.getLogger(CalendarEventService.class);

    private final CalendarStore store;
    private final CalDavAdapter calDav;
    private final IcsCancellationTransformer cancellationTransformer;
    private final SyncJobRegistry registry;
    private final ChangeNotifier notifier;
    private final Clock clock;
    private final String uidDomain;

    CalendarEventService(CalendarStore store, CalDavAdapter calDav, IcsCancellationTransformer cancellationTransformer,
                         SyncJobRegistry registry, ChangeNotifier notifier, Clock clock,
                         CalSyncProperties properties) {
        this.store = store;
        this.calDav = calDav;
        this.cancellationTransformer = cancellationTransformer;
        this.registry = registry;
        this.notifier = notifier;
        this.clock = clock;
        this.uidDomain = properties.uidDomain();
    }

    /**
     * Creates an event in a calendar of the user. A well-formed UID of the
     * given event is kept, otherwise one is generated.
     *
     * @throws IllegalArgumentException if the calendar does not belong to the user
     */
    public CalendarEventRecord createEvent(long userId, long calendarId, CalendarEventRecord event) {
        requireCalendar(userId, calendarId);
        validateDates(event);

        var record = event.copy();
        record.setId(null);
        record.setUid(EventUids.preserveOrGenerate(event.getUid(), clock, uidDomain));
        record.setCalendarId(calendarId);
        record.setSyncStatus(SyncStatus.LOCAL);
        record.setEtag(null);
        record.setUrl(null);
        record.setRevision(0);

        var created = store.createEvent(record);
        log.info("Created event {} ({}) in calendar {}", created.getId(), created.getUid(), calendarId);
        notifier.notify(userId, created.getId(), ChangeType.EVENT_CREATED);
        registry.requestSync(userId, SyncOptions.afterLocalChange(calendarId));
        return created;
    }

    /**
     * Updates the content of an existing event. The stored UID always wins
     * over the UID of {@code changes}.
     *
     * @throws IllegalArgumentException if the event does not exist or belongs to another user
     */
    public CalendarEventRecord updateEvent(long userId, long eventId, CalendarEventRecord changes) {
        var stored = requireEvent(userId, eventId);
        validateDates(changes);

        if (!stored.getUid().equals(changes.getUid())) {
            log.debug("Ignoring UID change of event {} from {} to {}", eventId, stored.getUid(), changes.getUid());
        }
        // applied to the latest state, so a push finishing meanwhile keeps its ETag
        var updated = store.modifyEvent(eventId, current -> applyChanges(current, changes));
        if (updated == null) {
            throw new IllegalArgumentException("Event " + eventId + " not found for user " + userId);
        }
        notifier.notify(userId, eventId, ChangeType.EVENT_UPDATED);
        var calendarId = updated.getCalendarId();
        if (calendarId != null) {
            registry.requestSync(userId, SyncOptions.afterLocalChange(calendarId));
        }
        return updated;
    }

    private static void applyChanges(CalendarEventRecord current, CalendarEventRecord changes) {
        current.setTitle(changes.getTitle());
        current.setDescription(changes.getDescription());
        current.setLocation(changes.getLocation());
        current.setStartDate(changes.getStartDate());
        current.setEndDate(changes.getEndDate());
        current.setAllDay(changes.isAllDay());
        current.setTimezone(changes.getTimezone());
        current.setRecurrenceRule(changes.getRecurrenceRule());
        current.setAttendees(changes.getAttendees());
        current.setResources(changes.getResources());
        current.setRevision(current.getRevision() + 1);
        if (current.existsRemotely()) {
            current.setSyncStatus(SyncStatus.PENDING);
        } else if (current.getSyncStatus() == SyncStatus.SYNCED) {
            current.setSyncStatus(SyncStatus.LOCAL);
        }
    }

    /**
     * Cancels an event: builds the cancellation message for its participants,
     * deletes the remote object (best effort) and removes the local record.
     *
     * @return the {@code METHOD:CANCEL} calendar for delivery to the participants
     */
    public String cancelEvent(long userId, long eventId) {
        var event = requireEvent(userId, eventId);
        var cancellation = cancellationTransformer.transformIcsForCancellation(event.getRawData(), event);

        if (event.getUrl() != null && !event.getUrl().isBlank()) {
            var connection = store.getServerConnection(userId);
            if (connection != null) {
                try {
                    calDav.deleteCalendarObject(CalDavCredentials.of(connection), event.getUrl(), event.getEtag());
                } catch (CalDavException e) {
                    log.warn("Could not delete remote object {} of cancelled event {}: {}", event.getUrl(),
                            event.getUid(), e.getMessage());
                }
            }
        }

        store.deleteEvent(eventId);
        log.info("Cancelled event {} ({})", eventId, event.getUid());
        notifier.notify(userId, eventId, ChangeType.EVENT_DELETED);
        return cancellation;
    }

    private void requireCalendar(long userId, long calendarId) {
        var calendar = store.getCalendar(calendarId);
        if (calendar == null || calendar.userId() != userId) {
            throw new IllegalArgumentException("Calendar " + calendarId + " not found for user " + userId);
        }
    }

    private CalendarEventRecord requireEvent(long userId, long eventId) {
        var event = store.getEvent(eventId);
        if (event == null || !belongsTo(event.getCalendarId(), userId)) {
            throw new IllegalArgumentException("Event " + eventId + " not found for user " + userId);
        }
        return event;
    }

    private boolean belongsTo(@Nullable Long calendarId, long userId) {
        if (calendarId == null) {
            return false;
        }
        var calendar = store.getCalendar(calendarId);
        return calendar != null && calendar.userId() == userId;
    }

    private static void validateDates(CalendarEventRecord event) {
        Objects.requireNonNull(event.getStartDate(), "startDate");
        if (event.getEndDate().isBefore(event.getStartDate())) {
            throw new IllegalArgumentException("Event must not end before it starts");
        }
    }
}

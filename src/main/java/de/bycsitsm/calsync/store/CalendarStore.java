package de.bycsitsm.calsync.store;

import de.bycsitsm.calsync.model.Calendar;
import de.bycsitsm.calsync.model.CalendarEventRecord;
import de.bycsitsm.calsync.model.ServerConnection;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.Consumer;

/**
 * Persistence of calendars, events and server connections.
 * <p>
 * Implementations hand out copies: changes to a returned
 * {@link CalendarEventRecord} only take effect through {@link #updateEvent}.
 * Updates never change an event's {@code uid}.
 */
public interface CalendarStore {

    List<Calendar> getCalendars(long userId);

    @Nullable Calendar getCalendar(long calendarId);

    Calendar createCalendar(Calendar calendar);

    Calendar updateCalendar(Calendar calendar);

    List<CalendarEventRecord> getEvents(long calendarId);

    @Nullable CalendarEventRecord getEvent(long eventId);

    /**
     * Looks up an event by UID within the calendars of one user.
     */
    @Nullable CalendarEventRecord getEventByUid(long userId, String uid);

    CalendarEventRecord createEvent(CalendarEventRecord event);

    /**
     * Stores the given state of an existing event. The stored {@code uid} is kept.
     *
     * @throws IllegalArgumentException if the event does not exist
     */
    CalendarEventRecord updateEvent(CalendarEventRecord event);

    /**
     * Stores the given state only if the stored revision still equals
     * {@code expectedRevision}.
     *
     * @return the stored event, or {@code null} if the event was changed or deleted in the meantime
     */
    @Nullable CalendarEventRecord updateEventIfUnchanged(CalendarEventRecord event, long expectedRevision);

    /**
     * Applies {@code change} to the current stored state of an event, atomically
     * with respect to all other event updates. The stored {@code uid} is kept.
     *
     * @return the stored event, or {@code null} if the event does not exist
     */
    @Nullable CalendarEventRecord modifyEvent(long eventId, Consumer<CalendarEventRecord> change);

    boolean deleteEvent(long eventId);

    @Nullable ServerConnection getServerConnection(long userId);

    ServerConnection updateServerConnection(ServerConnection connection);
}

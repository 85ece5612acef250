package de.bycsitsm.calsync.caldav;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * The CalDAV operations the synchronization engine depends on. All methods
 * throw {@link CalDavException} on failure; {@link #login} throws
 * {@link CalDavAuthenticationException} when the credentials are rejected.
 */
public interface CalDavAdapter {

    void login(CalDavCredentials credentials);

    List<CalDavCalendar> fetchCalendars(CalDavCredentials credentials);

    List<CalDavObject> fetchCalendarObjects(CalDavCredentials credentials, CalDavCalendar calendar);

    /**
     * Stores a calendar object.
     *
     * @param objectUrl the absolute URL of the object
     * @param ics       the iCalendar text
     * @param etag      the expected current entity tag, sent as {@code If-Match}; {@code null} for an unconditional PUT
     * @return the new entity tag, or {@code null} if the server did not report one
     */
    @Nullable String putCalendarObject(CalDavCredentials credentials, String objectUrl, String ics, @Nullable String etag);

    /**
     * Deletes a calendar object. Deleting an object that no longer exists is not an error.
     */
    void deleteCalendarObject(CalDavCredentials credentials, String objectUrl, @Nullable String etag);
}

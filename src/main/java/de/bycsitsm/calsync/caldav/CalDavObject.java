package de.bycsitsm.calsync.caldav;

import org.jspecify.annotations.Nullable;

/**
 * A calendar object resource as returned by a {@code calendar-query} REPORT.
 *
 * @param url          the absolute URL of the object
 * @param etag         the entity tag, if the server reported one
 * @param calendarData the iCalendar text of the object
 */
public record CalDavObject(
        String url,
        @Nullable String etag,
        String calendarData
) {
}

package de.bycsitsm.calsync.caldav;

import org.jspecify.annotations.Nullable;

/**
 * Represents a calendar collection discovered on a CalDAV server.
 *
 * @param displayName the human-readable name of the calendar
 * @param url         the absolute URL of the calendar collection, ending with a slash
 * @param description an optional description of the calendar
 * @param color       an optional color as {@code #RRGGBB}
 * @param ctag        an optional CTag for change detection
 */
public record CalDavCalendar(
        String displayName,
        String url,
        @Nullable String description,
        @Nullable String color,
        @Nullable String ctag
) {
}

package de.bycsitsm.calsync.model;

import org.jspecify.annotations.Nullable;

/**
 * A locally stored calendar, optionally mirrored from a remote CalDAV collection.
 *
 * @param id          the store-assigned id, or {@code null} before creation
 * @param userId      the owning user
 * @param name        the display name
 * @param color       the display color as hex string
 * @param url         the remote collection URL, or {@code null} for a local-only calendar
 * @param syncToken   the time of the last successful sync of this calendar
 * @param enabled     whether the calendar is shown and synced
 * @param description an optional description from the remote collection
 */
public record Calendar(
        @Nullable Long id,
        long userId,
        String name,
        String color,
        @Nullable String url,
        @Nullable String syncToken,
        boolean enabled,
        @Nullable String description
) {

    public static final String DEFAULT_COLOR = "#3788d8";

    public boolean isRemote() {
        return url != null && !url.isBlank();
    }

    public Calendar withId(long newId) {
        return new Calendar(newId, userId, name, color, url, syncToken, enabled, description);
    }

    public Calendar withRemoteState(String newName, String newUrl, String newSyncToken) {
        return new Calendar(id, userId, newName, color, newUrl, newSyncToken, enabled, description);
    }

    public Calendar withSyncToken(String newSyncToken) {
        return new Calendar(id, userId, name, color, url, newSyncToken, enabled, description);
    }

    public Calendar withAppearance(String newColor, @Nullable String newDescription) {
        return new Calendar(id, userId, name, newColor, url, syncToken, enabled, newDescription);
    }
}

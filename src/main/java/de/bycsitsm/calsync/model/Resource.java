package de.bycsitsm.calsync.model;

import org.jspecify.annotations.Nullable;

/**
 * A bookable resource (room, projector, ...) invited to an event.
 *
 * @param name       the display name of the resource
 * @param adminEmail the address that administers the resource
 * @param type       the resource type, e.g. {@code Projector}
 */
public record Resource(
        String name,
        String adminEmail,
        @Nullable String type
) implements Participant {

    @Override
    public String email() {
        return adminEmail;
    }
}

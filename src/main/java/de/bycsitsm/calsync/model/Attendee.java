package de.bycsitsm.calsync.model;

import org.jspecify.annotations.Nullable;

/**
 * A human participant of an event.
 *
 * @param email          the participant's address
 * @param name           the common name ({@code CN}), if known
 * @param role           the participation role, e.g. {@code REQ-PARTICIPANT}
 * @param status         the participation status ({@code PARTSTAT}), e.g. {@code ACCEPTED}
 * @param scheduleStatus the server-reported {@code SCHEDULE-STATUS}, if any
 */
public record Attendee(
        String email,
        @Nullable String name,
        @Nullable String role,
        @Nullable String status,
        @Nullable String scheduleStatus
) implements Participant {

    public Attendee(String email, @Nullable String name) {
        this(email, name, "REQ-PARTICIPANT", "NEEDS-ACTION", null);
    }
}

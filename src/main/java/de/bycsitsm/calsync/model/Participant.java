package de.bycsitsm.calsync.model;

/**
 * A calendar user address attached to an event. Every {@code ATTENDEE} line is
 * resolved into exactly one of {@link Attendee} or {@link Resource} when the
 * event is parsed; later stages only deal with the resolved type.
 */
public sealed interface Participant permits Attendee, Resource {

    /**
     * The address the participant is reached at, without the {@code mailto:} prefix.
     */
    String email();
}

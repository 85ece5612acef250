package de.bycsitsm.calsync.ics;

/**
 * A standards-conformant iCalendar parser. Implementations read the first
 * master {@code VEVENT} of a calendar object and fail with an
 * {@link IcsParseException} when the text cannot be parsed.
 */
public interface IcsParsingFacility {

    /**
     * Parses the given calendar object.
     *
     * @param ics the iCalendar text
     * @return the properties of the event
     * @throws IcsParseException if the text is not parseable or contains no {@code VEVENT}
     */
    ParsedComponent parseEvent(String ics);
}

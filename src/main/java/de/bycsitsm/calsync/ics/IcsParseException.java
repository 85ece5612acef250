package de.bycsitsm.calsync.ics;

/**
 * Exception thrown when iCalendar text cannot be parsed.
 */
public class IcsParseException extends RuntimeException {

    public IcsParseException(String message) {
        super(message);
    }

    public IcsParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

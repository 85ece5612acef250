package de.bycsitsm.calsync.caldav;

/**
 * Exception thrown when a CalDAV operation fails.
 */
public class CalDavException extends RuntimeException {

    private final int statusCode;

    public CalDavException(String message) {
        this(message, 0);
    }

    public CalDavException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CalDavException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * Returns the HTTP status that caused the failure, or 0 for network and parse errors.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

package de.bycsitsm.calsync.caldav;

/**
 * Thrown when the server rejects the configured credentials.
 */
public class CalDavAuthenticationException extends CalDavException {

    public CalDavAuthenticationException(String message) {
        super(message, 401);
    }
}

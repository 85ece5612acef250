package de.bycsitsm.calsync.caldav;

import de.bycsitsm.calsync.model.ServerConnection;

/**
 * Server URL and Basic authentication credentials.
 */
public record CalDavCredentials(String url, String username, String password) {

    public static CalDavCredentials of(ServerConnection connection) {
        return new CalDavCredentials(connection.url(), connection.username(), connection.password());
    }

    @Override
    public String toString() {
        return "CalDavCredentials[url=" + url + ", username=" + username + "]";
    }
}

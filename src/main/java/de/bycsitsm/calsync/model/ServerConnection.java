package de.bycsitsm.calsync.model;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * A user's connection to a remote CalDAV server.
 *
 * @param userId       the owning user
 * @param url          the CalDAV server URL
 * @param username     the username for Basic authentication
 * @param password     the password for Basic authentication
 * @param syncInterval the periodic sync interval, or {@code null} for the configured default
 * @param autoSync     whether periodic sync is enabled
 * @param status       the result of the last sync pass
 * @param lastSync     the completion time of the last successful pass
 */
public record ServerConnection(
        long userId,
        String url,
        String username,
        String password,
        @Nullable Duration syncInterval,
        boolean autoSync,
        ConnectionStatus status,
        @Nullable Instant lastSync
) {

    public ServerConnection withStatus(ConnectionStatus newStatus) {
        return new ServerConnection(userId, url, username, password, syncInterval, autoSync, newStatus, lastSync);
    }

    public ServerConnection withSyncCompleted(Instant completedAt) {
        return new ServerConnection(userId, url, username, password, syncInterval, autoSync,
                ConnectionStatus.CONNECTED, completedAt);
    }

    public ServerConnection withAutoSync(boolean enabled) {
        return new ServerConnection(userId, url, username, password, syncInterval, enabled, status, lastSync);
    }

    public ServerConnection withSyncInterval(Duration interval) {
        return new ServerConnection(userId, url, username, password, interval, autoSync, status, lastSync);
    }

    @Override
    public String toString() {
        // Keep the password out of log output
        return "ServerConnection[userId=" + userId + ", url=" + url + ", username=" + username
                + ", autoSync=" + autoSync + ", status=" + status + ", lastSync=" + lastSync + "]";
    }
}

package de.bycsitsm.calsync.sync;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of a user's sync state.
 *
 * @param configured whether a sync job exists for the user
 * @param syncing    whether periodic sync is armed
 * @param lastSync   the completion time of the last successful pass
 * @param interval   the periodic sync interval
 * @param inProgress whether a pass is running right now
 * @param autoSync   whether the connection has periodic sync enabled
 */
public record SyncStatusSnapshot(
        boolean configured,
        boolean syncing,
        @Nullable Instant lastSync,
        Duration interval,
        boolean inProgress,
        boolean autoSync
) {

    static SyncStatusSnapshot unconfigured(Duration defaultInterval) {
        return new SyncStatusSnapshot(false, false, null, defaultInterval, false, false);
    }
}

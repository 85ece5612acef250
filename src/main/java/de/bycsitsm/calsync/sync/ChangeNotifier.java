package de.bycsitsm.calsync.sync;

import org.jspecify.annotations.Nullable;

/**
 * Fire-and-forget notification of connected clients about changed data.
 * Implementations must not throw and must not block the caller for long.
 */
public interface ChangeNotifier {

    /**
     * @param userId   the user whose data changed
     * @param targetId the id of the changed event or calendar, if any
     * @param type     what changed
     */
    void notify(long userId, @Nullable Long targetId, ChangeType type);
}

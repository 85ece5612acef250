package de.bycsitsm.calsync.sync;

import java.util.Set;

/**
 * Knows which users currently have an active UI session.
 */
public interface ActiveUserSource {

    Set<Long> activeUserIds();

    void sessionStarted(long userId);

    void sessionEnded(long userId);
}

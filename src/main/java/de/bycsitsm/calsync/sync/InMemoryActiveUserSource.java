package de.bycsitsm.calsync.sync;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ActiveUserSource} fed by session setup and logout.
 */
@Component
public class InMemoryActiveUserSource implements ActiveUserSource {

    private final Set<Long> active = ConcurrentHashMap.newKeySet();

    @Override
    public Set<Long> activeUserIds() {
        return Set.copyOf(active);
    }

    @Override
    public void sessionStarted(long userId) {
        active.add(userId);
    }

    @Override
    public void sessionEnded(long userId) {
        active.remove(userId);
    }
}

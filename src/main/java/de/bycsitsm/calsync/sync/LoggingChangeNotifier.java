package de.bycsitsm.calsync.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ChangeNotifier} that only logs. Replaced by a push transport where clients are connected.
 */
@Component
class LoggingChangeNotifier implements ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingChangeNotifier.class);

    @Override
    public void notify(long userId, @Nullable Long targetId, ChangeType type) {
        log.debug("Change for user {}: {} {}", userId, type, targetId);
    }
}

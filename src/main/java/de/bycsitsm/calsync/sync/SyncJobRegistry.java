package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.CalSyncProperties;
import de.bycsitsm.calsync.model.ServerConnection;
import de.bycsitsm.calsync.store.CalendarStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link SyncJob} per user and decides when sync passes run.
 * <p>
 * Jobs are reference counted by UI sessions: {@link #setupSyncForUser} creates
 * or shares a job, {@link #handleUserLogout} tears it down after the last
 * session ended. Each job may carry a periodic ticker. Independently, a global
 * ticker sweeps all users with an active session so that remote changes are
 * discovered even without an explicit request.
 * <p>
 * At most one pass runs per user. A forced request made while a pass is
 * running queues exactly one follow-up pass; later forced requests replace the
 * queued options. Non-forced requests made while busy are dropped.
 */
@Service
public class SyncJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(SyncJobRegistry.class);

    private final Map<Long, SyncJob> jobs = new ConcurrentHashMap<>();

    private final CalendarSyncOrchestrator orchestrator;
    private final CalendarStore store;
    private final SyncScheduler scheduler;
    private final ActiveUserSource activeUsers;
    private final Duration defaultInterval;
    private final Duration globalInterval;

    private SyncScheduler.@Nullable Ticker globalTicker;

    SyncJobRegistry(CalendarSyncOrchestrator orchestrator, CalendarStore store, SyncScheduler scheduler,
                    ActiveUserSource activeUsers, CalSyncProperties properties) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.scheduler = scheduler;
        this.activeUsers = activeUsers;
        this.defaultInterval = properties.defaultSyncInterval();
        this.globalInterval = properties.globalSyncInterval();
    }

    @PostConstruct
    void start() {
        globalTicker = scheduler.schedulePeriodically(this::syncActiveUsers, globalInterval);
        log.info("Global sync armed every {}", globalInterval);
    }

    /**
     * Stops every job. Running passes finish on their own.
     */
    @PreDestroy
    void shutdown() {
        if (globalTicker != null) {
            globalTicker.cancel();
            globalTicker = null;
        }
        jobs.values().forEach(this::disarm);
        log.info("Stopped {} sync job(s)", jobs.size());
        jobs.clear();
    }

    /**
     * Registers a UI session of a user. Creates the user's job on the first
     * session; with auto sync enabled, arms the periodic ticker and requests an
     * immediate forced pass.
     */
    public void setupSyncForUser(long userId, ServerConnection connection) {
        var job = jobs.compute(userId, (id, existing) -> {
            if (existing == null) {
                return new SyncJob(connection, intervalOf(connection));
            }
            existing.connection(connection);
            return existing;
        });
        int sessions = job.incrementSessions();
        activeUsers.sessionStarted(userId);
        log.info("Sync set up for user {} ({} session(s))", userId, sessions);

        if (connection.autoSync()) {
            job.autoSync(true);
            startSync(userId);
            scheduler.submit(() -> syncNow(userId, SyncOptions.forced()));
        }
    }

    /**
     * Ends a UI session. The job is stopped and removed when no session is left.
     */
    public void handleUserLogout(long userId) {
        var job = jobs.get(userId);
        if (job == null) {
            return;
        }
        if (job.decrementSessions() == 0) {
            disarm(job);
            jobs.remove(userId, job);
            activeUsers.sessionEnded(userId);
            log.info("Removed sync job of user {}", userId);
        }
    }

    /**
     * Arms the periodic ticker of a user's job.
     *
     * @return {@code false} if the user has no job
     */
    public boolean startSync(long userId) {
        var job = jobs.get(userId);
        if (job == null) {
            return false;
        }
        synchronized (job) {
            job.stopRequested(false);
            if (!job.isArmed()) {
                job.ticker(scheduler.schedulePeriodically(() -> runScheduled(job), job.interval()));
                log.debug("Periodic sync armed for user {} every {}", userId, job.interval());
            }
        }
        return true;
    }

    /**
     * Disarms the periodic ticker of a user's job. A running pass is not interrupted.
     */
    public void stopSync(long userId) {
        var job = jobs.get(userId);
        if (job != null) {
            disarm(job);
        }
    }

    /**
     * Runs a sync pass on the calling thread. If a pass is already running,
     * a forced request is queued behind it and a normal request is skipped;
     * both count as success.
     *
     * @return {@code false} if the user has no server connection or the pass failed
     */
    public boolean syncNow(long userId, SyncOptions options) {
        var job = jobOrLoad(userId);
        if (job == null) {
            log.debug("No server connection for user {}, nothing to sync", userId);
            return false;
        }
        if (!job.tryStart()) {
            if (options.forceRefresh()) {
                job.queue(options);
                log.debug("Sync for user {} is running, queued follow-up pass", userId);
            } else {
                log.debug("Sync for user {} is already running", userId);
            }
            return true;
        }
        return runAndDrain(job, options);
    }

    /**
     * Requests a forced pass on the scheduler.
     *
     * @return {@code false} if the user has no server connection
     */
    public boolean requestSync(long userId, SyncOptions options) {
        if (jobOrLoad(userId) == null) {
            return false;
        }
        scheduler.submit(() -> syncNow(userId, options));
        return true;
    }

    public SyncStatusSnapshot getSyncStatus(long userId) {
        var job = jobs.get(userId);
        if (job == null) {
            return SyncStatusSnapshot.unconfigured(defaultInterval);
        }
        return new SyncStatusSnapshot(true, job.isArmed(), job.lastSync(), job.interval(), job.isRunning(),
                job.autoSync());
    }

    /**
     * Changes and persists the periodic interval. An armed ticker is re-armed.
     */
    public void updateSyncInterval(long userId, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sync interval must be positive: " + interval);
        }
        var connection = store.getServerConnection(userId);
        if (connection != null) {
            connection = connection.withSyncInterval(interval);
            store.updateServerConnection(connection);
        }
        var job = jobs.get(userId);
        if (job == null) {
            return;
        }
        synchronized (job) {
            if (connection != null) {
                job.connection(connection);
            }
            job.interval(interval);
            if (job.isArmed()) {
                disarm(job);
                startSync(userId);
            }
        }
    }

    /**
     * Enables or disables periodic sync and persists the choice.
     */
    public void updateAutoSync(long userId, boolean autoSync) {
        var connection = store.getServerConnection(userId);
        if (connection != null) {
            connection = connection.withAutoSync(autoSync);
            store.updateServerConnection(connection);
        }
        var job = jobs.get(userId);
        if (job == null) {
            return;
        }
        if (connection != null) {
            job.connection(connection);
        }
        job.autoSync(autoSync);
        if (autoSync) {
            startSync(userId);
        } else {
            stopSync(userId);
        }
    }

    /**
     * One sweep of the global ticker. Prunes jobs of inactive users and submits
     * a pass for every active user with a server connection.
     */
    void syncActiveUsers() {
        var active = activeUsers.activeUserIds();
        for (var userId : jobs.keySet()) {
            if (!active.contains(userId)) {
                var job = jobs.remove(userId);
                if (job != null) {
                    disarm(job);
                    log.debug("Pruned sync job of inactive user {}", userId);
                }
            }
        }
        for (var userId : active) {
            var job = jobs.get(userId);
            if (job != null && job.isRunning()) {
                continue;
            }
            if (store.getServerConnection(userId) == null) {
                continue;
            }
            // one pass per user on the pool, so a slow server delays only its own user
            scheduler.submit(() -> {
                try {
                    syncNow(userId, SyncOptions.defaults());
                } catch (RuntimeException e) {
                    log.error("Global sync for user {} failed", userId, e);
                }
            });
        }
    }

    boolean hasJob(long userId) {
        return jobs.containsKey(userId);
    }

    private void runScheduled(SyncJob job) {
        if (job.stopRequested()) {
            return;
        }
        try {
            syncNow(job.userId(), SyncOptions.defaults());
        } catch (RuntimeException e) {
            log.error("Scheduled sync for user {} failed", job.userId(), e);
        }
    }

    /**
     * Runs a pass on a started job, then hands a queued follow-up pass to the scheduler.
     */
    private boolean runAndDrain(SyncJob job, SyncOptions options) {
        boolean result;
        try {
            result = orchestrator.runPass(job.connection(), options);
            var stored = store.getServerConnection(job.userId());
            if (stored != null) {
                job.connection(stored);
            }
        } catch (RuntimeException e) {
            job.abort();
            throw e;
        }
        var next = job.finish();
        if (next != null) {
            log.debug("Running queued sync pass for user {}", job.userId());
            scheduler.submit(() -> runAndDrain(job, next));
        }
        return result;
    }

    private @Nullable SyncJob jobOrLoad(long userId) {
        var job = jobs.get(userId);
        if (job != null) {
            return job;
        }
        var connection = store.getServerConnection(userId);
        if (connection == null) {
            return null;
        }
        return jobs.computeIfAbsent(userId, id -> new SyncJob(connection, intervalOf(connection)));
    }

    private void disarm(SyncJob job) {
        synchronized (job) {
            job.stopRequested(true);
            var ticker = job.ticker();
            if (ticker != null) {
                ticker.cancel();
                job.ticker(null);
            }
        }
    }

    private Duration intervalOf(ServerConnection connection) {
        var interval = connection.syncInterval();
        return interval != null && !interval.isZero() && !interval.isNegative() ? interval : defaultInterval;
    }
}

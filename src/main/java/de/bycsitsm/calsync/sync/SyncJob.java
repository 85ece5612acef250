package de.bycsitsm.calsync.sync;

import de.bycsitsm.calsync.model.ServerConnection;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-user sync state held by the {@link SyncJobRegistry}. All access is
 * synchronized on the job.
 */
final class SyncJob {

    private final long userId;
    private ServerConnection connection;
    private Duration interval;
    private boolean autoSync;
    private SyncScheduler.@Nullable Ticker ticker;
    private boolean running;
    private boolean stopRequested;
    private @Nullable Instant lastSync;
    private int sessionCount;
    private @Nullable SyncOptions queued;

    SyncJob(ServerConnection connection, Duration interval) {
        this.userId = connection.userId();
        this.connection = connection;
        this.interval = interval;
        this.autoSync = connection.autoSync();
        this.lastSync = connection.lastSync();
    }

    long userId() {
        return userId;
    }

    synchronized ServerConnection connection() {
        return connection;
    }

    synchronized void connection(ServerConnection connection) {
        this.connection = connection;
        if (connection.lastSync() != null) {
            this.lastSync = connection.lastSync();
        }
    }

    synchronized Duration interval() {
        return interval;
    }

    synchronized void interval(Duration interval) {
        this.interval = interval;
    }

    synchronized boolean autoSync() {
        return autoSync;
    }

    synchronized void autoSync(boolean autoSync) {
        this.autoSync = autoSync;
    }

    synchronized SyncScheduler.@Nullable Ticker ticker() {
        return ticker;
    }

    synchronized void ticker(SyncScheduler.@Nullable Ticker ticker) {
        this.ticker = ticker;
    }

    synchronized boolean isArmed() {
        return ticker != null && !ticker.isCancelled();
    }

    synchronized boolean isRunning() {
        return running;
    }

    synchronized boolean stopRequested() {
        return stopRequested;
    }

    synchronized void stopRequested(boolean stopRequested) {
        this.stopRequested = stopRequested;
    }

    synchronized @Nullable Instant lastSync() {
        return lastSync;
    }

    synchronized int incrementSessions() {
        return ++sessionCount;
    }

    synchronized int decrementSessions() {
        sessionCount = Math.max(0, sessionCount - 1);
        return sessionCount;
    }

    synchronized int sessionCount() {
        return sessionCount;
    }

    /**
     * Marks the job as running.
     *
     * @return {@code false} if a pass is already running
     */
    synchronized boolean tryStart() {
        if (running) {
            return false;
        }
        running = true;
        return true;
    }

    /**
     * Queues one follow-up pass; a later request replaces an earlier queued one.
     */
    synchronized void queue(SyncOptions options) {
        this.queued = options;
    }

    synchronized boolean hasQueued() {
        return queued != null;
    }

    /**
     * Ends the current pass. If a follow-up pass is queued, the job stays
     * running and the queued options are returned.
     */
    synchronized @Nullable SyncOptions finish() {
        var next = queued;
        queued = null;
        if (next == null) {
            running = false;
        }
        return next;
    }

    /**
     * Clears the running state without starting a queued pass.
     */
    synchronized void abort() {
        queued = null;
        running = false;
    }

    @Override
    public synchronized String toString() {
        return "SyncJob[userId=" + userId + ", running=" + running + ", sessions=" + sessionCount
                + ", armed=" + isArmed() + "]";
    }
}

package de.bycsitsm.calsync.sync;

import java.time.Duration;

/**
 * Runs sync work off the caller's thread. Periodic tasks are represented by a
 * {@link Ticker} that acts as cancellation token.
 */
public interface SyncScheduler {

    /**
     * Runs {@code task} every {@code period}, the first time one period from now.
     */
    Ticker schedulePeriodically(Runnable task, Duration period);

    /**
     * Runs {@code task} once, as soon as possible.
     */
    void submit(Runnable task);

    interface Ticker {

        /**
         * Stops future executions. An execution in progress is not interrupted.
         */
        void cancel();

        boolean isCancelled();
    }
}

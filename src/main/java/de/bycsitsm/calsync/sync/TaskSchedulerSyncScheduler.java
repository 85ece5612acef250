package de.bycsitsm.calsync.sync;

import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link SyncScheduler} on top of Spring's {@link ThreadPoolTaskScheduler}.
 */
@Component
class TaskSchedulerSyncScheduler implements SyncScheduler {

    private final ThreadPoolTaskScheduler taskScheduler;
    private final Clock clock;

    TaskSchedulerSyncScheduler(ThreadPoolTaskScheduler syncTaskScheduler, Clock clock) {
        this.taskScheduler = syncTaskScheduler;
        this.clock = clock;
    }

    @Override
    public Ticker schedulePeriodically(Runnable task, Duration period) {
        var future = taskScheduler.scheduleAtFixedRate(task, clock.instant().plus(period), period);
        return new FutureTicker(future);
    }

    @Override
    public void submit(Runnable task) {
        taskScheduler.execute(task);
    }

    private record FutureTicker(ScheduledFuture<?> future) implements Ticker {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}

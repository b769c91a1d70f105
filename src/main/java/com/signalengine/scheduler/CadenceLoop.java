package com.signalengine.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Runs a task repeatedly on a {@link TaskScheduler}, one run at a time.
 *
 * <p>Each run schedules the next one when it finishes: after {@code cadence} on success, or
 * after an exponential backoff on failure ({@code initialBackoff}, doubled per consecutive
 * failure, capped at {@code maxBackoff}). The cancellation flag is checked before every run
 * and before every reschedule, so {@link #cancel()} stops the loop at the next suspension
 * point even if a run is in progress.
 */
public class CadenceLoop {

    private static final Logger log = LoggerFactory.getLogger(CadenceLoop.class);

    private final String name;
    private final Runnable task;
    private final TaskScheduler taskScheduler;
    private final Duration cadence;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> nextRun;
    private volatile int consecutiveFailures;

    public CadenceLoop(
            String name,
            Runnable task,
            TaskScheduler taskScheduler,
            Duration cadence,
            Duration initialBackoff,
            Duration maxBackoff,
            Clock clock) {
        this.name = name;
        this.task = task;
        this.taskScheduler = taskScheduler;
        this.cadence = cadence;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.clock = clock;
    }

    /** Schedules the first run immediately. Later calls are no-ops. */
    public void start() {
        if (started.compareAndSet(false, true)) {
            log.info("Cadence loop '{}' started (every {}s)", name, cadence.toSeconds());
            scheduleNext(Duration.ZERO);
        }
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            ScheduledFuture<?> future = nextRun;
            if (future != null) {
                future.cancel(false);
            }
            log.info("Cadence loop '{}' cancelled", name);
        }
    }

    public boolean isRunning() {
        return started.get() && !cancelled.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /** Delay before the next run after {@code failures} consecutive failures. */
    Duration backoff(int failures) {
        if (failures <= 0) {
            return cadence;
        }
        Duration delay = initialBackoff;
        for (int i = 1; i < failures && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    void runOnce() {
        if (cancelled.get()) {
            return;
        }

        Duration delay;
        try {
            task.run();
            consecutiveFailures = 0;
            delay = cadence;
        } catch (RuntimeException e) {
            consecutiveFailures++;
            delay = backoff(consecutiveFailures);
            log.warn(
                    "Cadence loop '{}' run failed ({} in a row), retrying in {}s: {}",
                    name,
                    consecutiveFailures,
                    delay.toSeconds(),
                    e.getMessage(),
                    e);
        }

        if (!cancelled.get()) {
            scheduleNext(delay);
        }
    }

    private void scheduleNext(Duration delay) {
        nextRun = taskScheduler.schedule(this::runOnce, clock.instant().plus(delay));
    }
}

package com.questrail.coord.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Deadline conversion</h2>
 * <p>Deadlines are converted to relative delays against the supplied
 * {@link MonotonicClock} at scheduling time. Callers must compute deadlines
 * with the same clock instance. A deadline already in the past runs with zero
 * delay.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>The executor is not owned here. {@code CoordinationRuntime} shuts down the
 * executor it creates; callers that pass their own executor shut it down
 * themselves.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // never interrupt a window callback that is already running
        return () -> future.cancel(false);
    }
}

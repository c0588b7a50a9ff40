package com.questrail.coord.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Cooperative wakeup source used by the timer-based primitives.
 *
 * <p>
 * A scheduled task is a callback, never a blocking sleep. Implementations may
 * run the task on any thread; the primitives guard their own state.
 * </p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds, as read from {@link MonotonicClock#nowNanos()}
     * @param task          callback to run
     * @return handle that cancels the wakeup
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task {@code delay} after the clock's current reading.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}

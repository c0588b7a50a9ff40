package com.questrail.coord.internal.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <p>Suited to processes that hold many debounce or batch instances with short
 * windows: the wheel keeps one worker thread and amortizes wakeups into ticks.
 * Precision is bounded by the wheel's tick duration, so a wakeup may run up to
 * one tick late but never early.</p>
 *
 * <p>The timer is not owned here; {@link Timer#stop()} is the caller's job.</p>
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler {

    private final Timer timer;
    private final MonotonicClock clock;

    public HashedWheelTimerScheduler(Timer timer, MonotonicClock clock) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }
}

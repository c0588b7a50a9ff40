package com.questrail.coord.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP or manual clock changes. Tests use a manual clock
 * instead so that windows can be stepped deterministically.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}

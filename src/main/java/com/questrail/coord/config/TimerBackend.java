package com.questrail.coord.config;

/**
 * Substrate a {@code CoordinationRuntime} uses to fire window timers.
 */
public enum TimerBackend {
    /** Single-thread {@code ScheduledExecutorService}. Precise; one heap entry per timer. */
    EXECUTOR,
    /** Netty {@code HashedWheelTimer}. Coarser (one tick); cheap for many short timers. */
    HASHED_WHEEL
}

package com.questrail.coord.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for coordination windows.
 *
 * <h2>Binding invariant</h2>
 * Interval gating in the debounce and batch primitives MUST be measured on a
 * monotonic source. Wall-clock time is used only to stamp observability
 * events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}

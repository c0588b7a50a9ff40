package com.questrail.coord.config;

import java.time.Duration;
import java.util.Objects;

/**
 * CoordinationTiming
 * -----------------------------------------------------------------------------
 * Window configuration for the timer-based primitives (debounce and batch).
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>interval</b>: minimum time between the starts of two consecutive
 *       executions. A debounce with a zero or negative interval is a plain
 *       pass-through; a batch requires a non-negative interval.</li>
 *   <li><b>disregardExecutionTime</b>: when {@code false} (the default) the
 *       next execution waits for both the interval and the previous
 *       execution, so executions never overlap. When {@code true} the next
 *       execution starts on the interval alone and may overlap.</li>
 * </ul>
 */
public record CoordinationTiming(
        Duration interval,
        boolean disregardExecutionTime
) {
    public CoordinationTiming {
        Objects.requireNonNull(interval, "interval");
    }

    /**
     * Window of {@code interval} that waits for the previous execution.
     */
    public static CoordinationTiming of(Duration interval) {
        return new CoordinationTiming(interval, false);
    }

    public static CoordinationTiming ofMillis(long intervalMillis) {
        return of(Duration.ofMillis(intervalMillis));
    }

    /**
     * No window at all. Only meaningful for debounce.
     */
    public static CoordinationTiming passThrough() {
        return new CoordinationTiming(Duration.ZERO, false);
    }

    public CoordinationTiming withDisregardExecutionTime(boolean disregard) {
        return new CoordinationTiming(interval, disregard);
    }

    public boolean isPassThrough() {
        return interval.isZero() || interval.isNegative();
    }
}

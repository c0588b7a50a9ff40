package com.questrail.coord.core;

import com.questrail.coord.internal.time.SystemWallClock;
import com.questrail.coord.observability.CoordinationCancelEvent;
import com.questrail.coord.observability.CoordinationErrorEvent;
import com.questrail.coord.observability.CoordinationExecutionEvent;
import com.questrail.coord.observability.CoordinationObservabilitySink;
import com.questrail.coord.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Naming and observability plumbing common to the primitives.
 *
 * <p>Events are stamped with wall-clock time for readability only.</p>
 */
abstract class ObservedPrimitive {

    private final String name;
    private final CoordinationObservabilitySink observabilitySink;
    private final AtomicLong rounds = new AtomicLong();

    ObservedPrimitive(String name, CoordinationObservabilitySink observabilitySink) {
        this.name = Objects.requireNonNull(name, "name");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public final String name() {
        return name;
    }

    /**
     * Number of executions of the wrapped function started so far.
     */
    public final long executionCount() {
        return rounds.get();
    }

    final void executionStarted(int callers) {
        observabilitySink.onExecution(new CoordinationExecutionEvent(
            SystemWallClock.INSTANCE.now(), name, rounds.incrementAndGet(), callers));
    }

    final void roundCancelled(long epoch, long latestEpoch) {
        observabilitySink.onCancel(new CoordinationCancelEvent(
            SystemWallClock.INSTANCE.now(), name, epoch, latestEpoch));
    }

    final void callbackFailed(String message, Throwable cause) {
        observabilitySink.onError(new CoordinationErrorEvent(
            SystemWallClock.INSTANCE.now(), name, message, cause));
    }
}

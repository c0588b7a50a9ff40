package com.questrail.coord.core;

import com.questrail.coord.api.AsyncFunction;
import com.questrail.coord.observability.CoordinationObservabilitySink;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Once
 * =============================================================================
 * Single-flight initialization: the wrapped function runs on the first call
 * and never again.
 *
 * <p>Every caller, concurrent with the first or arriving later, receives the
 * outcome of that first run. A failure is cached just like a value; there is
 * no retry. Arguments of calls after the first are ignored.</p>
 *
 * <pre>
 *   Once&lt;Void, Connection&gt; connect = Once.of(ignored -&gt; pool.openAsync());
 *   connect.invoke(null);   // opens
 *   connect.invoke(null);   // same connection, no second open
 * </pre>
 */
public final class Once<A, T> extends ObservedPrimitive implements AsyncFunction<A, T> {

    private final AsyncFunction<A, T> fn;
    private final Object stateLock = new Object();

    private CompletableFuture<T> outcome;

    public Once(AsyncFunction<A, T> fn, String name, CoordinationObservabilitySink observabilitySink) {
        super(name, observabilitySink);
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    public static <A, T> Once<A, T> of(AsyncFunction<A, T> fn) {
        return new Once<>(fn, "once", null);
    }

    public CompletableFuture<T> invoke(A args) {
        final CompletableFuture<T> shared;
        final boolean first;

        synchronized (stateLock) {
            first = outcome == null;
            if (first) {
                outcome = new CompletableFuture<>();
            }
            shared = outcome;
        }

        if (first) {
            executionStarted(1);
            Futures.propagate(Futures.invoke(fn, args), shared);
        }
        return Futures.copyOf(shared);
    }

    @Override
    public CompletableFuture<T> apply(A args) {
        return invoke(args);
    }

    public boolean isStarted() {
        synchronized (stateLock) {
            return outcome != null;
        }
    }

    /**
     * {@code true} once the first run has completed, successfully or not.
     */
    public boolean isDone() {
        synchronized (stateLock) {
            return outcome != null && outcome.isDone();
        }
    }
}

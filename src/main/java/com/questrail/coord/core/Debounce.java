package com.questrail.coord.core;

import com.questrail.coord.api.AsyncFunction;
import com.questrail.coord.config.CoordinationTiming;
import com.questrail.coord.internal.time.MonotonicClock;
import com.questrail.coord.internal.time.MonotonicScheduler;
import com.questrail.coord.observability.CoordinationObservabilitySink;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Debounce
 * =============================================================================
 * Coalesces bursts of calls into at most one execution per interval.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>A call while idle executes immediately.</li>
 *   <li>A call while busy is queued. A later call replaces the queued
 *       arguments; every queued caller shares the one execution that runs with
 *       the latest arguments.</li>
 *   <li>The queued execution starts when the {@link IntervalGate} window
 *       opens: {@code max(interval, executionTime)} after the previous start,
 *       or strictly {@code interval} with {@code disregardExecutionTime}.</li>
 *   <li>An interval of zero or less disables coalescing entirely.</li>
 * </ul>
 *
 * <p>Unlike a naive reset-on-every-call debounce, a constant stream of calls
 * cannot starve the function: it keeps firing once per window.</p>
 *
 * <p>If the scheduler refuses a window timer (for instance because the
 * runtime was closed), the execution is not started, its callers fail with
 * the refusal and the instance returns to idle.</p>
 */
public final class Debounce<A, T> extends ObservedPrimitive implements AsyncFunction<A, T>, TimedPrimitive {

    private sealed interface State<A, T> permits Idle, Busy {
    }

    private record Idle<A, T>() implements State<A, T> {
    }

    /**
     * @param window  window of the execution that made the primitive busy
     * @param next    queued call, or {@code null} if nothing arrived since the last start
     * @param callers number of callers sharing {@code next}
     */
    private record Busy<A, T>(IntervalGate.Window window, PendingCall<A, T> next, int callers)
            implements State<A, T> {
    }

    private final AsyncFunction<A, T> fn;
    private final IntervalGate gate;
    private final Object stateLock = new Object();

    private State<A, T> state = new Idle<>();

    private Debounce(Builder<A, T> builder) {
        super(builder.name, builder.observabilitySink);
        this.fn = Objects.requireNonNull(builder.fn, "fn");
        CoordinationTiming timing = Objects.requireNonNull(builder.timing, "timing");
        this.gate = timing.isPassThrough()
                ? null
                : new IntervalGate(timing, builder.clock, builder.scheduler);
    }

    public static <A, T> Builder<A, T> builder(AsyncFunction<A, T> fn) {
        return new Builder<>(fn);
    }

    public CompletableFuture<T> invoke(A args) {
        if (gate == null) {
            executionStarted(1);
            return Futures.invoke(fn, args);
        }

        final CompletableFuture<T> queued;
        final IntervalGate.Window window;
        synchronized (stateLock) {
            if (state instanceof Busy<A, T> busy) {
                PendingCall<A, T> next = busy.next() == null
                        ? PendingCall.of(args)
                        : busy.next().withArgs(args);
                state = new Busy<>(busy.window(), next, busy.callers() + 1);
                queued = next.future();
                window = null;
            } else {
                window = gate.newWindow();
                state = new Busy<>(window, null, 0);
                queued = null;
            }
        }

        if (queued != null) {
            return Futures.copyOf(queued);
        }
        return Futures.copyOf(execute(window, args, 1));
    }

    @Override
    public CompletableFuture<T> apply(A args) {
        return invoke(args);
    }

    /**
     * {@code true} while an execution or its window is outstanding.
     */
    public boolean isBusy() {
        synchronized (stateLock) {
            return state instanceof Busy;
        }
    }

    @Override
    public int abandon(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        final Busy<A, T> abandoned;
        synchronized (stateLock) {
            if (!(state instanceof Busy<A, T> busy)) {
                return 0;
            }
            abandoned = busy;
            state = new Idle<>();
        }

        abandoned.window().cancel();
        if (abandoned.next() == null) {
            return 0;
        }
        abandoned.next().future().completeExceptionally(cause);
        return abandoned.callers();
    }

    private CompletableFuture<T> execute(IntervalGate.Window window, A args, int callers) {
        try {
            return window.run(() -> {
                executionStarted(callers);
                return Futures.invoke(fn, args);
            }, () -> windowOpened(window));
        } catch (RuntimeException e) {
            windowRefused(window, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private void windowOpened(IntervalGate.Window window) {
        final PendingCall<A, T> next;
        final int callers;
        final IntervalGate.Window nextWindow;

        synchronized (stateLock) {
            if (!(state instanceof Busy<A, T> busy) || busy.window() != window) {
                // abandoned meanwhile
                return;
            }
            next = busy.next();
            callers = busy.callers();
            nextWindow = next == null ? null : gate.newWindow();
            state = next == null ? new Idle<>() : new Busy<>(nextWindow, null, 0);
        }

        if (next != null) {
            Futures.propagate(execute(nextWindow, next.args(), callers), next.future());
        }
    }

    /**
     * The scheduler would not arm {@code window}: nothing is running, so go
     * idle and fail whoever queued behind it.
     */
    private void windowRefused(IntervalGate.Window window, RuntimeException cause) {
        PendingCall<A, T> stranded = null;
        synchronized (stateLock) {
            if (state instanceof Busy<A, T> busy && busy.window() == window) {
                stranded = busy.next();
                state = new Idle<>();
            }
        }

        callbackFailed("scheduler refused window timer", cause);
        if (stranded != null) {
            stranded.future().completeExceptionally(cause);
        }
    }

    public static final class Builder<A, T> {
        private final AsyncFunction<A, T> fn;
        private CoordinationTiming timing = CoordinationTiming.passThrough();
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private String name = "debounce";
        private CoordinationObservabilitySink observabilitySink;

        private Builder(AsyncFunction<A, T> fn) {
            this.fn = Objects.requireNonNull(fn, "fn");
        }

        public Builder<A, T> withTiming(CoordinationTiming timing) {
            this.timing = timing;
            return this;
        }

        public Builder<A, T> withScheduler(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder<A, T> withName(String name) {
            this.name = name;
            return this;
        }

        public Builder<A, T> withObservabilitySink(CoordinationObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Debounce<A, T> build() {
            return new Debounce<>(this);
        }
    }
}

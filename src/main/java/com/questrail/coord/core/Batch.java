package com.questrail.coord.core;

import com.questrail.coord.api.AsyncFunction;
import com.questrail.coord.api.Batcher;
import com.questrail.coord.api.Unbatcher;
import com.questrail.coord.config.CoordinationTiming;
import com.questrail.coord.internal.time.MonotonicClock;
import com.questrail.coord.internal.time.MonotonicScheduler;
import com.questrail.coord.observability.CoordinationObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Batch
 * =============================================================================
 * Like {@link Debounce}, but calls that arrive during a window are merged
 * instead of discarded.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The first call of an idle period executes immediately with its own
 *       arguments.</li>
 *   <li>Calls while busy are queued until the window opens.</li>
 *   <li>One queued call runs with its own arguments, unbatched.</li>
 *   <li>Two or more queued calls are merged by the {@link Batcher}; the
 *       function runs once and its output goes to every queued caller, or,
 *       with an {@link Unbatcher}, each caller gets its positional share.</li>
 *   <li>Any failure of a batched round (function, batcher, unbatcher, or an
 *       unbatcher returning the wrong number of outputs) fails every caller of
 *       that round with the same cause.</li>
 *   <li>If the scheduler refuses a window timer, the execution is not
 *       started, its callers and everyone queued behind it fail with the
 *       refusal, and the instance returns to idle.</li>
 * </ul>
 */
public final class Batch<A, T> extends ObservedPrimitive implements AsyncFunction<A, T>, TimedPrimitive {

    private sealed interface State<A, T> permits Idle, Busy {
    }

    private record Idle<A, T>() implements State<A, T> {
    }

    /**
     * @param window window of the execution that made the primitive busy
     * @param queue  callers waiting for that window to open, in arrival order
     */
    private record Busy<A, T>(IntervalGate.Window window, List<PendingCall<A, T>> queue)
            implements State<A, T> {
    }

    private final AsyncFunction<A, T> fn;
    private final Batcher<A> batcher;
    private final Unbatcher<A, T> unbatcher;
    private final IntervalGate gate;
    private final Object stateLock = new Object();

    private State<A, T> state = new Idle<>();

    private Batch(Builder<A, T> builder) {
        super(builder.name, builder.observabilitySink);
        this.fn = Objects.requireNonNull(builder.fn, "fn");
        this.batcher = Objects.requireNonNull(builder.batcher, "batcher");
        this.unbatcher = builder.unbatcher;
        CoordinationTiming timing = Objects.requireNonNull(builder.timing, "timing");
        if (timing.interval().isNegative()) {
            throw new IllegalArgumentException("batch interval must be non-negative");
        }
        this.gate = new IntervalGate(timing, builder.clock, builder.scheduler);
    }

    public static <A, T> Builder<A, T> builder(AsyncFunction<A, T> fn, Batcher<A> batcher) {
        return new Builder<>(fn, batcher);
    }

    public CompletableFuture<T> invoke(A args) {
        final PendingCall<A, T> queued;
        final IntervalGate.Window window;
        synchronized (stateLock) {
            if (state instanceof Busy<A, T> busy) {
                queued = PendingCall.of(args);
                busy.queue().add(queued);
                window = null;
            } else {
                window = gate.newWindow();
                state = new Busy<>(window, new ArrayList<>());
                queued = null;
            }
        }

        if (queued != null) {
            return Futures.copyOf(queued.future());
        }
        return Futures.copyOf(execute(window, args, 1));
    }

    @Override
    public CompletableFuture<T> apply(A args) {
        return invoke(args);
    }

    /**
     * Number of callers waiting for the next window.
     */
    public int queuedCount() {
        synchronized (stateLock) {
            return state instanceof Busy<A, T> busy ? busy.queue().size() : 0;
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
        Futures.failAll(abandoned.queue(), cause);
        return abandoned.queue().size();
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
        final List<PendingCall<A, T>> queued;
        final IntervalGate.Window nextWindow;

        synchronized (stateLock) {
            if (!(state instanceof Busy<A, T> busy) || busy.window() != window) {
                // abandoned meanwhile
                return;
            }
            queued = busy.queue();
            nextWindow = queued.isEmpty() ? null : gate.newWindow();
            state = queued.isEmpty() ? new Idle<>() : new Busy<>(nextWindow, new ArrayList<>());
        }

        if (queued.isEmpty()) {
            return;
        }
        if (queued.size() == 1) {
            PendingCall<A, T> only = queued.get(0);
            Futures.propagate(execute(nextWindow, only.args(), 1), only.future());
            return;
        }

        List<A> inputs = new ArrayList<>(queued.size());
        for (PendingCall<A, T> call : queued) {
            inputs.add(call.args());
        }

        final A merged;
        try {
            merged = batcher.batch(inputs);
        } catch (RuntimeException e) {
            Futures.failAll(queued, e);
            // no execution started, so the next window has to be opened by hand
            windowOpened(nextWindow);
            return;
        }

        execute(nextWindow, merged, queued.size()).whenComplete((output, error) -> {
            if (error != null) {
                Futures.failAll(queued, error);
            } else {
                distribute(queued, inputs, output);
            }
        });
    }

    /**
     * The scheduler would not arm {@code window}: nothing is running, so go
     * idle and fail whoever queued behind it.
     */
    private void windowRefused(IntervalGate.Window window, RuntimeException cause) {
        List<PendingCall<A, T>> stranded = List.of();
        synchronized (stateLock) {
            if (state instanceof Busy<A, T> busy && busy.window() == window) {
                stranded = busy.queue();
                state = new Idle<>();
            }
        }

        callbackFailed("scheduler refused window timer", cause);
        Futures.failAll(stranded, cause);
    }

    private void distribute(List<PendingCall<A, T>> queued, List<A> inputs, T output) {
        if (unbatcher == null) {
            for (PendingCall<A, T> call : queued) {
                call.future().complete(output);
            }
            return;
        }

        final List<T> outputs;
        try {
            outputs = unbatcher.unbatch(inputs, output);
        } catch (RuntimeException e) {
            Futures.failAll(queued, e);
            return;
        }
        if (outputs == null || outputs.size() != queued.size()) {
            Futures.failAll(queued, new IllegalStateException(
                "unbatcher returned " + (outputs == null ? "null" : outputs.size() + " outputs")
                    + " for " + queued.size() + " inputs"));
            return;
        }
        for (int i = 0; i < queued.size(); i++) {
            queued.get(i).future().complete(outputs.get(i));
        }
    }

    public static final class Builder<A, T> {
        private final AsyncFunction<A, T> fn;
        private final Batcher<A> batcher;
        private Unbatcher<A, T> unbatcher;
        private CoordinationTiming timing;
        private MonotonicClock clock;
        private MonotonicScheduler scheduler;
        private String name = "batch";
        private CoordinationObservabilitySink observabilitySink;

        private Builder(AsyncFunction<A, T> fn, Batcher<A> batcher) {
            this.fn = Objects.requireNonNull(fn, "fn");
            this.batcher = Objects.requireNonNull(batcher, "batcher");
        }

        public Builder<A, T> withUnbatcher(Unbatcher<A, T> unbatcher) {
            this.unbatcher = unbatcher;
            return this;
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

        public Batch<A, T> build() {
            return new Batch<>(this);
        }
    }
}

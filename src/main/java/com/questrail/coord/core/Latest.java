package com.questrail.coord.core;

import com.questrail.coord.api.ArgsMerger;
import com.questrail.coord.api.AsyncFunction;
import com.questrail.coord.observability.CoordinationObservabilitySink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;

/**
 * Latest
 * =============================================================================
 * Single-flight wrapper in which every caller receives the outcome of the
 * most recent round.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>A call while idle starts a busy period and runs a round with its
 *       arguments.</li>
 *   <li>A call during a round does not start a concurrent execution. Its
 *       arguments are folded into the next round by the {@link ArgsMerger}
 *       (default: latest arguments win).</li>
 *   <li>If {@code areArgsEqual} judges the proposed next arguments equal to
 *       the running round's, no further round is scheduled and the caller
 *       shares the running round's outcome.</li>
 *   <li>When a round completes and another was scheduled, it starts right
 *       away. When none was scheduled the busy period ends and every caller
 *       of the period receives the final round's value or failure.</li>
 * </ul>
 *
 * <p>Compare {@link Serial}, where superseded callers receive a cancellation
 * outcome instead.</p>
 */
public final class Latest<A, T> extends ObservedPrimitive implements AsyncFunction<A, T> {

    private sealed interface State<A, T> permits Idle, Busy {
    }

    private record Idle<A, T>() implements State<A, T> {
    }

    /**
     * @param current args of the executing round
     * @param middle  args that arrived during the executing round, oldest first
     * @param hasNext whether another round is scheduled
     * @param next    args of the scheduled round; may legitimately be {@code null}
     * @param outcome shared by every caller of the busy period
     * @param callers number of callers of the busy period
     */
    private record Busy<A, T>(
            A current,
            List<A> middle,
            boolean hasNext,
            A next,
            CompletableFuture<T> outcome,
            int callers
    ) implements State<A, T> {

        static <A, T> Busy<A, T> start(A args, CompletableFuture<T> outcome, int callers) {
            return new Busy<>(args, new ArrayList<>(), false, null, outcome, callers);
        }
    }

    private final AsyncFunction<A, T> fn;
    private final BiPredicate<A, A> areArgsEqual;
    private final ArgsMerger<A> updateArgs;
    private final Object stateLock = new Object();

    private State<A, T> state = new Idle<>();

    private Latest(Builder<A, T> builder) {
        super(builder.name, builder.observabilitySink);
        this.fn = Objects.requireNonNull(builder.fn, "fn");
        this.areArgsEqual = builder.areArgsEqual;
        this.updateArgs = Objects.requireNonNull(builder.updateArgs, "updateArgs");
    }

    public static <A, T> Latest<A, T> of(AsyncFunction<A, T> fn) {
        return builder(fn).build();
    }

    public static <A, T> Builder<A, T> builder(AsyncFunction<A, T> fn) {
        return new Builder<>(fn);
    }

    public CompletableFuture<T> invoke(A args) {
        final CompletableFuture<T> outcome;
        final boolean start;

        synchronized (stateLock) {
            if (state instanceof Busy<A, T> busy) {
                final A proposed;
                try {
                    proposed = updateArgs.merge(
                        busy.current(),
                        Collections.unmodifiableList(new ArrayList<>(busy.middle())),
                        args,
                        busy.hasNext() ? busy.next() : null);
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(e);
                }
                busy.middle().add(args);

                boolean sameAsRunning = areArgsEqual != null && areArgsEqual.test(proposed, busy.current());
                state = new Busy<>(
                    busy.current(),
                    busy.middle(),
                    !sameAsRunning,
                    sameAsRunning ? null : proposed,
                    busy.outcome(),
                    busy.callers() + 1);
                outcome = busy.outcome();
                start = false;
            } else {
                outcome = new CompletableFuture<>();
                state = Busy.start(args, outcome, 1);
                start = true;
            }
        }

        if (start) {
            runRound(args, 1);
        }
        return Futures.copyOf(outcome);
    }

    @Override
    public CompletableFuture<T> apply(A args) {
        return invoke(args);
    }

    public boolean isBusy() {
        synchronized (stateLock) {
            return state instanceof Busy;
        }
    }

    private void runRound(A args, int callers) {
        executionStarted(callers);
        Futures.invoke(fn, args).whenComplete(this::roundFinished);
    }

    private void roundFinished(T value, Throwable error) {
        final A nextArgs;
        final int callers;
        final CompletableFuture<T> outcome;

        synchronized (stateLock) {
            if (!(state instanceof Busy<A, T> busy)) {
                throw new IllegalStateException("latest round finished while idle");
            }
            if (busy.hasNext()) {
                nextArgs = busy.next();
                callers = busy.callers();
                outcome = null;
                state = Busy.start(nextArgs, busy.outcome(), busy.callers());
            } else {
                nextArgs = null;
                callers = 0;
                outcome = busy.outcome();
                state = new Idle<>();
            }
        }

        if (outcome == null) {
            runRound(nextArgs, callers);
        } else {
            Futures.settle(outcome, value, error);
        }
    }

    public static final class Builder<A, T> {
        private final AsyncFunction<A, T> fn;
        private BiPredicate<A, A> areArgsEqual;
        private ArgsMerger<A> updateArgs = ArgsMerger.latestWins();
        private String name = "latest";
        private CoordinationObservabilitySink observabilitySink;

        private Builder(AsyncFunction<A, T> fn) {
            this.fn = Objects.requireNonNull(fn, "fn");
        }

        public Builder<A, T> withAreArgsEqual(BiPredicate<A, A> areArgsEqual) {
            this.areArgsEqual = areArgsEqual;
            return this;
        }

        public Builder<A, T> withUpdateArgs(ArgsMerger<A> updateArgs) {
            this.updateArgs = updateArgs;
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

        public Latest<A, T> build() {
            return new Latest<>(this);
        }
    }
}

package com.questrail.coord.core;

import com.questrail.coord.api.AsyncFunction;
import com.questrail.coord.api.CancelListener;
import com.questrail.coord.api.SerialFunction;
import com.questrail.coord.api.SerialResult;
import com.questrail.coord.observability.CoordinationObservabilitySink;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Serial
 * =============================================================================
 * Runs the function on every call and cancels, cooperatively, any round that
 * a newer call supersedes.
 *
 * <p>Each round receives a {@link com.questrail.coord.api.CancelToken} carrying
 * its epoch. Superseded callers get {@link SerialResult.Cancelled}; the latest
 * caller gets its own value. A body that never polls the token still ends up
 * last-writer-wins because of the final check after it completes.</p>
 *
 * <pre>
 *   Serial&lt;String, Page&gt; search = Serial.of((token, query) -&gt;
 *           index.fetch(query).thenCompose(first -&gt; {
 *               token.checkCancel();
 *               return index.rank(first);
 *           }));
 * </pre>
 *
 * @see SerialEvent for rounds that each bring their own body
 */
public final class Serial<A, T> implements AsyncFunction<A, SerialResult<T>> {

    private final SerialFunction<A, T> fn;
    private final SerialEvent event;

    private Serial(Builder<A, T> builder) {
        this.fn = Objects.requireNonNull(builder.fn, "fn");
        this.event = new SerialEvent(builder.onCancel, builder.name, builder.observabilitySink);
    }

    public static <A, T> Serial<A, T> of(SerialFunction<A, T> fn) {
        return builder(fn).build();
    }

    public static <A, T> Builder<A, T> builder(SerialFunction<A, T> fn) {
        return new Builder<>(fn);
    }

    public CompletableFuture<SerialResult<T>> invoke(A args) {
        return event.run(token -> fn.apply(token, args));
    }

    @Override
    public CompletableFuture<SerialResult<T>> apply(A args) {
        return invoke(args);
    }

    /**
     * Epoch of the most recently started round, 0 before the first call.
     */
    public long currentEpoch() {
        return event.currentEpoch();
    }

    public String name() {
        return event.name();
    }

    public static final class Builder<A, T> {
        private final SerialFunction<A, T> fn;
        private CancelListener onCancel;
        private String name = "serial";
        private CoordinationObservabilitySink observabilitySink;

        private Builder(SerialFunction<A, T> fn) {
            this.fn = Objects.requireNonNull(fn, "fn");
        }

        public Builder<A, T> withOnCancel(CancelListener onCancel) {
            this.onCancel = onCancel;
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

        public Serial<A, T> build() {
            return new Serial<>(this);
        }
    }
}

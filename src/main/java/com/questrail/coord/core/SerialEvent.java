package com.questrail.coord.core;

import com.questrail.coord.api.CancelListener;
import com.questrail.coord.api.CancelToken;
import com.questrail.coord.api.SerialResult;
import com.questrail.coord.api.SerialTask;
import com.questrail.coord.observability.CoordinationObservabilitySink;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SerialEvent
 * =============================================================================
 * Epoch counter behind {@link Serial}, usable directly when every round brings
 * its own body.
 *
 * <h2>Round lifecycle</h2>
 * <ol>
 *   <li>{@link #run(SerialTask)} increments the epoch and starts the body
 *       with a fresh {@link CancelToken}. Rounds are never queued; a new round
 *       supersedes every older one.</li>
 *   <li>The body polls the token; nothing is interrupted.</li>
 *   <li>When the body completes, the token is checked one final time. A
 *       superseded round yields {@link SerialResult.Cancelled} regardless of
 *       what the body produced or threw.</li>
 *   <li>A current round yields {@link SerialResult.Completed}, or fails with
 *       the body's failure.</li>
 * </ol>
 *
 * <p>The {@link CancelListener} fires once per superseded round, from the
 * first check that notices. A listener that throws is reported to the
 * observability sink and otherwise ignored.</p>
 */
public final class SerialEvent extends ObservedPrimitive {

    private final AtomicLong serial = new AtomicLong();
    private final CancelListener onCancel;

    public SerialEvent(CancelListener onCancel, String name, CoordinationObservabilitySink observabilitySink) {
        super(name, observabilitySink);
        this.onCancel = Objects.requireNonNullElse(onCancel, CancelListener.none());
    }

    public SerialEvent(CancelListener onCancel) {
        this(onCancel, "serial-event", null);
    }

    public SerialEvent() {
        this(null);
    }

    public <T> CompletableFuture<SerialResult<T>> run(SerialTask<T> task) {
        Objects.requireNonNull(task, "task");

        Round round = new Round(serial.incrementAndGet());
        executionStarted(1);

        CompletableFuture<SerialResult<T>> result = new CompletableFuture<>();
        Futures.call(() -> task.run(round)).whenComplete((value, error) -> {
            if (round.isCancelled()) {
                result.complete(SerialResult.cancelled(round.epoch(), round.latestEpoch()));
            } else if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
            } else {
                result.complete(SerialResult.completed(value));
            }
        });
        return result;
    }

    /**
     * Epoch of the most recently started round, 0 before the first.
     */
    public long currentEpoch() {
        return serial.get();
    }

    private void notifyCancelled(long epoch, long latest) {
        roundCancelled(epoch, latest);
        try {
            onCancel.onCancel(epoch, latest);
        } catch (RuntimeException e) {
            callbackFailed("cancel listener failed for round " + epoch, e);
        }
    }

    private final class Round implements CancelToken {
        private final long epoch;
        private final AtomicBoolean notified = new AtomicBoolean(false);

        private Round(long epoch) {
            this.epoch = epoch;
        }

        @Override
        public long epoch() {
            return epoch;
        }

        @Override
        public long latestEpoch() {
            return serial.get();
        }

        @Override
        public boolean isCancelled() {
            long latest = serial.get();
            if (latest == epoch) {
                return false;
            }
            if (notified.compareAndSet(false, true)) {
                notifyCancelled(epoch, latest);
            }
            return true;
        }
    }
}

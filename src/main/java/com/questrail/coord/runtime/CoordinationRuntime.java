package com.questrail.coord.runtime;

import com.questrail.coord.api.AsyncFunction;
import com.questrail.coord.api.Batcher;
import com.questrail.coord.api.CancelListener;
import com.questrail.coord.api.SerialFunction;
import com.questrail.coord.api.Unbatcher;
import com.questrail.coord.config.CoordinationRuntimeConfig;
import com.questrail.coord.config.CoordinationTiming;
import com.questrail.coord.core.Batch;
import com.questrail.coord.core.Debounce;
import com.questrail.coord.core.Latest;
import com.questrail.coord.core.Once;
import com.questrail.coord.core.RwLock;
import com.questrail.coord.core.Serial;
import com.questrail.coord.core.SerialEvent;
import com.questrail.coord.core.TimedPrimitive;
import com.questrail.coord.internal.time.HashedWheelTimerScheduler;
import com.questrail.coord.internal.time.MonotonicClock;
import com.questrail.coord.internal.time.MonotonicScheduler;
import com.questrail.coord.internal.time.ScheduledExecutorScheduler;
import com.questrail.coord.internal.time.SystemMonotonicClock;
import com.questrail.coord.observability.CoordinationObservabilitySink;
import io.netty.util.HashedWheelTimer;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CoordinationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the timer substrate shared by the
 * primitives it creates.
 *
 * <p>Primitives built here share one clock, one scheduler and one
 * observability sink. Primitives that need no timer (once, latest, serial,
 * read-write lock) do not depend on the runtime staying open.</p>
 *
 * <p>{@link #close()} stops the owned timer substrate and then fails every
 * caller still queued on a debounce or batch window created here. Afterwards
 * those instances fail new calls with the scheduler's refusal instead of
 * hanging.</p>
 *
 * <pre>
 *   try (CoordinationRuntime runtime = CoordinationRuntime.create(config)) {
 *       Debounce&lt;Query, Result&gt; search = runtime.debounce("search", backend::search);
 *       ...
 *   }
 * </pre>
 */
public final class CoordinationRuntime implements AutoCloseable {

    private final CoordinationRuntimeConfig config;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Runnable shutdown;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<TimedPrimitive> timedPrimitives = Collections.newSetFromMap(new WeakHashMap<>());

    private CoordinationRuntime(CoordinationRuntimeConfig config,
                                MonotonicClock clock,
                                MonotonicScheduler scheduler,
                                Runnable shutdown) {
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.shutdown = shutdown;
    }

    /**
     * Creates a runtime that owns a timer of the configured backend.
     */
    public static CoordinationRuntime create(CoordinationRuntimeConfig config) {
        Objects.requireNonNull(config, "config");
        MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        switch (config.timerBackend()) {
            case HASHED_WHEEL: {
                HashedWheelTimer timer = new HashedWheelTimer(
                    new DefaultThreadFactory(config.timerThreadName(), true),
                    config.wheelTickDuration().toNanos(),
                    TimeUnit.NANOSECONDS);
                return new CoordinationRuntime(config, clock,
                    new HashedWheelTimerScheduler(timer, clock), timer::stop);
            }
            case EXECUTOR:
            default: {
                ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                    1, new DefaultThreadFactory(config.timerThreadName(), true));
                // pending windows are failed by close(), not run
                executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
                executor.setRemoveOnCancelPolicy(true);
                return new CoordinationRuntime(config, clock,
                    new ScheduledExecutorScheduler(executor, clock), () -> shutdownExecutor(executor));
            }
        }
    }

    /**
     * Creates a runtime over an externally owned clock and scheduler.
     * {@link #close()} leaves them running but still fails the callers queued
     * on windows created here.
     */
    public static CoordinationRuntime using(CoordinationRuntimeConfig config,
                                            MonotonicClock clock,
                                            MonotonicScheduler scheduler) {
        return new CoordinationRuntime(
            Objects.requireNonNull(config, "config"),
            Objects.requireNonNull(clock, "clock"),
            Objects.requireNonNull(scheduler, "scheduler"),
            () -> { });
    }

    public CoordinationRuntimeConfig config() {
        return config;
    }

    public MonotonicClock clock() {
        return clock;
    }

    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    public <A, T> Once<A, T> once(String name, AsyncFunction<A, T> fn) {
        return new Once<>(fn, name, sink());
    }

    public <V> RwLock<V> rwLock(V initialValue) {
        return new RwLock<>(initialValue);
    }

    public <A, T> Debounce<A, T> debounce(String name, AsyncFunction<A, T> fn) {
        return debounce(name, fn, config.defaultTiming());
    }

    public <A, T> Debounce<A, T> debounce(String name, AsyncFunction<A, T> fn, CoordinationTiming timing) {
        return register(Debounce.builder(fn)
            .withTiming(timing)
            .withScheduler(clock, scheduler)
            .withName(name)
            .withObservabilitySink(sink())
            .build());
    }

    public <A, T> Batch<A, T> batch(String name, AsyncFunction<A, T> fn, Batcher<A> batcher) {
        return batch(name, fn, batcher, null, config.defaultTiming());
    }

    public <A, T> Batch<A, T> batch(String name, AsyncFunction<A, T> fn, Batcher<A> batcher,
                                    Unbatcher<A, T> unbatcher) {
        return batch(name, fn, batcher, unbatcher, config.defaultTiming());
    }

    /**
     * @param unbatcher may be {@code null}: every queued caller then gets the whole output
     */
    public <A, T> Batch<A, T> batch(String name, AsyncFunction<A, T> fn, Batcher<A> batcher,
                                    Unbatcher<A, T> unbatcher, CoordinationTiming timing) {
        return register(Batch.builder(fn, batcher)
            .withUnbatcher(unbatcher)
            .withTiming(timing)
            .withScheduler(clock, scheduler)
            .withName(name)
            .withObservabilitySink(sink())
            .build());
    }

    public <A, T> Latest.Builder<A, T> latest(String name, AsyncFunction<A, T> fn) {
        return Latest.builder(fn)
            .withName(name)
            .withObservabilitySink(sink());
    }

    public <A, T> Serial<A, T> serial(String name, SerialFunction<A, T> fn, CancelListener onCancel) {
        return Serial.builder(fn)
            .withOnCancel(onCancel)
            .withName(name)
            .withObservabilitySink(sink())
            .build();
    }

    public SerialEvent serialEvent(String name, CancelListener onCancel) {
        return new SerialEvent(onCancel, name, sink());
    }

    /**
     * Stops the owned timer substrate, then fails the callers queued on any
     * open debounce or batch window created by this runtime. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdown.run();

        List<TimedPrimitive> open;
        synchronized (timedPrimitives) {
            open = new ArrayList<>(timedPrimitives);
            timedPrimitives.clear();
        }
        IllegalStateException cause = new IllegalStateException("coordination runtime closed");
        for (TimedPrimitive primitive : open) {
            primitive.abandon(cause);
        }
    }

    private <P extends TimedPrimitive> P register(P primitive) {
        synchronized (timedPrimitives) {
            timedPrimitives.add(primitive);
        }
        return primitive;
    }

    private CoordinationObservabilitySink sink() {
        return config.observabilitySink();
    }

    private static void shutdownExecutor(ScheduledExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

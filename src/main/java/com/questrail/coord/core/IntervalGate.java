package com.questrail.coord.core;

import com.questrail.coord.config.CoordinationTiming;
import com.questrail.coord.internal.time.Cancellable;
import com.questrail.coord.internal.time.MonotonicClock;
import com.questrail.coord.internal.time.MonotonicScheduler;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * IntervalGate
 * =============================================================================
 * Trailing-edge windows shared by {@link Debounce} and {@link Batch}.
 *
 * <p>Each execution runs inside one {@link Window}. The window opens once the
 * timer of length {@code interval} has elapsed <em>and</em> the execution has
 * completed, i.e. {@code max(interval, executionTime)} after the start. With
 * {@code disregardExecutionTime} the window opens on the timer alone.</p>
 *
 * <p>The timer is armed before the execution starts, so a slow execution
 * start does not stretch the interval. If the scheduler refuses the wakeup,
 * the execution is never started and the refusal is thrown to the caller of
 * {@link Window#run}.</p>
 */
final class IntervalGate {

    private final CoordinationTiming timing;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    IntervalGate(CoordinationTiming timing, MonotonicClock clock, MonotonicScheduler scheduler) {
        this.timing = Objects.requireNonNull(timing, "timing");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Creates an unarmed window. The primitive records it in its busy state
     * before calling {@link Window#run}, so a stale callback can be told apart.
     */
    Window newWindow() {
        return new Window();
    }

    final class Window {
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile Cancellable timer;

        private Window() {
        }

        /**
         * Arms the timer, starts the execution and returns it.
         *
         * @param execution starts the execution; must not throw
         * @param onOpen    runs at most once, when the next execution may start;
         *                  never after {@link #cancel()}
         * @throws RuntimeException if the scheduler rejects the wakeup, in which
         *                          case {@code execution} was not started
         */
        <T> CompletableFuture<T> run(Supplier<CompletableFuture<T>> execution, Runnable onOpen) {
            boolean timerOnly = timing.disregardExecutionTime();
            // Two arrivals (timer, completion) are needed unless only the timer counts.
            AtomicBoolean firstArrived = new AtomicBoolean(timerOnly);
            Runnable arrive = () -> {
                if (!firstArrived.compareAndSet(false, true) && closed.compareAndSet(false, true)) {
                    onOpen.run();
                }
            };

            timer = scheduler.scheduleAfter(timing.interval(), clock, arrive);
            CompletableFuture<T> result = execution.get();
            if (!timerOnly) {
                result.whenComplete((value, error) -> arrive.run());
            }
            return result;
        }

        /**
         * Closes the window without opening it and cancels its wakeup.
         *
         * @return {@code false} if the window had already opened or been cancelled
         */
        boolean cancel() {
            if (!closed.compareAndSet(false, true)) {
                return false;
            }
            Cancellable armed = timer;
            if (armed != null) {
                armed.cancel();
            }
            return true;
        }
    }
}

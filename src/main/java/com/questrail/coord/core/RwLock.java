package com.questrail.coord.core;

import com.questrail.coord.api.ReadGuard;
import com.questrail.coord.api.WriteGuard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RwLock
 * =============================================================================
 * Asynchronous many-readers / one-writer lock around a value.
 *
 * <h2>Admission</h2>
 * <ul>
 *   <li>Requests are granted strictly in arrival order. A read that arrives
 *       while a writer is waiting queues behind that writer, even if other
 *       reads are active, so writers cannot be starved.</li>
 *   <li>When the lock frees up, the head of the queue is granted. A run of
 *       consecutive reads at the head is granted together.</li>
 *   <li>There is no timeout. A guard that is never released blocks every
 *       later request.</li>
 * </ul>
 *
 * <h2>Value ownership</h2>
 * <p>The value can only be replaced through {@link WriteGuard#release(Object)}.
 * Read guards see the value current at the time they were granted.</p>
 *
 * <h2>Threading</h2>
 * <p>Guard futures are completed outside the internal monitor, on the thread
 * that released the previous guard. A waiter whose future was cancelled by
 * its caller is skipped: its grant is released again immediately.</p>
 */
public final class RwLock<V> {

    private sealed interface Waiter<V> permits ReadWaiter, WriteWaiter {
    }

    private record ReadWaiter<V>(CompletableFuture<ReadGuard<V>> future) implements Waiter<V> {
    }

    private record WriteWaiter<V>(CompletableFuture<WriteGuard<V>> future) implements Waiter<V> {
    }

    private final Object stateLock = new Object();
    private final Deque<Waiter<V>> waiters = new ArrayDeque<>();

    private V value;
    private boolean writerActive;
    private int activeReaders;

    public RwLock(V initialValue) {
        this.value = initialValue;
    }

    /**
     * Requests shared access.
     */
    public CompletableFuture<ReadGuard<V>> read() {
        CompletableFuture<ReadGuard<V>> future = new CompletableFuture<>();
        final Read guard;
        synchronized (stateLock) {
            if (writerActive || !waiters.isEmpty()) {
                waiters.addLast(new ReadWaiter<>(future));
                return future;
            }
            activeReaders++;
            guard = new Read(value);
        }
        future.complete(guard);
        return future;
    }

    /**
     * Requests exclusive access.
     */
    public CompletableFuture<WriteGuard<V>> write() {
        CompletableFuture<WriteGuard<V>> future = new CompletableFuture<>();
        final Write guard;
        synchronized (stateLock) {
            if (writerActive || activeReaders > 0 || !waiters.isEmpty()) {
                waiters.addLast(new WriteWaiter<>(future));
                return future;
            }
            writerActive = true;
            guard = new Write(value);
        }
        future.complete(guard);
        return future;
    }

    public int readerCount() {
        synchronized (stateLock) {
            return activeReaders;
        }
    }

    public boolean isWriteLocked() {
        synchronized (stateLock) {
            return writerActive;
        }
    }

    /**
     * Number of requests waiting for a grant.
     */
    public int queueLength() {
        synchronized (stateLock) {
            return waiters.size();
        }
    }

    private void releaseRead() {
        List<Runnable> grants;
        synchronized (stateLock) {
            activeReaders--;
            grants = admitLocked();
        }
        grants.forEach(Runnable::run);
    }

    private void releaseWrite(V newValue) {
        List<Runnable> grants;
        synchronized (stateLock) {
            value = newValue;
            writerActive = false;
            grants = admitLocked();
        }
        grants.forEach(Runnable::run);
    }

    /**
     * Moves waiters from the head of the queue into the lock while they are
     * compatible with its current holders. Returns the future completions to
     * run once the monitor is released.
     */
    private List<Runnable> admitLocked() {
        List<Runnable> grants = new ArrayList<>();
        while (!waiters.isEmpty() && !writerActive) {
            Waiter<V> head = waiters.peekFirst();
            if (head instanceof ReadWaiter<V> reader) {
                waiters.pollFirst();
                activeReaders++;
                Read guard = new Read(value);
                grants.add(() -> {
                    if (!reader.future().complete(guard)) {
                        guard.release();
                    }
                });
            } else if (head instanceof WriteWaiter<V> writer) {
                if (activeReaders > 0) {
                    break;
                }
                waiters.pollFirst();
                writerActive = true;
                Write guard = new Write(value);
                grants.add(() -> {
                    if (!writer.future().complete(guard)) {
                        guard.release(guard.value());
                    }
                });
            }
        }
        return grants;
    }

    private final class Read implements ReadGuard<V> {
        private final V snapshot;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Read(V snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public V value() {
            return snapshot;
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                throw new IllegalStateException("read guard already released");
            }
            releaseRead();
        }
    }

    private final class Write implements WriteGuard<V> {
        private final V current;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Write(V current) {
            this.current = current;
        }

        @Override
        public V value() {
            return current;
        }

        @Override
        public void release(V newValue) {
            if (!released.compareAndSet(false, true)) {
                throw new IllegalStateException("write guard already released");
            }
            releaseWrite(newValue);
        }
    }
}

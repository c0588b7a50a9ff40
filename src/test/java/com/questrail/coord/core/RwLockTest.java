package com.questrail.coord.core;

import com.questrail.coord.api.ReadGuard;
import com.questrail.coord.api.WriteGuard;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.questrail.coord.core.Outcomes.valueOf;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RwLockTest
 * -----------------------------------------------------------------------------
 * Shared reads, exclusive writes, arrival-order admission.
 */
class RwLockTest {

    @Test
    void readersShareTheLock() {
        RwLock<String> lock = new RwLock<>("v0");

        CompletableFuture<ReadGuard<String>> r1 = lock.read();
        CompletableFuture<ReadGuard<String>> r2 = lock.read();

        assertEquals("v0", valueOf(r1).value());
        assertEquals("v0", valueOf(r2).value());
        assertEquals(2, lock.readerCount());
        assertFalse(lock.isWriteLocked());
    }

    @Test
    void writerWaitsForReadersAndReplacesValue() {
        RwLock<Integer> lock = new RwLock<>(1);

        ReadGuard<Integer> reader = valueOf(lock.read());
        CompletableFuture<WriteGuard<Integer>> writer = lock.write();

        assertFalse(writer.isDone());
        assertEquals(1, lock.queueLength());

        reader.release();

        WriteGuard<Integer> guard = valueOf(writer);
        assertTrue(lock.isWriteLocked());
        assertEquals(1, guard.value());
        guard.release(guard.value() + 1);

        assertFalse(lock.isWriteLocked());
        assertEquals(2, valueOf(lock.read()).value());
    }

    @Test
    void readArrivingBehindWaitingWriterQueues() {
        RwLock<String> lock = new RwLock<>("v0");
        List<String> order = new ArrayList<>();

        ReadGuard<String> firstReader = valueOf(lock.read());
        CompletableFuture<WriteGuard<String>> writer = lock.write();
        CompletableFuture<ReadGuard<String>> lateReader = lock.read();

        writer.thenAccept(g -> order.add("write"));
        lateReader.thenAccept(g -> order.add("read:" + g.value()));

        assertFalse(lateReader.isDone(), "read must not overtake a waiting writer");
        assertEquals(2, lock.queueLength());

        firstReader.release();
        assertEquals(List.of("write"), order);

        valueOf(writer).release("v1");
        assertEquals(List.of("write", "read:v1"), order);
        assertEquals(1, lock.readerCount());
    }

    @Test
    void consecutiveQueuedReadsAreGrantedTogether() {
        RwLock<String> lock = new RwLock<>("v0");

        WriteGuard<String> writer = valueOf(lock.write());
        CompletableFuture<ReadGuard<String>> r1 = lock.read();
        CompletableFuture<ReadGuard<String>> r2 = lock.read();
        CompletableFuture<WriteGuard<String>> w2 = lock.write();
        CompletableFuture<ReadGuard<String>> r3 = lock.read();

        writer.release("v1");

        assertTrue(r1.isDone());
        assertTrue(r2.isDone());
        assertFalse(w2.isDone());
        assertFalse(r3.isDone());
        assertEquals(2, lock.readerCount());

        valueOf(r1).release();
        assertFalse(w2.isDone());
        valueOf(r2).release();
        assertTrue(w2.isDone());
        assertFalse(r3.isDone());
    }

    @Test
    void writersAreExclusiveAndOrdered() {
        RwLock<List<String>> lock = new RwLock<>(List.of());

        WriteGuard<List<String>> w1 = valueOf(lock.write());
        CompletableFuture<WriteGuard<List<String>>> w2 = lock.write();
        assertFalse(w2.isDone());

        w1.release(List.of("a"));
        WriteGuard<List<String>> second = valueOf(w2);
        assertEquals(List.of("a"), second.value());
        second.release(List.of("a", "b"));

        assertEquals(List.of("a", "b"), valueOf(lock.read()).value());
    }

    @Test
    void doubleReleaseIsRejected() {
        RwLock<String> lock = new RwLock<>("v0");

        ReadGuard<String> reader = valueOf(lock.read());
        reader.release();
        assertThrows(IllegalStateException.class, reader::release);
        assertEquals(0, lock.readerCount());

        WriteGuard<String> writer = valueOf(lock.write());
        writer.release("v1");
        assertThrows(IllegalStateException.class, () -> writer.release("v2"));
        assertEquals("v1", valueOf(lock.read()).value());
    }

    @Test
    void readGuardReleasesOnClose() throws Exception {
        RwLock<String> lock = new RwLock<>("v0");

        try (ReadGuard<String> guard = valueOf(lock.read())) {
            assertEquals(1, lock.readerCount());
            assertEquals("v0", guard.value());
        }
        assertEquals(0, lock.readerCount());
        assertTrue(lock.write().isDone());
    }

    @Test
    void cancelledWaiterIsSkipped() {
        RwLock<String> lock = new RwLock<>("v0");

        WriteGuard<String> writer = valueOf(lock.write());
        CompletableFuture<WriteGuard<String>> abandoned = lock.write();
        CompletableFuture<ReadGuard<String>> reader = lock.read();

        abandoned.cancel(false);
        writer.release("v1");

        assertTrue(reader.isDone());
        assertEquals("v1", valueOf(reader).value());
        assertFalse(lock.isWriteLocked());
    }

    @Test
    void writersStayExclusiveAcrossThreads() throws Exception {
        RwLock<Integer> lock = new RwLock<>(0);
        AtomicInteger readers = new AtomicInteger();
        AtomicInteger writers = new AtomicInteger();
        AtomicInteger violations = new AtomicInteger();
        AtomicInteger writes = new AtomicInteger();

        int threads = 8;
        int rounds = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> workers = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                workers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        if ((i + id) % 2 == 0) {
                            ReadGuard<Integer> guard = lock.read().get(5, TimeUnit.SECONDS);
                            readers.incrementAndGet();
                            if (writers.get() != 0) {
                                violations.incrementAndGet();
                            }
                            guard.value();
                            readers.decrementAndGet();
                            guard.release();
                        } else {
                            WriteGuard<Integer> guard = lock.write().get(5, TimeUnit.SECONDS);
                            if (writers.incrementAndGet() != 1 || readers.get() != 0) {
                                violations.incrementAndGet();
                            }
                            int next = guard.value() + 1;
                            writes.incrementAndGet();
                            writers.decrementAndGet();
                            guard.release(next);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, violations.get());
        assertEquals(threads * rounds / 2, writes.get());
        assertEquals(writes.get(), valueOf(lock.read()).value());
        assertEquals(0, lock.queueLength());
    }
}

package com.questrail.coord.core;

import com.questrail.coord.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import static com.questrail.coord.core.Outcomes.failureOf;
import static com.questrail.coord.core.Outcomes.valueOf;
import static org.junit.jupiter.api.Assertions.*;

/**
 * LatestTest
 * -----------------------------------------------------------------------------
 * Every caller of a busy period receives the last round's outcome.
 */
class LatestTest {

    @Test
    void backToBackCallsBothReceiveSecondRoundResult() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.of(fn);

        CompletableFuture<String> a = latest.invoke("a");
        CompletableFuture<String> b = latest.invoke("b");
        assertEquals(1, fn.callCount(), "no concurrent round");

        fn.complete(0, "A");
        assertFalse(a.isDone(), "a superseded round does not resolve anybody");
        assertEquals(List.of("a", "b"), fn.calls());

        fn.complete(1, "B");
        assertEquals("B", valueOf(a));
        assertEquals("B", valueOf(b));
        assertFalse(latest.isBusy());
    }

    @Test
    void equalArgsShareTheRunningRound() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.builder(fn)
            .withAreArgsEqual(Objects::equals)
            .build();

        CompletableFuture<String> a = latest.invoke("same");
        CompletableFuture<String> b = latest.invoke("same");

        fn.complete(0, "result");

        assertEquals(1, fn.callCount());
        assertEquals("result", valueOf(a));
        assertEquals("result", valueOf(b));
    }

    @Test
    void equalArgsDropAnAlreadyScheduledRound() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.builder(fn)
            .withAreArgsEqual(Objects::equals)
            .build();

        CompletableFuture<String> a = latest.invoke("a");
        CompletableFuture<String> b = latest.invoke("b");
        CompletableFuture<String> backToA = latest.invoke("a");

        fn.complete(0, "A");

        assertEquals(1, fn.callCount());
        assertEquals("A", valueOf(a));
        assertEquals("A", valueOf(b));
        assertEquals("A", valueOf(backToA));
    }

    @Test
    void intermediateArgsAreSkippedByDefault() {
        ControlledFunction<Integer, Integer> fn = new ControlledFunction<>();
        Latest<Integer, Integer> latest = Latest.of(fn);

        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            results.add(latest.invoke(i));
        }

        fn.complete(0, 10);
        fn.complete(1, 40);

        assertEquals(List.of(1, 4), fn.calls());
        for (CompletableFuture<Integer> result : results) {
            assertEquals(40, valueOf(result));
        }
    }

    @Test
    void roundsKeepRunningWhileCallsArrive() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.of(fn);

        CompletableFuture<String> a = latest.invoke("a");
        latest.invoke("b");
        fn.complete(0, "A");

        CompletableFuture<String> c = latest.invoke("c");
        fn.complete(1, "B");
        assertFalse(a.isDone());

        fn.complete(2, "C");
        assertEquals(List.of("a", "b", "c"), fn.calls());
        assertEquals("C", valueOf(a));
        assertEquals("C", valueOf(c));
    }

    @Test
    void mergerSeesMiddleArgsAndPreviousNext() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        List<List<String>> middles = new ArrayList<>();
        Latest<String, String> latest = Latest.builder(fn)
            .withUpdateArgs((current, middle, arrived, next) -> {
                middles.add(middle);
                return next == null ? arrived : next + arrived;
            })
            .build();

        latest.invoke("a");
        latest.invoke("b");
        latest.invoke("c");
        CompletableFuture<String> d = latest.invoke("d");

        fn.complete(0, "A");
        assertEquals(List.of("a", "bcd"), fn.calls());
        assertEquals(List.of(List.of(), List.of("b"), List.of("b", "c")), middles);

        fn.complete(1, "BCD");
        assertEquals("BCD", valueOf(d));
    }

    @Test
    void mergerFailureOnlyFailsThatCaller() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.builder(fn)
            .withUpdateArgs((current, middle, arrived, next) -> {
                if (arrived.isEmpty()) {
                    throw new IllegalArgumentException("empty query");
                }
                return arrived;
            })
            .build();

        CompletableFuture<String> a = latest.invoke("a");
        CompletableFuture<String> broken = latest.invoke("");

        assertInstanceOf(IllegalArgumentException.class, failureOf(broken));

        fn.complete(0, "A");
        assertEquals("A", valueOf(a));
        assertEquals(1, fn.callCount());
    }

    @Test
    void finalRoundFailureReachesEveryCaller() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.of(fn);

        CompletableFuture<String> a = latest.invoke("a");
        CompletableFuture<String> b = latest.invoke("b");

        fn.complete(0, "A");
        IllegalStateException boom = new IllegalStateException("boom");
        fn.fail(1, boom);

        assertSame(boom, failureOf(a));
        assertSame(boom, failureOf(b));
    }

    @Test
    void earlierRoundFailureIsOverriddenByFinalRound() {
        ControlledFunction<String, String> fn = new ControlledFunction<>();
        Latest<String, String> latest = Latest.of(fn);

        CompletableFuture<String> a = latest.invoke("a");
        latest.invoke("b");

        fn.fail(0, new IllegalStateException("transient"));
        fn.complete(1, "B");

        assertEquals("B", valueOf(a));
    }

    @Test
    void newBusyPeriodStartsAfterIdle() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        Latest<String, String> latest = Latest.builder((String s) -> CompletableFuture.completedFuture(s + "!"))
            .withName("preview")
            .withObservabilitySink(sink)
            .build();

        assertEquals("x!", valueOf(latest.invoke("x")));
        assertEquals("y!", valueOf(latest.invoke("y")));
        assertEquals(2, sink.getExecutions().size());
        assertEquals(2, latest.executionCount());
    }
}

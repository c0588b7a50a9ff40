package com.questrail.coord.core;

import com.questrail.coord.api.CancelToken;
import com.questrail.coord.api.SerialResult;
import com.questrail.coord.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

import static com.questrail.coord.core.Outcomes.failureOf;
import static com.questrail.coord.core.Outcomes.valueOf;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SerialTest
 * -----------------------------------------------------------------------------
 * Every call runs; superseded rounds resolve as cancelled.
 */
class SerialTest {

    /**
     * Body that suspends on a test-controlled step, then polls the token.
     */
    private static final class SteppedBody {
        final List<CompletableFuture<String>> steps = new ArrayList<>();
        final List<CancelToken> tokens = new ArrayList<>();

        CompletableFuture<String> run(CancelToken token, String args) {
            CompletableFuture<String> step = new CompletableFuture<>();
            steps.add(step);
            tokens.add(token);
            return step.thenApply(value -> {
                token.checkCancel();
                return args + ":" + value;
            });
        }
    }

    @Test
    void newerCallCancelsRunningRound() {
        SteppedBody body = new SteppedBody();
        List<long[]> cancels = new ArrayList<>();
        Serial<String, String> serial = Serial.builder(body::run)
            .withOnCancel((current, latest) -> cancels.add(new long[] {current, latest}))
            .build();

        CompletableFuture<SerialResult<String>> first = serial.invoke("a");
        CompletableFuture<SerialResult<String>> second = serial.invoke("b");

        assertEquals(1, body.tokens.get(0).epoch());
        assertEquals(2, body.tokens.get(1).epoch());
        assertEquals(2, serial.currentEpoch());

        body.steps.get(0).complete("x");
        body.steps.get(1).complete("y");

        SerialResult.Cancelled<String> cancelled =
            assertInstanceOf(SerialResult.Cancelled.class, valueOf(first));
        assertEquals(1, cancelled.epoch());
        assertEquals(2, cancelled.latestEpoch());
        assertEquals(SerialResult.completed("b:y"), valueOf(second));

        assertEquals(1, cancels.size());
        assertArrayEquals(new long[] {1, 2}, cancels.get(0));
    }

    @Test
    void bodyThatNeverPollsIsStillCancelledAfterCompletion() {
        List<CompletableFuture<String>> steps = new ArrayList<>();
        Serial<String, String> serial = Serial.of((token, args) -> {
            CompletableFuture<String> step = new CompletableFuture<>();
            steps.add(step);
            return step;
        });

        CompletableFuture<SerialResult<String>> first = serial.invoke("a");
        CompletableFuture<SerialResult<String>> second = serial.invoke("b");

        steps.get(1).complete("B");
        steps.get(0).complete("A");

        assertTrue(valueOf(first).isCancelled());
        assertEquals("B", valueOf(second).orElseThrow());
    }

    @Test
    void sequentialCallsAreNeverCancelled() {
        Serial<Integer, Integer> serial = Serial.of((token, n) -> CompletableFuture.completedFuture(n * 2));

        assertEquals(SerialResult.completed(2), valueOf(serial.invoke(1)));
        assertEquals(SerialResult.completed(4), valueOf(serial.invoke(2)));
        assertEquals(2, serial.currentEpoch());
    }

    @Test
    void failureOfCurrentRoundPropagates() {
        IllegalStateException boom = new IllegalStateException("boom");
        Serial<String, String> serial = Serial.of((token, args) -> CompletableFuture.failedFuture(boom));

        assertSame(boom, failureOf(serial.invoke("a")));
    }

    @Test
    void failureOfSupersededRoundIsReportedAsCancelled() {
        List<CompletableFuture<String>> steps = new ArrayList<>();
        Serial<String, String> serial = Serial.of((token, args) -> {
            CompletableFuture<String> step = new CompletableFuture<>();
            steps.add(step);
            return step;
        });

        CompletableFuture<SerialResult<String>> first = serial.invoke("a");
        serial.invoke("b");
        steps.get(0).completeExceptionally(new IllegalStateException("late failure"));

        assertTrue(valueOf(first).isCancelled());
    }

    @Test
    void cancelledResultRefusesValueAccess() {
        SerialResult<String> cancelled = SerialResult.cancelled(1, 3);
        assertThrows(NoSuchElementException.class, cancelled::orElseThrow);
    }

    @Test
    void reportsCancellationToSink() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        SteppedBody body = new SteppedBody();
        Serial<String, String> serial = Serial.builder(body::run)
            .withName("autosave")
            .withObservabilitySink(sink)
            .build();

        serial.invoke("a");
        serial.invoke("b");
        serial.invoke("c");
        body.steps.forEach(step -> step.complete("done"));

        assertEquals(3, sink.getExecutions().size());
        assertEquals(2, sink.getCancellations().size());
        assertEquals("autosave", sink.getCancellations().get(0).primitive());
        assertEquals(3, sink.getCancellations().get(1).latestEpoch());
    }
}

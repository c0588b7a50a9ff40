package com.questrail.coord.core;

import com.questrail.coord.api.AsyncFunction;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Future plumbing shared by the primitives.
 *
 * <p>Every future handed to a caller is a fresh one, so a caller cancelling
 * its own future never completes a future the primitive relies on.</p>
 */
final class Futures {

    private Futures() {
    }

    /**
     * Runs {@code fn(args)} and adapts its stage. A synchronous throw, or a
     * {@code null} stage, becomes a failed future.
     */
    static <A, T> CompletableFuture<T> invoke(AsyncFunction<A, T> fn, A args) {
        return call(() -> fn.apply(args));
    }

    static <T> CompletableFuture<T> call(Callable<? extends CompletionStage<T>> body) {
        CompletionStage<T> stage;
        try {
            stage = body.call();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(new NullPointerException("async function returned a null stage"));
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> settle(result, value, error));
        return result;
    }

    /**
     * Returns a new future that completes with the outcome of {@code source}.
     */
    static <T> CompletableFuture<T> copyOf(CompletableFuture<T> source) {
        CompletableFuture<T> copy = new CompletableFuture<>();
        propagate(source, copy);
        return copy;
    }

    static <T> void propagate(CompletableFuture<T> source, CompletableFuture<T> target) {
        source.whenComplete((value, error) -> settle(target, value, error));
    }

    static <T> void settle(CompletableFuture<T> target, T value, Throwable error) {
        if (error != null) {
            target.completeExceptionally(unwrap(error));
        } else {
            target.complete(value);
        }
    }

    static void failAll(List<? extends PendingCall<?, ?>> calls, Throwable error) {
        Throwable cause = unwrap(error);
        for (PendingCall<?, ?> call : calls) {
            call.future().completeExceptionally(cause);
        }
    }

    /**
     * Strips the wrappers the JDK adds around a failure as it crosses stages.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

package com.questrail.coord.core;

import java.util.concurrent.CompletableFuture;

/**
 * One caller waiting for a shared outcome: the arguments it supplied and the
 * future it will be completed with. Completed exactly once.
 */
record PendingCall<A, T>(A args, CompletableFuture<T> future) {

    static <A, T> PendingCall<A, T> of(A args) {
        return new PendingCall<>(args, new CompletableFuture<>());
    }

    /**
     * Same future, newer arguments.
     */
    PendingCall<A, T> withArgs(A newArgs) {
        return new PendingCall<>(newArgs, future);
    }
}

package com.questrail.coord.api;

import java.util.concurrent.CompletionStage;

/**
 * Body of a serial primitive. Receives the round's {@link CancelToken}
 * alongside the caller's arguments.
 */
@FunctionalInterface
public interface SerialFunction<A, T>
{
    CompletionStage<T> apply(CancelToken token, A args) throws Exception;
}

package com.questrail.coord.api;

import java.util.concurrent.CompletionStage;

/**
 * A one-off round body submitted to a {@code SerialEvent}.
 */
@FunctionalInterface
public interface SerialTask<T>
{
    CompletionStage<T> run(CancelToken token) throws Exception;
}

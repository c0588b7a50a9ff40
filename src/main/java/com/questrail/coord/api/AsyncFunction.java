package com.questrail.coord.api;

import java.util.concurrent.CompletionStage;

/**
 * AsyncFunction
 * -----------------------------------------------------------------------------
 * An opaque asynchronous operation: the unit every coordination primitive
 * wraps.
 *
 * <p>A multi-argument operation takes its arguments as one value (a record,
 * a {@code List}, or {@code Void} when there are none). Throwing from
 * {@link #apply(Object)} is treated exactly like returning a failed stage.</p>
 *
 * <p>The primitives themselves implement this interface, so decorators can be
 * stacked, e.g. a {@code Latest} over a {@code Once}.</p>
 *
 * @param <A> argument type
 * @param <T> result type
 */
@FunctionalInterface
public interface AsyncFunction<A, T>
{
    CompletionStage<T> apply(A args) throws Exception;
}

package com.questrail.coord.api;

import java.util.List;

/**
 * Splits the output of a batched execution into one output per caller.
 *
 * <p>The returned list is matched positionally to {@code inputs} and must have
 * the same size.</p>
 */
@FunctionalInterface
public interface Unbatcher<A, T>
{
    List<T> unbatch(List<A> inputs, T output);
}

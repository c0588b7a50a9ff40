package com.questrail.coord.api;

import java.util.List;

/**
 * Combines the arguments of every queued batch caller into one input.
 */
@FunctionalInterface
public interface Batcher<A>
{
    A batch(List<A> inputs);
}

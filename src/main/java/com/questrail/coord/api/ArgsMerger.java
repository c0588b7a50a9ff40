package com.questrail.coord.api;

import java.util.List;

/**
 * ArgsMerger
 * -----------------------------------------------------------------------------
 * Decides which arguments the next {@code Latest} round runs with when a call
 * arrives while a round is executing.
 *
 * @param <A> argument type
 */
@FunctionalInterface
public interface ArgsMerger<A>
{
    /**
     * @param current arguments of the round that is executing
     * @param middle  arguments that arrived during this round before {@code latest}, oldest first
     * @param latest  arguments of the call that just arrived
     * @param next    arguments previously chosen for the next round, or {@code null}
     * @return arguments for the next round
     */
    A merge(A current, List<A> middle, A latest, A next);

    /**
     * Keeps only the most recent arguments.
     */
    static <A> ArgsMerger<A> latestWins()
    {
        return (current, middle, latest, next) -> latest;
    }
}

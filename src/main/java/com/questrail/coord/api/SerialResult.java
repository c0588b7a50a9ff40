package com.questrail.coord.api;

import java.util.NoSuchElementException;

/**
 * SerialResult
 * -----------------------------------------------------------------------------
 * Outcome of one serial round: either the value the body produced, or the
 * distinguished cancellation outcome for a round that was superseded.
 *
 * <p>Cancellation is an expected result, not a fault. Failures of the body
 * itself are delivered through the future, not through this type.</p>
 *
 * @param <T> value type
 */
public sealed interface SerialResult<T>
        permits SerialResult.Completed, SerialResult.Cancelled
{
    static <T> SerialResult<T> completed(T value)
    {
        return new Completed<>(value);
    }

    static <T> SerialResult<T> cancelled(long epoch, long latestEpoch)
    {
        return new Cancelled<>(epoch, latestEpoch);
    }

    boolean isCancelled();

    /**
     * Returns the completed value.
     *
     * @throws NoSuchElementException if the round was cancelled
     */
    T orElseThrow();

    record Completed<T>(T value) implements SerialResult<T>
    {
        @Override
        public boolean isCancelled()
        {
            return false;
        }

        @Override
        public T orElseThrow()
        {
            return value;
        }
    }

    record Cancelled<T>(long epoch, long latestEpoch) implements SerialResult<T>
    {
        @Override
        public boolean isCancelled()
        {
            return true;
        }

        @Override
        public T orElseThrow()
        {
            throw new NoSuchElementException("round " + epoch + " was cancelled by round " + latestEpoch);
        }
    }
}

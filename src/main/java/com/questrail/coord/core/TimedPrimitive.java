package com.questrail.coord.core;

/**
 * A primitive that holds callers across a timer window ({@link Debounce},
 * {@link Batch}).
 *
 * <p>The owner of the timer substrate calls {@link #abandon(Throwable)} when
 * that substrate goes away, so no caller is left waiting on a wakeup that
 * will never fire.</p>
 */
public interface TimedPrimitive {

    /**
     * Cancels the open window, fails every caller queued on it with
     * {@code cause} and returns the primitive to idle. An execution already
     * running is not affected and still completes its own callers.
     *
     * @return number of queued callers that were failed
     */
    int abandon(Throwable cause);
}

package com.questrail.coord.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for one pending timer wakeup.
 *
 * <p>
 * Debounce and batch windows own exactly one of these at a time. A window is
 * closed by letting the wakeup fire or by cancelling it; it is never stacked
 * behind another wakeup.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the pending wakeup.
     *
     * @return {@code true} if the wakeup will no longer run; {@code false} if it
     *         already ran or was cancelled before.
     */
    boolean cancel();
}

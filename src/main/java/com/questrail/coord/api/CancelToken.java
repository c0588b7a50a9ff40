package com.questrail.coord.api;

/**
 * CancelToken
 * -----------------------------------------------------------------------------
 * Cooperative cancellation check handed to each serial round.
 *
 * <p>A round is superseded as soon as a newer round has been started on the
 * same instance. Nothing is interrupted: the body polls the token after each
 * suspension point and stops voluntarily. Whether or not it polls, the
 * wrapper checks once more after the body completes and reports a superseded
 * round as {@link SerialResult.Cancelled}.</p>
 *
 * <p>The first poll that observes the supersession fires the instance's
 * {@link CancelListener}; later polls do not fire it again.</p>
 */
public interface CancelToken
{
    /**
     * Epoch of the round this token belongs to. The first round is 1.
     */
    long epoch();

    /**
     * Epoch of the most recently started round on the owning instance.
     */
    long latestEpoch();

    /**
     * Returns {@code true} if a newer round has been started.
     */
    boolean isCancelled();

    /**
     * Throws {@link SerialCancelledException} if a newer round has been started.
     * The wrapper turns the exception into {@link SerialResult.Cancelled}.
     */
    default void checkCancel()
    {
        if (isCancelled()) {
            throw new SerialCancelledException(epoch(), latestEpoch());
        }
    }
}

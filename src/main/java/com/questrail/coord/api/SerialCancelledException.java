package com.questrail.coord.api;

/**
 * Thrown by {@link CancelToken#checkCancel()} to unwind a superseded round.
 *
 * <p>Never reaches the caller of a serial primitive: the wrapper converts it
 * into {@link SerialResult.Cancelled}.</p>
 */
public final class SerialCancelledException extends RuntimeException
{
    private final long epoch;
    private final long latestEpoch;

    public SerialCancelledException(long epoch, long latestEpoch)
    {
        super("Round " + epoch + " superseded by round " + latestEpoch);
        this.epoch = epoch;
        this.latestEpoch = latestEpoch;
    }

    public long epoch()
    {
        return epoch;
    }

    public long latestEpoch()
    {
        return latestEpoch;
    }
}

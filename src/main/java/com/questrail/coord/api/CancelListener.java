package com.questrail.coord.api;

/**
 * Notified once for every serial round that is superseded.
 */
@FunctionalInterface
public interface CancelListener
{
    /**
     * @param current epoch of the superseded round
     * @param latest  epoch of the newest round at the time of detection
     */
    void onCancel(long current, long latest);

    static CancelListener none()
    {
        return (current, latest) -> { };
    }
}

package com.questrail.coord.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for stamping observability events. Never used to decide
 * when a window opens.
 */
public interface WallClock
{
    Instant now();
}

package com.questrail.coord.observability;

import java.time.Instant;

/**
 * A serial round was superseded by a newer one.
 */
public record CoordinationCancelEvent(
    Instant timestamp,
    String primitive,
    long epoch,
    long latestEpoch
) {
}

package com.questrail.coord.observability;

import java.time.Instant;

/**
 * An error raised by a user callback that could not be delivered to a caller.
 */
public record CoordinationErrorEvent(
    Instant timestamp,
    String primitive,
    String message,
    Throwable cause
) {
}

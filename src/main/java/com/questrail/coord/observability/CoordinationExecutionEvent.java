package com.questrail.coord.observability;

import java.time.Instant;

/**
 * One execution of a wrapped function.
 *
 * @param primitive name of the primitive instance
 * @param round     per-instance execution counter, starting at 1
 * @param callers   number of callers that will receive this execution's outcome,
 *                  as known when it starts
 */
public record CoordinationExecutionEvent(
    Instant timestamp,
    String primitive,
    long round,
    int callers
) {
    public boolean isCoalesced() {
        return callers > 1;
    }
}

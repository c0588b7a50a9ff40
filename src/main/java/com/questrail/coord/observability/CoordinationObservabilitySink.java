package com.questrail.coord.observability;

/**
 * Receives observability events from the coordination primitives.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Primitives never log on their own; everything they have to say goes
 * through this interface. Implementations must not throw.</p>
 */
public interface CoordinationObservabilitySink {
    /**
     * Called each time a primitive starts an execution of its wrapped function.
     * @param event which primitive, which round, and how many callers share it
     */
    void onExecution(CoordinationExecutionEvent event);

    /**
     * Called once per superseded serial round.
     * @param event the superseded and the latest epoch
     */
    void onCancel(CoordinationCancelEvent event);

    /**
     * Called when a user callback outside the result path fails, e.g. a
     * cancel listener that throws.
     * @param event the error event
     */
    void onError(CoordinationErrorEvent event);
}

package com.questrail.coord.observability;

/**
 * No-op implementation of CoordinationObservabilitySink. The default for every
 * primitive.
 */
public final class NullObservabilitySink implements CoordinationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onExecution(CoordinationExecutionEvent event) {}

    @Override
    public void onCancel(CoordinationCancelEvent event) {}

    @Override
    public void onError(CoordinationErrorEvent event) {}
}

package com.questrail.coord.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CoordinationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCoordinationObservabilitySink implements CoordinationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCoordinationObservabilitySink.class);

    @Override
    public void onExecution(CoordinationExecutionEvent event) {
        if (event.isCoalesced()) {
            log.debug("{}: round {} serves {} coalesced callers",
                event.primitive(), event.round(), event.callers());
        } else {
            log.debug("{}: round {} started", event.primitive(), event.round());
        }
    }

    @Override
    public void onCancel(CoordinationCancelEvent event) {
        log.info("{}: round {} cancelled, latest round is {}",
            event.primitive(), event.epoch(), event.latestEpoch());
    }

    @Override
    public void onError(CoordinationErrorEvent event) {
        log.error("{}: {}", event.primitive(), event.message(), event.cause());
    }
}

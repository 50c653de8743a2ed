package com.questrail.flameconnect.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ParameterObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jParameterObservabilitySink implements ParameterObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jParameterObservabilitySink.class);

    @Override
    public void onParameterDecoded(ParameterDecodedEvent event) {
        log.debug("Decoded parameter {}: {}", event.parameter().kind().id(), event.parameter());
    }

    @Override
    public void onDecodeFailure(ParameterErrorEvent event) {
        final String outcome = event.skipped() ? "skipping" : "aborting batch";
        if (event.cause() != null) {
            log.warn("Failed to decode parameter {}, {}: {}", event.parameterId(), outcome, event.message(), event.cause());
        } else {
            log.warn("Failed to decode parameter {}, {}: {}", event.parameterId(), outcome, event.message());
        }
    }

    @Override
    public void onEncodeFailure(ParameterErrorEvent event) {
        log.error("Failed to encode parameter {}: {}", event.parameterId(), event.message());
    }
}

package com.questrail.flameconnect.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ParameterObservabilitySink {
    private final List<ParameterDecodedEvent> decoded = new ArrayList<>();
    private final List<ParameterErrorEvent> decodeFailures = new ArrayList<>();
    private final List<ParameterErrorEvent> encodeFailures = new ArrayList<>();

    @Override
    public synchronized void onParameterDecoded(ParameterDecodedEvent event) {
        decoded.add(event);
    }

    @Override
    public synchronized void onDecodeFailure(ParameterErrorEvent event) {
        decodeFailures.add(event);
    }

    @Override
    public synchronized void onEncodeFailure(ParameterErrorEvent event) {
        encodeFailures.add(event);
    }

    public synchronized List<ParameterDecodedEvent> getDecoded() {
        return new ArrayList<>(decoded);
    }

    public synchronized List<ParameterErrorEvent> getDecodeFailures() {
        return new ArrayList<>(decodeFailures);
    }

    public synchronized List<ParameterErrorEvent> getEncodeFailures() {
        return new ArrayList<>(encodeFailures);
    }
}

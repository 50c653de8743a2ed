package com.questrail.flameconnect.observability;

/**
 * No-op implementation of ParameterObservabilitySink.
 */
public final class NullParameterObservabilitySink implements ParameterObservabilitySink {
    public static final NullParameterObservabilitySink INSTANCE = new NullParameterObservabilitySink();

    private NullParameterObservabilitySink() {}

    @Override
    public void onParameterDecoded(ParameterDecodedEvent event) {}

    @Override
    public void onDecodeFailure(ParameterErrorEvent event) {}

    @Override
    public void onEncodeFailure(ParameterErrorEvent event) {}
}

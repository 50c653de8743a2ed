package com.questrail.flameconnect.observability;

/**
 * Main interface for receiving parameter exchange observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ParameterObservabilitySink {
    /**
     * Called for every entry of an inbound batch that decoded successfully.
     * @param event the decoded parameter and its timestamp
     */
    void onParameterDecoded(ParameterDecodedEvent event);

    /**
     * Called when an inbound entry could not be decoded and was dropped
     * (or aborted the batch, depending on configuration).
     * @param event the failure details
     */
    void onDecodeFailure(ParameterErrorEvent event);

    /**
     * Called when an outbound parameter could not be encoded and the write was aborted.
     * @param event the failure details
     */
    void onEncodeFailure(ParameterErrorEvent event);
}

package com.questrail.flameconnect.observability;

import com.questrail.flameconnect.model.Parameter;

import java.time.Instant;

/**
 * Record representing one successfully decoded inbound parameter.
 */
public record ParameterDecodedEvent(
    Instant timestamp,
    Parameter parameter
) {
}

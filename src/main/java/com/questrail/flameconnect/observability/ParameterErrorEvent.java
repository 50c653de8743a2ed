package com.questrail.flameconnect.observability;

import com.questrail.flameconnect.codec.ProtocolError;

import java.time.Instant;

/**
 * Record representing a failed decode or encode in the parameter exchange.
 *
 * @param parameterId wire id of the affected entry
 * @param error       the failure, or {@code null} when the reporter has none
 * @param cause       underlying exception, or {@code null}
 * @param skipped     {@code true} when the entry was dropped and processing
 *                    continued; {@code false} when the failure aborts the call
 */
public record ParameterErrorEvent(
    Instant timestamp,
    int parameterId,
    String message,
    ProtocolError error,
    Throwable cause,
    boolean skipped
) {
}

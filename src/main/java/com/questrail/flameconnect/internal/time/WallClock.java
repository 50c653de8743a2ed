package com.questrail.flameconnect.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>
 * The codec itself is time-free; only the exchange layer stamps the events it
 * reports. Tests substitute a fixed clock.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}

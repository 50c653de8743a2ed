package com.questrail.flameconnect.config;

import com.questrail.flameconnect.internal.time.SystemWallClock;
import com.questrail.flameconnect.internal.time.WallClock;
import com.questrail.flameconnect.observability.ParameterObservabilitySink;
import com.questrail.flameconnect.observability.Slf4jParameterObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the parameter exchange layer.
 *
 * @param skipUndecodable     drop undecodable inbound entries and continue
 *                            ({@code true}), or abort the batch on the first one
 * @param fallbackTemperature target temperature used by turn-on/turn-off when
 *                            the current state carries no Mode parameter
 */
public record ExchangeConfig(
    ParameterObservabilitySink observabilitySink,
    WallClock wallClock,
    boolean skipUndecodable,
    double fallbackTemperature
) {
    public static final double DEFAULT_FALLBACK_TEMPERATURE = 22.0;

    public ExchangeConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static ExchangeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ParameterObservabilitySink observabilitySink = new Slf4jParameterObservabilitySink();
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private boolean skipUndecodable = true;
        private double fallbackTemperature = DEFAULT_FALLBACK_TEMPERATURE;

        public Builder withObservabilitySink(ParameterObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withSkipUndecodable(boolean skipUndecodable) {
            this.skipUndecodable = skipUndecodable;
            return this;
        }

        public Builder withFallbackTemperature(double fallbackTemperature) {
            this.fallbackTemperature = fallbackTemperature;
            return this;
        }

        public ExchangeConfig build() {
            return new ExchangeConfig(observabilitySink, wallClock, skipUndecodable, fallbackTemperature);
        }
    }
}

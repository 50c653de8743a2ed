package com.questrail.flameconnect.exchange;

import com.questrail.flameconnect.config.ExchangeConfig;
import com.questrail.flameconnect.model.FireMode;
import com.questrail.flameconnect.model.FlameEffect;
import com.questrail.flameconnect.model.FlameEffectParameter;
import com.questrail.flameconnect.model.ModeParameter;
import com.questrail.flameconnect.model.Parameter;
import com.questrail.flameconnect.model.WritableParameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the parameter sets for turning a fireplace on or off while
 * preserving its current settings.
 *
 * <p>Both commands start from the parameters last decoded for the fireplace.
 * When no {@link ModeParameter} is among them, the configured fallback
 * temperature is used. When a kind appears more than once, the last
 * occurrence wins.</p>
 */
public final class FireCommands
{
    private final double fallbackTemperature;

    public FireCommands(ExchangeConfig config)
    {
        this.fallbackTemperature = Objects.requireNonNull(config, "config").fallbackTemperature();
    }

    /**
     * Mode MANUAL at the current temperature, plus the current flame effect
     * switched on when one is known.
     */
    public List<WritableParameter> turnOn(List<? extends Parameter> current)
    {
        final List<WritableParameter> writes = new ArrayList<>(2);
        writes.add(new ModeParameter(FireMode.MANUAL, currentTemperature(current)));
        find(current, FlameEffectParameter.class)
                .map(flame -> flame.withFlameEffect(FlameEffect.ON))
                .ifPresent(writes::add);
        return List.copyOf(writes);
    }

    /**
     * Mode STANDBY at the current temperature.
     */
    public List<WritableParameter> turnOff(List<? extends Parameter> current)
    {
        return List.of(new ModeParameter(FireMode.STANDBY, currentTemperature(current)));
    }

    private double currentTemperature(List<? extends Parameter> current)
    {
        return find(current, ModeParameter.class)
                .map(ModeParameter::temperature)
                .orElse(fallbackTemperature);
    }

    private static <P extends Parameter> Optional<P> find(List<? extends Parameter> current, Class<P> type)
    {
        Objects.requireNonNull(current, "current");
        P found = null;
        for (Parameter parameter : current) {
            if (type.isInstance(parameter)) {
                found = type.cast(parameter);
            }
        }
        return Optional.ofNullable(found);
    }
}

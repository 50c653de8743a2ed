package com.questrail.flameconnect.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Preset colours offered by the FlameConnect app for media and overhead lighting.
 */
public final class NamedColors
{
    private static final Map<String, RGBWColor> PALETTE;

    static {
        Map<String, RGBWColor> palette = new LinkedHashMap<>();
        palette.put("dark-red", new RGBWColor(180, 0, 0, 0));
        palette.put("light-red", new RGBWColor(255, 0, 0, 80));
        palette.put("dark-yellow", new RGBWColor(180, 120, 0, 0));
        palette.put("light-yellow", new RGBWColor(255, 200, 0, 80));
        palette.put("dark-green", new RGBWColor(0, 180, 0, 0));
        palette.put("light-green", new RGBWColor(0, 255, 0, 80));
        palette.put("dark-cyan", new RGBWColor(0, 180, 180, 0));
        palette.put("light-cyan", new RGBWColor(0, 255, 255, 80));
        palette.put("dark-blue", new RGBWColor(0, 0, 180, 0));
        palette.put("light-blue", new RGBWColor(0, 0, 255, 80));
        palette.put("dark-purple", new RGBWColor(128, 0, 180, 0));
        palette.put("light-purple", new RGBWColor(180, 0, 255, 80));
        palette.put("dark-pink", new RGBWColor(180, 0, 80, 0));
        palette.put("light-pink", new RGBWColor(255, 0, 128, 80));
        PALETTE = Collections.unmodifiableMap(palette);
    }

    private NamedColors() {}

    /**
     * Looks up a preset by name, ignoring case ("dark-red", "Light-Blue", ...).
     */
    public static Optional<RGBWColor> byName(String name)
    {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PALETTE.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns all presets keyed by name.
     */
    public static Map<String, RGBWColor> all()
    {
        return PALETTE;
    }
}

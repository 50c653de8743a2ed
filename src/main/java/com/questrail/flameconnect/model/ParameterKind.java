package com.questrail.flameconnect.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * ParameterKind
 * -----------------------------------------------------------------------------
 * The fixed set of FlameConnect wire parameter identifiers.
 *
 * <p>Each kind carries its 16-bit wire id, the fixed total frame length
 * (3-byte header plus payload) and whether the appliance accepts writes for
 * it. The wire layout is fixed per kind; there is no negotiation.</p>
 *
 * <table>
 *   <caption>Catalog</caption>
 *   <tr><th>Kind</th><th>Id</th><th>Frame length</th></tr>
 *   <tr><td>TEMPERATURE_UNIT</td><td>236</td><td>4</td></tr>
 *   <tr><td>MODE</td><td>321</td><td>6</td></tr>
 *   <tr><td>FLAME_EFFECT</td><td>322</td><td>23</td></tr>
 *   <tr><td>HEAT_SETTINGS</td><td>323</td><td>10</td></tr>
 *   <tr><td>HEAT_MODE</td><td>325</td><td>4</td></tr>
 *   <tr><td>TIMER</td><td>326</td><td>6</td></tr>
 *   <tr><td>SOFTWARE_VERSION</td><td>327</td><td>12 (read-only)</td></tr>
 *   <tr><td>ERROR</td><td>329</td><td>7 (read-only)</td></tr>
 *   <tr><td>SOUND</td><td>369</td><td>5</td></tr>
 *   <tr><td>LOG_EFFECT</td><td>370</td><td>11</td></tr>
 * </table>
 */
public enum ParameterKind
{
    TEMPERATURE_UNIT(236, "TemperatureUnit", 4, false),
    MODE(321, "Mode", 6, false),
    FLAME_EFFECT(322, "FlameEffect", 23, false),
    HEAT_SETTINGS(323, "HeatSettings", 10, false),
    HEAT_MODE(325, "HeatMode", 4, false),
    TIMER(326, "Timer", 6, false),
    SOFTWARE_VERSION(327, "SoftwareVersion", 12, true),
    ERROR(329, "Error", 7, true),
    SOUND(369, "Sound", 5, false),
    LOG_EFFECT(370, "LogEffect", 11, false);

    /**
     * Size of the frame header (2-byte id + 1-byte payload length).
     */
    public static final int HEADER_LENGTH = 3;

    private static final Map<Integer, ParameterKind> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ParameterKind::id, Function.identity()));

    private final int id;
    private final String displayName;
    private final int frameLength;
    private final boolean readOnly;

    ParameterKind(int id, String displayName, int frameLength, boolean readOnly)
    {
        this.id = id;
        this.displayName = displayName;
        this.frameLength = frameLength;
        this.readOnly = readOnly;
    }

    /**
     * Looks up the kind carrying the given wire id.
     *
     * @param id unsigned 16-bit parameter id as sent by the cloud relay
     * @return the matching kind, or empty if the id is not part of the protocol
     */
    public static Optional<ParameterKind> fromId(int id)
    {
        return Optional.ofNullable(BY_ID.get(id));
    }

    public int id()
    {
        return id;
    }

    /**
     * Human-readable name used in error messages and logs.
     */
    public String displayName()
    {
        return displayName;
    }

    /**
     * Total frame length in bytes, header included.
     */
    public int frameLength()
    {
        return frameLength;
    }

    /**
     * Payload length in bytes, as written into header byte 2.
     */
    public int payloadLength()
    {
        return frameLength - HEADER_LENGTH;
    }

    /**
     * True for kinds the appliance only reports and that must never be encoded.
     */
    public boolean readOnly()
    {
        return readOnly;
    }
}

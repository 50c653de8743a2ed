package com.questrail.flameconnect.model;

/**
 * Canonical semantic representation of one FlameConnect appliance parameter.
 *
 * <h2>Purpose</h2>
 * <p>
 * A {@code Parameter} is a fully decoded, immutable value of one of the ten
 * wire parameter kinds. Callers read and build these values; they never see
 * header bytes, byte offsets, channel order or index translation, all of
 * which are resolved by the codec.
 * </p>
 *
 * <h2>Directionality</h2>
 * <p>
 * Some kinds are only ever reported by the appliance. This is enforced
 * structurally via subinterfaces:
 * </p>
 * <ul>
 *   <li>{@link WritableParameter} — may be encoded and sent to the appliance</li>
 *   <li>{@link ReadOnlyParameter} — decode-only (software version, fault flags)</li>
 * </ul>
 */
public sealed interface Parameter
        permits WritableParameter, ReadOnlyParameter {

    /**
     * Returns the wire kind this value belongs to. The mapping is fixed:
     * every implementation returns one constant.
     */
    ParameterKind kind();
}

package com.questrail.flameconnect.model;

/**
 * Parameter kinds the appliance only reports.
 *
 * <p>Values of these types can be produced by decoding but are always
 * rejected by the encoder.</p>
 */
public sealed interface ReadOnlyParameter extends Parameter
        permits SoftwareVersionParameter, ErrorParameter {
}

package com.questrail.flameconnect.codec;

import com.questrail.flameconnect.model.ParameterKind;

import java.util.Objects;

/**
 * ProtocolError
 * -----------------------------------------------------------------------------
 * Typed taxonomy of codec failures.
 *
 * <p>Every failure is recoverable and scoped to a single entry or call: a
 * batch decoder can skip the offending entry and continue, a writer can
 * abort one request. The codec never logs these and never substitutes a
 * default value in their place.</p>
 */
public sealed interface ProtocolError
        permits ProtocolError.InsufficientData,
                ProtocolError.UnknownParameter,
                ProtocolError.ReadOnly,
                ProtocolError.UnsupportedValue,
                ProtocolError.MalformedValue {

    /**
     * Human-readable description suitable for logs and user-facing messages.
     */
    String message();

    /**
     * Raw buffer shorter than the kind's fixed frame length.
     */
    record InsufficientData(ParameterKind kind, int expectedLength, int actualLength) implements ProtocolError
    {
        public InsufficientData {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String message()
        {
            return "Insufficient data for " + kind.displayName()
                    + ": expected " + expectedLength + " bytes, got " + actualLength;
        }
    }

    /**
     * Parameter id that is not part of the protocol.
     */
    record UnknownParameter(int parameterId) implements ProtocolError
    {
        @Override
        public String message()
        {
            return "Unknown parameter ID: " + parameterId;
        }
    }

    /**
     * Attempt to encode a kind the appliance only reports. Permanent, never transient.
     */
    record ReadOnly(ParameterKind kind) implements ProtocolError
    {
        public ReadOnly {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String message()
        {
            return kind.displayName() + " is read-only and cannot be encoded";
        }
    }

    /**
     * Enum-typed field carrying a byte outside the enum's domain.
     */
    record UnsupportedValue(ParameterKind kind, String field, int value) implements ProtocolError
    {
        public UnsupportedValue {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(field, "field");
        }

        @Override
        public String message()
        {
            return "Unsupported value for " + kind.displayName() + "." + field + ": " + value;
        }
    }

    /**
     * Transport value that could not be turned into frame bytes, e.g. invalid base64.
     */
    record MalformedValue(int parameterId, String detail) implements ProtocolError
    {
        public MalformedValue {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public String message()
        {
            return "Malformed value for parameter " + parameterId + ": " + detail;
        }
    }
}

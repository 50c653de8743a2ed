package com.questrail.flameconnect.model;

import java.util.Optional;

/**
 * Implemented by every enum whose constants map to a single wire byte.
 */
public interface WireEnum
{
    /**
     * Returns the byte value this constant occupies on the wire.
     */
    int wireValue();

    /**
     * Resolves a wire byte to the constant of {@code type} that carries it.
     *
     * @return the constant, or empty when the byte is outside the enum's domain
     */
    static <E extends Enum<E> & WireEnum> Optional<E> fromWire(Class<E> type, int value)
    {
        for (E constant : type.getEnumConstants()) {
            if (constant.wireValue() == value) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}

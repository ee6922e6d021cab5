package com.questrail.vaultacl.policy;

import java.util.Objects;

/**
 * Declares a fixed-width unsigned scalar stored after the allowlists of a
 * protocol policy (for example a maximum slippage in basis points).
 *
 * @param name         field name
 * @param type         encoded width
 * @param defaultValue value used when a policy is created from scratch
 */
public record ScalarField(String name, Type type, long defaultValue)
{
    /**
     * Encoded widths, all unsigned little-endian.
     */
    public enum Type {
        U16(2, 0xFFFFL),
        U32(4, 0xFFFF_FFFFL),
        U64(8, -1L);

        private final int size;
        private final long max;

        Type(int size, long max) {
            this.size = size;
            this.max = max;
        }

        public int size() {
            return size;
        }

        boolean fits(long value) {
            return this == U64 || (value >= 0 && value <= max);
        }
    }

    public ScalarField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (!type.fits(defaultValue)) {
            throw new IllegalArgumentException(name + " default " + defaultValue + " does not fit " + type);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code value} does not fit the width
     */
    long checked(long value) {
        if (!type.fits(value)) {
            throw new IllegalArgumentException(name + " value " + value + " does not fit " + type);
        }
        return value;
    }
}

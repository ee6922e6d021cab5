package com.questrail.vaultacl.api;

/**
 * A numeric market identifier (spot or perp market index), encoded as an
 * unsigned 16-bit value.
 */
public record MarketIndex(int value) implements Principal
{
    /** Largest representable market index. */
    public static final int MAX = 0xFFFF;

    public MarketIndex {
        if (value < 0 || value > MAX) {
            throw new IllegalArgumentException("market index must be 0-" + MAX + ": " + value);
        }
    }

    public static MarketIndex of(int value) {
        return new MarketIndex(value);
    }

    @Override
    public String display() {
        return Integer.toString(value);
    }
}

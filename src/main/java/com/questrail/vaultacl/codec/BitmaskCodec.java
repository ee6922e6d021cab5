package com.questrail.vaultacl.codec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * BitmaskCodec
 * -----------------------------------------------------------------------------
 * Pure helpers for the fixed-width bit flags and bitmasks that identify
 * protocols (within an integration) and permissions (within a protocol).
 *
 * <h2>Conventions</h2>
 * <ul>
 *   <li>An <b>ordinal</b> is a 0-based bit position.</li>
 *   <li>A <b>bitflag</b> is a mask with exactly one bit set ({@code 1 << ordinal}).</li>
 *   <li>A <b>bitmask</b> is any combination of bitflags.</li>
 * </ul>
 *
 * Masks are carried in a {@code long} regardless of their declared
 * {@link Width}; the width only bounds which ordinals are legal.
 */
public final class BitmaskCodec
{
    /**
     * Declared widths of the masks used by the access-control model.
     */
    public enum Width {
        /** Protocol bitflags and {@code protocolsBitmask}. */
        U16(16),
        /** Permission bitmasks. */
        U64(64);

        private final int bits;

        Width(int bits) {
            this.bits = bits;
        }

        public int bits() {
            return bits;
        }

        /** Largest mask value representable at this width (as unsigned). */
        public long allOnes() {
            return bits == 64 ? -1L : (1L << bits) - 1;
        }
    }

    private BitmaskCodec() {}

    /**
     * Returns the single-bit mask for {@code ordinal}.
     *
     * @throws IllegalArgumentException if the ordinal does not fit {@code width}
     */
    public static long bit(int ordinal, Width width) {
        if (ordinal < 0 || ordinal >= width.bits()) {
            throw new IllegalArgumentException(
                    "ordinal " + ordinal + " out of range for " + width + " (0-" + (width.bits() - 1) + ")");
        }
        return 1L << ordinal;
    }

    /**
     * Returns the ordinals set in {@code mask}, ascending.
     * <p>
     * The result is lazy and restartable: every call to
     * {@link Iterable#iterator()} walks the mask again from bit 0.
     */
    public static Iterable<Integer> ordinals(long mask) {
        return () -> new Iterator<>() {
            private long remaining = mask;

            @Override
            public boolean hasNext() {
                return remaining != 0;
            }

            @Override
            public Integer next() {
                if (remaining == 0) {
                    throw new NoSuchElementException();
                }
                int ordinal = Long.numberOfTrailingZeros(remaining);
                remaining &= remaining - 1;
                return ordinal;
            }
        };
    }

    /**
     * Returns the ordinals set in {@code mask} as a list, ascending.
     */
    public static List<Integer> ordinalList(long mask) {
        List<Integer> out = new ArrayList<>(Long.bitCount(mask));
        for (int ordinal : ordinals(mask)) {
            out.add(ordinal);
        }
        return out;
    }

    /**
     * Returns {@code true} if {@code flag} has exactly one bit set.
     */
    public static boolean isSingleBit(long flag) {
        return flag != 0 && (flag & (flag - 1)) == 0;
    }

    /**
     * Returns the ordinal of a single-bit flag.
     *
     * @throws IllegalArgumentException if {@code flag} is not a single bit
     */
    public static int ordinalOf(long flag) {
        if (!isSingleBit(flag)) {
            throw new IllegalArgumentException("not a single-bit flag: 0b" + Long.toBinaryString(flag));
        }
        return Long.numberOfTrailingZeros(flag);
    }

    /**
     * Renders each set bit of {@code mask} through {@code nameForOrdinal}.
     * Bits the lookup does not know (it returns {@code null}) render as the
     * numeric value of the bit.
     */
    public static List<String> names(long mask, IntFunction<String> nameForOrdinal) {
        List<String> out = new ArrayList<>(Long.bitCount(mask));
        for (int ordinal : ordinals(mask)) {
            String name = nameForOrdinal.apply(ordinal);
            out.add(name != null ? name : Long.toUnsignedString(1L << ordinal));
        }
        return out;
    }

    /**
     * Binary rendering padded to the declared width, e.g.
     * {@code 0000000000000101}.
     */
    public static String formatBits(long mask, Width width) {
        String binary = Long.toBinaryString(mask & width.allOnes());
        if (binary.length() >= width.bits()) {
            return binary;
        }
        return "0".repeat(width.bits() - binary.length()) + binary;
    }
}

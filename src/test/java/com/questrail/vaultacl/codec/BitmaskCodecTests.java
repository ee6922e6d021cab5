package com.questrail.vaultacl.codec;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BitmaskCodecTests
{
    @Test
    void twoDistinctBitsDecodeToExactlyThoseOrdinals() {
        int[][] pairs = {{0, 1}, {0, 63}, {3, 17}, {15, 16}, {31, 32}, {62, 5}};
        for (int[] p : pairs) {
            long mask = BitmaskCodec.bit(p[0], BitmaskCodec.Width.U64)
                    | BitmaskCodec.bit(p[1], BitmaskCodec.Width.U64);
            List<Integer> expected = List.of(Math.min(p[0], p[1]), Math.max(p[0], p[1]));
            assertEquals(expected, BitmaskCodec.ordinalList(mask), "pair " + p[0] + "," + p[1]);
        }
    }

    @Test
    void ordinalsAreAscendingAndRestartable() {
        Iterable<Integer> ordinals = BitmaskCodec.ordinals(0b1010_0101L);

        List<Integer> first = new ArrayList<>();
        ordinals.forEach(first::add);
        List<Integer> second = new ArrayList<>();
        ordinals.forEach(second::add);

        assertEquals(List.of(0, 2, 5, 7), first);
        assertEquals(first, second);
        assertFalse(BitmaskCodec.ordinals(0).iterator().hasNext());
    }

    @Test
    void ordinalsIncludeTheSignBit() {
        assertEquals(List.of(63), BitmaskCodec.ordinalList(Long.MIN_VALUE));
    }

    @Test
    void bitRejectsOrdinalsOutsideTheWidth() {
        assertEquals(1L << 15, BitmaskCodec.bit(15, BitmaskCodec.Width.U16));
        assertThrows(IllegalArgumentException.class, () -> BitmaskCodec.bit(16, BitmaskCodec.Width.U16));
        assertThrows(IllegalArgumentException.class, () -> BitmaskCodec.bit(-1, BitmaskCodec.Width.U64));
        assertThrows(IllegalArgumentException.class, () -> BitmaskCodec.bit(64, BitmaskCodec.Width.U64));
    }

    @Test
    void unknownBitsRenderAsTheirNumericValue() {
        List<String> names = BitmaskCodec.names(0b1101, ordinal -> ordinal == 0 ? "Transfer" : null);
        assertEquals(List.of("Transfer", "4", "8"), names);
    }

    @Test
    void singleBitHelpers() {
        assertTrue(BitmaskCodec.isSingleBit(0b100));
        assertFalse(BitmaskCodec.isSingleBit(0b101));
        assertFalse(BitmaskCodec.isSingleBit(0));
        assertEquals(2, BitmaskCodec.ordinalOf(0b100));
        assertThrows(IllegalArgumentException.class, () -> BitmaskCodec.ordinalOf(0b11));
    }

    @Test
    void formatBitsPadsToWidth() {
        assertEquals("0000000000000101", BitmaskCodec.formatBits(0b101, BitmaskCodec.Width.U16));
        assertEquals(0xFFFFL, BitmaskCodec.Width.U16.allOnes());
        assertEquals(-1L, BitmaskCodec.Width.U64.allOnes());
    }
}

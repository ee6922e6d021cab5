package com.questrail.vaultacl.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PermissionIndexTests
{
    @Test
    void arrayPermissionIndexProvidesBidirectionalLookup() {
        ArrayPermissionIndex index = new ArrayPermissionIndex("Deposit", "Withdraw", "Borrow");

        assertEquals(0, index.indexOf("Deposit"));
        assertEquals(2, index.indexOf("Borrow"));
        assertEquals("Withdraw", index.nameAt(1));
        assertEquals(3, index.size());
        assertEquals(List.of("Deposit", "Withdraw", "Borrow"), index.allNames());
    }

    @Test
    void resolveIgnoresCaseButReturnsCanonicalName() {
        ArrayPermissionIndex index = new ArrayPermissionIndex("SwapAny", "SwapLst");

        assertEquals("SwapLst", index.tryResolve(" swaplst ").orElseThrow());
        assertTrue(index.tryResolve("SwapAll").isEmpty());
        // Exact lookup stays exact.
        assertFalse(index.contains("swaplst"));
        assertTrue(index.contains("SwapLst"));
    }

    @Test
    void unknownNameOrIndexThrows() {
        ArrayPermissionIndex index = new ArrayPermissionIndex("Transfer");

        assertThrows(IllegalArgumentException.class, () -> index.indexOf("Stake"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.nameAt(1));
        assertTrue(index.tryNameAt(1).isEmpty());
        assertTrue(index.tryNameAt(-1).isEmpty());
    }

    @Test
    void duplicatesAreRejectedIgnoringCase() {
        assertThrows(IllegalArgumentException.class, () -> new ArrayPermissionIndex("Stake", "Stake"));
        assertThrows(IllegalArgumentException.class, () -> new ArrayPermissionIndex("Stake", "stake"));
    }

    @Test
    void atMostSixtyFourPermissions() {
        String[] names = new String[65];
        for (int i = 0; i < names.length; i++) {
            names[i] = "P" + i;
        }
        assertThrows(IllegalArgumentException.class, () -> new ArrayPermissionIndex(names));
        assertEquals(0, ArrayPermissionIndex.empty().size());
    }
}

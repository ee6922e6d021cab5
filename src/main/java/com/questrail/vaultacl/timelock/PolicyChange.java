package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.api.Principal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Differences in one protocol's policy between live and staged state.
 *
 * <p>When either payload cannot be decoded against the protocol's schema
 * only the fact that the bytes differ is known; {@code opaque} is then
 * {@code true} and both maps are empty. Maps keep schema field order.</p>
 */
public record PolicyChange(int protocolBitflag,
                           Map<String, Diff<Principal, Void>> allowlistChanges,
                           Map<String, ValueChange<Long>> scalarChanges,
                           boolean opaque)
{
    public PolicyChange {
        allowlistChanges = Collections.unmodifiableMap(new LinkedHashMap<>(allowlistChanges));
        scalarChanges = Collections.unmodifiableMap(new LinkedHashMap<>(scalarChanges));
    }

    static PolicyChange opaque(int protocolBitflag) {
        return new PolicyChange(protocolBitflag, Map.of(), Map.of(), true);
    }
}

package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.api.PublicKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * IntegrationAcl
 * -----------------------------------------------------------------------------
 * One integration program enabled for the vault.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code protocolsBitmask} fits in 16 bits; bit {@code i} set means
 *       protocol {@code i} of the integration is enabled.</li>
 *   <li>At most one {@link ProtocolPolicyEntry} per protocol bitflag.</li>
 *   <li>A policy is only ever <em>set</em> while its protocol bit is on.
 *       Turning the bit off later leaves the entry in place, dormant.</li>
 * </ul>
 */
public record IntegrationAcl(PublicKey integrationProgram,
                             int protocolsBitmask,
                             List<ProtocolPolicyEntry> protocolPolicies)
{
    public IntegrationAcl {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        if ((protocolsBitmask & ~0xFFFF) != 0) {
            throw new IllegalArgumentException("protocolsBitmask must fit in 16 bits: 0x"
                    + Integer.toHexString(protocolsBitmask));
        }
        protocolPolicies = List.copyOf(protocolPolicies);
        Set<Integer> seen = new HashSet<>();
        for (ProtocolPolicyEntry e : protocolPolicies) {
            if (!seen.add(e.protocolBitflag())) {
                throw new IllegalArgumentException("Duplicate policy for protocol bitflag 0b"
                        + Integer.toBinaryString(e.protocolBitflag()) + " on " + integrationProgram);
            }
        }
    }

    public boolean isProtocolEnabled(int protocolBitflag) {
        return (protocolsBitmask & protocolBitflag) == protocolBitflag && protocolBitflag != 0;
    }

    public Optional<ProtocolPolicyEntry> policy(int protocolBitflag) {
        return protocolPolicies.stream()
                .filter(e -> e.protocolBitflag() == protocolBitflag)
                .findFirst();
    }

    public IntegrationAcl withProtocolsBitmask(int mask) {
        return new IntegrationAcl(integrationProgram, mask, protocolPolicies);
    }

    /**
     * Returns a copy with the policy for {@code entry.protocolBitflag()}
     * replaced, or appended if there was none.
     */
    public IntegrationAcl withPolicy(ProtocolPolicyEntry entry) {
        Objects.requireNonNull(entry, "entry");
        List<ProtocolPolicyEntry> list = new ArrayList<>(protocolPolicies.size() + 1);
        boolean replaced = false;
        for (ProtocolPolicyEntry e : protocolPolicies) {
            if (e.protocolBitflag() == entry.protocolBitflag()) {
                list.add(entry);
                replaced = true;
            } else {
                list.add(e);
            }
        }
        if (!replaced) {
            list.add(entry);
        }
        return new IntegrationAcl(integrationProgram, protocolsBitmask, list);
    }
}

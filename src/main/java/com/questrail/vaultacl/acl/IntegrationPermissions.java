package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.api.PublicKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-protocol permissions a delegate holds on one integration program.
 * At most one entry per protocol bitflag.
 */
public record IntegrationPermissions(PublicKey integrationProgram, List<ProtocolPermissions> protocolPermissions)
{
    public IntegrationPermissions {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        protocolPermissions = List.copyOf(protocolPermissions);
        Set<Integer> seen = new HashSet<>();
        for (ProtocolPermissions p : protocolPermissions) {
            if (!seen.add(p.protocolBitflag())) {
                throw new IllegalArgumentException("Duplicate protocol bitflag 0b"
                        + Integer.toBinaryString(p.protocolBitflag()) + " for " + integrationProgram);
            }
        }
    }

    public Optional<ProtocolPermissions> protocol(int protocolBitflag) {
        return protocolPermissions.stream()
                .filter(p -> p.protocolBitflag() == protocolBitflag)
                .findFirst();
    }

    /**
     * Returns a copy with the entry for {@code updated.protocolBitflag()}
     * replaced, or appended if absent. An entry whose bitmask is zero is
     * dropped.
     */
    public IntegrationPermissions withProtocol(ProtocolPermissions updated) {
        Objects.requireNonNull(updated, "updated");
        List<ProtocolPermissions> list = new ArrayList<>(protocolPermissions.size() + 1);
        boolean replaced = false;
        for (ProtocolPermissions p : protocolPermissions) {
            if (p.protocolBitflag() == updated.protocolBitflag()) {
                replaced = true;
                if (updated.permissionsBitmask() != 0) {
                    list.add(updated);
                }
            } else {
                list.add(p);
            }
        }
        if (!replaced && updated.permissionsBitmask() != 0) {
            list.add(updated);
        }
        return new IntegrationPermissions(integrationProgram, list);
    }

    public boolean isEmpty() {
        return protocolPermissions.isEmpty();
    }
}

package com.questrail.vaultacl.registry;

import com.questrail.vaultacl.api.PublicKey;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An integration program and the protocols it exposes.
 *
 * @param name      display name, e.g. {@code "ExtDrift"}
 * @param program   deployed program key
 * @param protocols protocols in bit order; bitflags are unique
 */
public record IntegrationDescriptor(String name, PublicKey program, List<ProtocolDescriptor> protocols)
{
    public IntegrationDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(program, "program");
        protocols = List.copyOf(protocols);
        Set<Integer> seen = new HashSet<>();
        for (ProtocolDescriptor p : protocols) {
            if (!seen.add(p.bitflag())) {
                throw new IllegalArgumentException(name + ": duplicate protocol bitflag 0b"
                        + Integer.toBinaryString(p.bitflag()));
            }
        }
    }

    public Optional<ProtocolDescriptor> protocol(int bitflag) {
        return protocols.stream().filter(p -> p.bitflag() == bitflag).findFirst();
    }

    /**
     * Bitwise OR of every declared protocol bitflag.
     */
    public int allProtocolsMask() {
        int mask = 0;
        for (ProtocolDescriptor p : protocols) {
            mask |= p.bitflag();
        }
        return mask;
    }
}

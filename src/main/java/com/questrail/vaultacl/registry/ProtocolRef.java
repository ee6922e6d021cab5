package com.questrail.vaultacl.registry;

import com.questrail.vaultacl.api.PublicKey;

import java.util.Objects;

/**
 * Result of resolving a protocol by name: where it lives and what it is.
 */
public record ProtocolRef(PublicKey integrationProgram, ProtocolDescriptor descriptor)
{
    public ProtocolRef {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        Objects.requireNonNull(descriptor, "descriptor");
    }

    public int protocolBitflag() {
        return descriptor.bitflag();
    }

    public String name() {
        return descriptor.name();
    }
}

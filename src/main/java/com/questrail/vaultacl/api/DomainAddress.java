package com.questrail.vaultacl.api;

import java.util.Objects;

/**
 * A cross-chain destination: a 4-byte domain id paired with a 32-byte address.
 *
 * <p>Both components form the identity. The same address on two domains is two
 * distinct principals.</p>
 *
 * @param domain  unsigned 32-bit domain identifier (stored in an {@code int})
 * @param address destination address on that domain
 */
public record DomainAddress(int domain, PublicKey address) implements Principal
{
    public DomainAddress {
        Objects.requireNonNull(address, "address");
    }

    @Override
    public String display() {
        return Integer.toUnsignedString(domain) + ":" + address.toBase58();
    }
}

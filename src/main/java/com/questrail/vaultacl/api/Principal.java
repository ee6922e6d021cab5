package com.questrail.vaultacl.api;

/**
 * Principal
 * -----------------------------------------------------------------------------
 * A single member of an allowlist: something an operation may target.
 *
 * <h2>Identity</h2>
 * Every principal has a natural identity used for membership and for diffing.
 * Implementations must base {@code equals}/{@code hashCode} on every component
 * of that identity. A {@link DomainAddress} therefore only equals another
 * {@code DomainAddress} whose domain <b>and</b> address both match, while a
 * {@link PublicKey} has a single component.
 *
 * <h2>Encoding</h2>
 * Principals do not know how they are laid out on the wire. Fixed-size record
 * layouts live in {@code policy.PrincipalCodec}.
 */
public sealed interface Principal permits PublicKey, DomainAddress, MarketIndex
{
    /**
     * Returns a short human-readable rendering suitable for logs and listings.
     */
    String display();
}

package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.api.PublicKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DelegateAcl
 * -----------------------------------------------------------------------------
 * Everything one delegate may do on behalf of the vault.
 *
 * <ul>
 *   <li>{@code expiresAt} is a unix timestamp in seconds; {@code 0} never expires.</li>
 *   <li>At most one {@link IntegrationPermissions} per integration program.</li>
 *   <li>A delegate with no integration permissions is inert but may still be
 *       listed until pruned.</li>
 * </ul>
 */
public record DelegateAcl(PublicKey pubkey, long expiresAt, List<IntegrationPermissions> integrationPermissions)
{
    /** {@link #expiresAt} value meaning "never expires". */
    public static final long NEVER = 0;

    public DelegateAcl {
        Objects.requireNonNull(pubkey, "pubkey");
        if (expiresAt < 0) {
            throw new IllegalArgumentException("expiresAt must not be negative: " + expiresAt);
        }
        integrationPermissions = List.copyOf(integrationPermissions);
        Set<PublicKey> seen = new HashSet<>();
        for (IntegrationPermissions ip : integrationPermissions) {
            if (!seen.add(ip.integrationProgram())) {
                throw new IllegalArgumentException("Duplicate integration " + ip.integrationProgram()
                        + " for delegate " + pubkey);
            }
        }
    }

    /**
     * A new delegate with no permissions and no expiry.
     */
    public static DelegateAcl empty(PublicKey pubkey) {
        return new DelegateAcl(pubkey, NEVER, List.of());
    }

    public boolean isExpired(long now) {
        return expiresAt != NEVER && now >= expiresAt;
    }

    public boolean isInert() {
        return integrationPermissions.isEmpty();
    }

    public Optional<IntegrationPermissions> integration(PublicKey integrationProgram) {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        return integrationPermissions.stream()
                .filter(ip -> ip.integrationProgram().equals(integrationProgram))
                .findFirst();
    }

    /**
     * Permission bitmask held on one protocol, {@code 0} if none.
     */
    public long permissionsBitmask(PublicKey integrationProgram, int protocolBitflag) {
        return integration(integrationProgram)
                .flatMap(ip -> ip.protocol(protocolBitflag))
                .map(ProtocolPermissions::permissionsBitmask)
                .orElse(0L);
    }

    public DelegateAcl withExpiresAt(long newExpiresAt) {
        return new DelegateAcl(pubkey, newExpiresAt, integrationPermissions);
    }

    /**
     * Returns a copy with the integration entry replaced or appended. An
     * entry left with no protocols is dropped.
     */
    public DelegateAcl withIntegration(IntegrationPermissions updated) {
        Objects.requireNonNull(updated, "updated");
        List<IntegrationPermissions> list = new ArrayList<>(integrationPermissions.size() + 1);
        boolean replaced = false;
        for (IntegrationPermissions ip : integrationPermissions) {
            if (ip.integrationProgram().equals(updated.integrationProgram())) {
                replaced = true;
                if (!updated.isEmpty()) {
                    list.add(updated);
                }
            } else {
                list.add(ip);
            }
        }
        if (!replaced && !updated.isEmpty()) {
            list.add(updated);
        }
        return new DelegateAcl(pubkey, expiresAt, list);
    }
}

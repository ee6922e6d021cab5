package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.api.DelegateNotFoundException;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.api.UnknownPermissionException;
import com.questrail.vaultacl.codec.BitmaskCodec;
import com.questrail.vaultacl.registry.PermissionSelection;
import com.questrail.vaultacl.registry.ProtocolDescriptor;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DelegateAccessControl
 * -----------------------------------------------------------------------------
 * Pure operations over a vault's delegate list.
 *
 * <h2>Role in the architecture</h2>
 * Every method takes the current {@code delegateAcls} value and returns the
 * proposed replacement. Nothing here talks to the ledger or reads a clock;
 * callers pass {@code now} explicitly and decide whether the result is
 * submitted directly or staged behind the timelock.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Grants are additive: the requested bits are OR-ed into the existing
 *       mask and unrelated bits are never cleared.</li>
 *   <li>Revoking from a delegate, integration or protocol that has no entry
 *       is a no-op and creates nothing.</li>
 *   <li>Protocol and permission bits are checked against the registry before
 *       anything is built, so a bad request never yields a partial result.</li>
 * </ul>
 */
public final class DelegateAccessControl
{
    private final ProtocolPolicyRegistry registry;

    public DelegateAccessControl(ProtocolPolicyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public static Optional<DelegateAcl> find(List<DelegateAcl> acls, PublicKey delegate) {
        Objects.requireNonNull(acls, "acls");
        Objects.requireNonNull(delegate, "delegate");
        return acls.stream().filter(a -> a.pubkey().equals(delegate)).findFirst();
    }

    /**
     * Returns {@code true} only if the delegate exists, has not expired at
     * {@code now}, and holds every bit of {@code permissionBits} on the
     * protocol.
     */
    public static boolean hasPermission(List<DelegateAcl> acls,
                                        PublicKey delegate,
                                        PublicKey integrationProgram,
                                        int protocolBitflag,
                                        long permissionBits,
                                        long now) {
        Optional<DelegateAcl> acl = find(acls, delegate);
        if (acl.isEmpty() || acl.get().isExpired(now)) {
            return false;
        }
        return acl.get().integration(integrationProgram)
                .flatMap(ip -> ip.protocol(protocolBitflag))
                .map(p -> p.grants(permissionBits))
                .orElse(false);
    }

    // ---------------------------------------------------------------------
    // Mutations (return the proposed replacement list)
    // ---------------------------------------------------------------------

    public List<DelegateAcl> grant(List<DelegateAcl> acls, PublicKey delegate, PermissionSelection selection) {
        Objects.requireNonNull(selection, "selection");
        return grant(acls, delegate,
                selection.protocol().integrationProgram(),
                selection.protocol().protocolBitflag(),
                selection.permissionsBitmask());
    }

    /**
     * Adds {@code permissionsBitmask} to the delegate's permissions on one
     * protocol, creating the delegate (never expiring) if it is not listed.
     */
    public List<DelegateAcl> grant(List<DelegateAcl> acls,
                                   PublicKey delegate,
                                   PublicKey integrationProgram,
                                   int protocolBitflag,
                                   long permissionsBitmask) {
        Objects.requireNonNull(acls, "acls");
        Objects.requireNonNull(delegate, "delegate");
        validate(integrationProgram, protocolBitflag, permissionsBitmask);

        DelegateAcl acl = find(acls, delegate).orElseGet(() -> DelegateAcl.empty(delegate));
        IntegrationPermissions ip = acl.integration(integrationProgram)
                .orElseGet(() -> new IntegrationPermissions(integrationProgram, List.of()));
        long existing = ip.protocol(protocolBitflag).map(ProtocolPermissions::permissionsBitmask).orElse(0L);

        ProtocolPermissions updated = new ProtocolPermissions(protocolBitflag, existing | permissionsBitmask);
        return upsert(acls, acl.withIntegration(ip.withProtocol(updated)));
    }

    public List<DelegateAcl> revoke(List<DelegateAcl> acls, PublicKey delegate, PermissionSelection selection) {
        Objects.requireNonNull(selection, "selection");
        return revoke(acls, delegate,
                selection.protocol().integrationProgram(),
                selection.protocol().protocolBitflag(),
                selection.permissionsBitmask());
    }

    /**
     * Clears {@code permissionsBitmask} from the delegate's permissions on
     * one protocol. A protocol left with no bits is removed from the
     * delegate; the delegate itself stays listed.
     */
    public List<DelegateAcl> revoke(List<DelegateAcl> acls,
                                    PublicKey delegate,
                                    PublicKey integrationProgram,
                                    int protocolBitflag,
                                    long permissionsBitmask) {
        Objects.requireNonNull(acls, "acls");
        Objects.requireNonNull(delegate, "delegate");
        validate(integrationProgram, protocolBitflag, permissionsBitmask);

        Optional<DelegateAcl> acl = find(acls, delegate);
        Optional<IntegrationPermissions> ip = acl.flatMap(a -> a.integration(integrationProgram));
        Optional<ProtocolPermissions> pp = ip.flatMap(i -> i.protocol(protocolBitflag));
        if (pp.isEmpty()) {
            return List.copyOf(acls);
        }

        ProtocolPermissions updated = pp.get().withPermissionsBitmask(
                pp.get().permissionsBitmask() & ~permissionsBitmask);
        return upsert(acls, acl.get().withIntegration(ip.get().withProtocol(updated)));
    }

    /**
     * Removes the delegate entirely.
     *
     * @throws DelegateNotFoundException if the delegate is not listed
     */
    public List<DelegateAcl> revokeAll(List<DelegateAcl> acls, PublicKey delegate) {
        if (find(acls, delegate).isEmpty()) {
            throw new DelegateNotFoundException(delegate);
        }
        return removeIfPresent(acls, delegate);
    }

    /**
     * Like {@link #revokeAll} but tolerates an absent delegate. Used to
     * scrub a staged list that may never have contained it.
     */
    public static List<DelegateAcl> removeIfPresent(List<DelegateAcl> acls, PublicKey delegate) {
        Objects.requireNonNull(acls, "acls");
        Objects.requireNonNull(delegate, "delegate");
        List<DelegateAcl> out = new ArrayList<>(acls.size());
        for (DelegateAcl a : acls) {
            if (!a.pubkey().equals(delegate)) {
                out.add(a);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Sets the delegate's expiry ({@link DelegateAcl#NEVER} to clear it).
     *
     * @throws DelegateNotFoundException if the delegate is not listed
     */
    public List<DelegateAcl> setExpiry(List<DelegateAcl> acls, PublicKey delegate, long expiresAt) {
        DelegateAcl acl = find(acls, delegate).orElseThrow(() -> new DelegateNotFoundException(delegate));
        return upsert(acls, acl.withExpiresAt(expiresAt));
    }

    /**
     * Drops delegates that have expired at {@code now} or hold no permissions.
     */
    public static List<DelegateAcl> pruneExpired(List<DelegateAcl> acls, long now) {
        Objects.requireNonNull(acls, "acls");
        List<DelegateAcl> out = new ArrayList<>(acls.size());
        for (DelegateAcl a : acls) {
            if (!a.isExpired(now) && !a.isInert()) {
                out.add(a);
            }
        }
        return List.copyOf(out);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void validate(PublicKey integrationProgram, int protocolBitflag, long permissionsBitmask) {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        ProtocolDescriptor protocol = registry.resolve(integrationProgram, protocolBitflag);
        if (permissionsBitmask == 0) {
            throw new IllegalArgumentException("Empty permission mask for protocol " + protocol.name());
        }
        for (int ordinal : BitmaskCodec.ordinals(permissionsBitmask)) {
            if (protocol.permissionNameAt(ordinal) == null) {
                throw new UnknownPermissionException(protocol.name(),
                        Long.toUnsignedString(1L << ordinal),
                        protocol.permissions().allNames());
            }
        }
    }

    private static List<DelegateAcl> upsert(List<DelegateAcl> acls, DelegateAcl updated) {
        List<DelegateAcl> out = new ArrayList<>(acls.size() + 1);
        boolean replaced = false;
        for (DelegateAcl a : acls) {
            if (a.pubkey().equals(updated.pubkey())) {
                out.add(updated);
                replaced = true;
            } else {
                out.add(a);
            }
        }
        if (!replaced) {
            out.add(updated);
        }
        return List.copyOf(out);
    }
}

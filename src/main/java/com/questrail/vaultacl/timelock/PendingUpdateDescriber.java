package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.acl.DelegateAcl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.acl.IntegrationPermissions;
import com.questrail.vaultacl.acl.ProtocolPermissions;
import com.questrail.vaultacl.api.Principal;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * PendingUpdateDescriber
 * -----------------------------------------------------------------------------
 * Renders the pending updates of a {@link VaultState} as indented,
 * human-readable lines, one block per staged field.
 *
 * <pre>
 *   integrationAcls:
 *     Modified integrations:
 *       [~] 9xQeWvG8...
 *           Enabling: DriftVaults
 *   delegateAcls:
 *     Added delegates:
 *       [+] 4Nd1mBQt...
 *           Expires: never
 *           Permissions:
 *             DriftProtocol: Deposit, Withdraw
 *   timelockDuration: 3600s → 0s
 * </pre>
 */
public final class PendingUpdateDescriber
{
    private final ProtocolPolicyRegistry registry;
    private final AclDiffs diffs;

    public PendingUpdateDescriber(ProtocolPolicyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.diffs = new AclDiffs(registry);
    }

    public List<String> describe(VaultState state) {
        Objects.requireNonNull(state, "state");
        List<String> out = new ArrayList<>();
        for (StateField field : state.timelock().pendingUpdates().keySet()) {
            switch (field) {
                case INTEGRATION_ACLS -> integrations(out, state.integrationAcls(), state.proposedIntegrationAcls());
                case DELEGATE_ACLS -> delegates(out, state.delegateAcls(), state.proposedDelegateAcls());
                case ASSETS -> keys(out, field, state.assets(), state.proposedAssets());
                case BORROWABLE -> keys(out, field, state.borrowable(), state.proposedBorrowable());
                case TIMELOCK_DURATION -> out.add("  " + field + ": " + state.timelockDuration()
                        + "s → " + state.proposedTimelockDuration() + "s");
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------

    private void integrations(List<String> out, List<IntegrationAcl> current, List<IntegrationAcl> staged) {
        Diff<IntegrationAcl, IntegrationChange> d = diffs.integrationAcls(current, staged);
        if (d.isEmpty()) {
            out.add("  " + StateField.INTEGRATION_ACLS + ": No changes");
            return;
        }
        out.add("  " + StateField.INTEGRATION_ACLS + ":");
        if (!d.added().isEmpty()) {
            out.add("    Added integrations:");
            for (IntegrationAcl acl : d.added()) {
                out.add("      [+] " + acl.integrationProgram().abbreviated()
                        + " (" + protocolList(acl.integrationProgram(), acl.protocolsBitmask()) + ")");
            }
        }
        if (!d.removed().isEmpty()) {
            out.add("    Removed integrations:");
            for (IntegrationAcl acl : d.removed()) {
                out.add("      [-] " + acl.integrationProgram().abbreviated()
                        + " (" + protocolList(acl.integrationProgram(), acl.protocolsBitmask()) + ")");
            }
        }
        if (!d.modified().isEmpty()) {
            out.add("    Modified integrations:");
            for (IntegrationChange mod : d.modified()) {
                PublicKey program = mod.integrationProgram();
                out.add("      [~] " + program.abbreviated());
                if (mod.enabledProtocols() != 0) {
                    out.add("          Enabling: " + protocolList(program, mod.enabledProtocols()));
                }
                if (mod.disabledProtocols() != 0) {
                    out.add("          Disabling: " + protocolList(program, mod.disabledProtocols()));
                }
                if (!mod.policyChanges().isEmpty()) {
                    out.add("          Policy changes:");
                    for (PolicyChange pc : mod.policyChanges()) {
                        policy(out, program, pc);
                    }
                }
            }
        }
    }

    private void policy(List<String> out, PublicKey program, PolicyChange pc) {
        String protocol = registry.protocolName(program, pc.protocolBitflag());
        if (pc.opaque()) {
            out.add("            " + protocol + ": policy data changed");
            return;
        }
        out.add("            " + protocol + ":");
        for (Map.Entry<String, Diff<Principal, Void>> e : pc.allowlistChanges().entrySet()) {
            Diff<Principal, Void> d = e.getValue();
            if (!d.added().isEmpty()) {
                out.add("              " + e.getKey() + " adding: " + principals(d.added()));
            }
            if (!d.removed().isEmpty()) {
                out.add("              " + e.getKey() + " removing: " + principals(d.removed()));
            }
        }
        for (Map.Entry<String, ValueChange<Long>> e : pc.scalarChanges().entrySet()) {
            out.add("              " + e.getKey() + ": " + e.getValue().current() + " → " + e.getValue().staged());
        }
    }

    private void delegates(List<String> out, List<DelegateAcl> current, List<DelegateAcl> staged) {
        Diff<DelegateAcl, DelegateChange> d = diffs.delegateAcls(current, staged);
        if (d.isEmpty()) {
            out.add("  " + StateField.DELEGATE_ACLS + ": No changes");
            return;
        }
        out.add("  " + StateField.DELEGATE_ACLS + ":");
        if (!d.added().isEmpty()) {
            out.add("    Added delegates:");
            for (DelegateAcl acl : d.added()) {
                out.add("      [+] " + acl.pubkey().abbreviated());
                out.add("          Expires: " + expiry(acl.expiresAt()));
                if (!acl.integrationPermissions().isEmpty()) {
                    out.add("          Permissions:");
                    for (IntegrationPermissions ip : acl.integrationPermissions()) {
                        for (ProtocolPermissions pp : ip.protocolPermissions()) {
                            out.add("            "
                                    + registry.protocolName(ip.integrationProgram(), pp.protocolBitflag()) + ": "
                                    + permissionList(ip.integrationProgram(), pp.protocolBitflag(), pp.permissionsBitmask()));
                        }
                    }
                }
            }
        }
        if (!d.removed().isEmpty()) {
            out.add("    Removed delegates:");
            for (DelegateAcl acl : d.removed()) {
                out.add("      [-] " + acl.pubkey().abbreviated());
            }
        }
        if (!d.modified().isEmpty()) {
            out.add("    Modified delegates:");
            for (DelegateChange mod : d.modified()) {
                out.add("      [~] " + mod.pubkey().abbreviated());
                if (mod.expiryChanged()) {
                    out.add("          Expiration: " + expiry(mod.currentExpiresAt())
                            + " → " + expiry(mod.stagedExpiresAt()));
                }
                if (!mod.permissionChanges().isEmpty()) {
                    out.add("          Permission changes:");
                    for (PermissionChange pc : mod.permissionChanges()) {
                        out.add("            " + registry.protocolName(pc.integrationProgram(), pc.protocolBitflag()) + ":");
                        if (pc.addedPermissions() != 0) {
                            out.add("              Adding: " + permissionList(
                                    pc.integrationProgram(), pc.protocolBitflag(), pc.addedPermissions()));
                        }
                        if (pc.removedPermissions() != 0) {
                            out.add("              Removing: " + permissionList(
                                    pc.integrationProgram(), pc.protocolBitflag(), pc.removedPermissions()));
                        }
                    }
                }
            }
        }
    }

    private static void keys(List<String> out, StateField field, List<PublicKey> current, List<PublicKey> staged) {
        Diff<PublicKey, Void> d = AclDiffs.keys(current, staged);
        if (d.isEmpty()) {
            out.add("  " + field + ": No changes");
            return;
        }
        out.add("  " + field + ":");
        d.added().forEach(k -> out.add("    [+] " + k.abbreviated()));
        d.removed().forEach(k -> out.add("    [-] " + k.abbreviated()));
    }

    private String protocolList(PublicKey program, int mask) {
        return String.join(", ", registry.protocolNames(program, mask));
    }

    private String permissionList(PublicKey program, int bitflag, long mask) {
        return String.join(", ", registry.permissionNames(program, bitflag, mask));
    }

    private static String principals(List<Principal> principals) {
        return principals.stream().map(Principal::display).collect(Collectors.joining(", "));
    }

    static String expiry(long expiresAt) {
        return expiresAt == DelegateAcl.NEVER ? "never" : Instant.ofEpochSecond(expiresAt).toString();
    }
}

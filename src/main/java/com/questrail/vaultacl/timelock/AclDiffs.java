package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.acl.DelegateAcl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.acl.IntegrationPermissions;
import com.questrail.vaultacl.acl.ProtocolPermissions;
import com.questrail.vaultacl.acl.ProtocolPolicyEntry;
import com.questrail.vaultacl.api.PolicyDecodeException;
import com.questrail.vaultacl.api.Principal;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.policy.AllowlistField;
import com.questrail.vaultacl.policy.PolicySchema;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.policy.ScalarField;
import com.questrail.vaultacl.registry.ProtocolDescriptor;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AclDiffs
 * -----------------------------------------------------------------------------
 * Computes {@link Diff}s between live and staged access-control values.
 *
 * <h2>Identity</h2>
 * <ul>
 *   <li>Integrations are matched by program key.</li>
 *   <li>Delegates are matched by public key.</li>
 *   <li>Protocol permissions and policies are matched by protocol bitflag.</li>
 *   <li>Allowlist entries are matched by principal.</li>
 * </ul>
 * Ordering never contributes to a difference at any level. Policies are
 * compared after decoding, so a payload that only lists the same principals
 * in another order is unchanged.
 */
public final class AclDiffs
{
    private final ProtocolPolicyRegistry registry;

    public AclDiffs(ProtocolPolicyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Diff<IntegrationAcl, IntegrationChange> integrationAcls(List<IntegrationAcl> current,
                                                                    List<IntegrationAcl> staged) {
        Map<PublicKey, IntegrationAcl> cur = byProgram(current);
        Map<PublicKey, IntegrationAcl> stg = byProgram(staged);

        List<IntegrationAcl> added = new ArrayList<>();
        List<IntegrationAcl> removed = new ArrayList<>();
        List<IntegrationChange> modified = new ArrayList<>();

        for (IntegrationAcl s : stg.values()) {
            IntegrationAcl c = cur.get(s.integrationProgram());
            if (c == null) {
                added.add(s);
                continue;
            }
            IntegrationChange change = new IntegrationChange(
                    s.integrationProgram(),
                    s.protocolsBitmask() & ~c.protocolsBitmask(),
                    c.protocolsBitmask() & ~s.protocolsBitmask(),
                    policies(c, s));
            if (!change.isEmpty()) {
                modified.add(change);
            }
        }
        for (IntegrationAcl c : cur.values()) {
            if (!stg.containsKey(c.integrationProgram())) {
                removed.add(c);
            }
        }
        return new Diff<>(added, removed, modified);
    }

    public Diff<DelegateAcl, DelegateChange> delegateAcls(List<DelegateAcl> current, List<DelegateAcl> staged) {
        Map<PublicKey, DelegateAcl> cur = new LinkedHashMap<>();
        current.forEach(a -> cur.put(a.pubkey(), a));
        Map<PublicKey, DelegateAcl> stg = new LinkedHashMap<>();
        staged.forEach(a -> stg.put(a.pubkey(), a));

        List<DelegateAcl> added = new ArrayList<>();
        List<DelegateAcl> removed = new ArrayList<>();
        List<DelegateChange> modified = new ArrayList<>();

        for (DelegateAcl s : stg.values()) {
            DelegateAcl c = cur.get(s.pubkey());
            if (c == null) {
                added.add(s);
                continue;
            }
            List<PermissionChange> permissions = permissions(c, s);
            if (c.expiresAt() != s.expiresAt() || !permissions.isEmpty()) {
                modified.add(new DelegateChange(s.pubkey(), c.expiresAt(), s.expiresAt(), permissions));
            }
        }
        for (DelegateAcl c : cur.values()) {
            if (!stg.containsKey(c.pubkey())) {
                removed.add(c);
            }
        }
        return new Diff<>(added, removed, modified);
    }

    public static Diff<PublicKey, Void> keys(List<PublicKey> current, List<PublicKey> staged) {
        return Diff.ofSets(current, staged);
    }

    public static Diff<Long, ValueChange<Long>> duration(long current, long staged) {
        if (current == staged) {
            return Diff.empty();
        }
        return new Diff<>(List.of(), List.of(), List.of(new ValueChange<>(current, staged)));
    }

    // ---------------------------------------------------------------------
    // Delegates
    // ---------------------------------------------------------------------

    private static List<PermissionChange> permissions(DelegateAcl current, DelegateAcl staged) {
        Set<PublicKey> programs = new LinkedHashSet<>();
        current.integrationPermissions().forEach(ip -> programs.add(ip.integrationProgram()));
        staged.integrationPermissions().forEach(ip -> programs.add(ip.integrationProgram()));

        List<PermissionChange> changes = new ArrayList<>();
        for (PublicKey program : programs) {
            Set<Integer> bitflags = new LinkedHashSet<>();
            current.integration(program).ifPresent(ip -> addBitflags(ip, bitflags));
            staged.integration(program).ifPresent(ip -> addBitflags(ip, bitflags));

            for (int bitflag : bitflags) {
                long c = current.permissionsBitmask(program, bitflag);
                long s = staged.permissionsBitmask(program, bitflag);
                if (c != s) {
                    changes.add(new PermissionChange(program, bitflag, s & ~c, c & ~s));
                }
            }
        }
        return changes;
    }

    private static void addBitflags(IntegrationPermissions ip, Set<Integer> out) {
        for (ProtocolPermissions p : ip.protocolPermissions()) {
            out.add(p.protocolBitflag());
        }
    }

    // ---------------------------------------------------------------------
    // Policies
    // ---------------------------------------------------------------------

    private List<PolicyChange> policies(IntegrationAcl current, IntegrationAcl staged) {
        Set<Integer> bitflags = new LinkedHashSet<>();
        current.protocolPolicies().forEach(e -> bitflags.add(e.protocolBitflag()));
        staged.protocolPolicies().forEach(e -> bitflags.add(e.protocolBitflag()));

        List<PolicyChange> changes = new ArrayList<>();
        for (int bitflag : bitflags) {
            Optional<ProtocolPolicyEntry> c = current.policy(bitflag);
            Optional<ProtocolPolicyEntry> s = staged.policy(bitflag);
            if (c.isPresent() && s.isPresent() && Arrays.equals(c.get().data(), s.get().data())) {
                continue;
            }
            policy(current.integrationProgram(), bitflag, c, s).ifPresent(changes::add);
        }
        return changes;
    }

    private Optional<PolicyChange> policy(PublicKey program,
                                          int bitflag,
                                          Optional<ProtocolPolicyEntry> current,
                                          Optional<ProtocolPolicyEntry> staged) {
        Optional<PolicySchema> schema = registry.tryResolve(program, bitflag)
                .flatMap(ProtocolDescriptor::policySchema);
        if (schema.isEmpty()) {
            return Optional.of(PolicyChange.opaque(bitflag));
        }

        ProtocolPolicy c;
        ProtocolPolicy s;
        try {
            c = decodeOrDefault(schema.get(), current);
            s = decodeOrDefault(schema.get(), staged);
        } catch (PolicyDecodeException e) {
            return Optional.of(PolicyChange.opaque(bitflag));
        }

        Map<String, Diff<Principal, Void>> lists = new LinkedHashMap<>();
        for (AllowlistField<?> f : schema.get().allowlists()) {
            Diff<Principal, Void> d = Diff.ofSets(c.allowlist(f.name()).entries(), s.allowlist(f.name()).entries());
            if (!d.isEmpty()) {
                lists.put(f.name(), d);
            }
        }
        Map<String, ValueChange<Long>> scalars = new LinkedHashMap<>();
        for (ScalarField f : schema.get().scalars()) {
            long cv = c.scalar(f.name());
            long sv = s.scalar(f.name());
            if (cv != sv) {
                scalars.put(f.name(), new ValueChange<>(cv, sv));
            }
        }
        if (lists.isEmpty() && scalars.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PolicyChange(bitflag, lists, scalars, false));
    }

    private static ProtocolPolicy decodeOrDefault(PolicySchema schema, Optional<ProtocolPolicyEntry> entry) {
        return entry.map(e -> schema.decode(e.data())).orElseGet(schema::newPolicy);
    }

    private static Map<PublicKey, IntegrationAcl> byProgram(List<IntegrationAcl> acls) {
        Map<PublicKey, IntegrationAcl> map = new LinkedHashMap<>();
        acls.forEach(a -> map.put(a.integrationProgram(), a));
        return map;
    }
}

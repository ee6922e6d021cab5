package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.acl.DelegateAccessControl;
import com.questrail.vaultacl.acl.DelegateAcl;
import com.questrail.vaultacl.acl.IntegrationAccessControl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.acl.IntegrationPermissions;
import com.questrail.vaultacl.acl.ProtocolPermissions;
import com.questrail.vaultacl.acl.ProtocolPolicyEntry;
import com.questrail.vaultacl.api.MarketIndex;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.api.TestKeys;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.registry.StandardProtocols;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.vaultacl.api.TestKeys.EXT_DRIFT;
import static com.questrail.vaultacl.api.TestKeys.EXT_KAMINO;
import static com.questrail.vaultacl.api.TestKeys.GLAM;
import static com.questrail.vaultacl.api.TestKeys.key;
import static org.junit.jupiter.api.Assertions.*;

class AclDiffsTests
{
    private static final PublicKey D1 = key(21);

    private final AclDiffs diffs = new AclDiffs(TestKeys.registry());
    private final IntegrationAccessControl integrations = new IntegrationAccessControl(TestKeys.registry());
    private final DelegateAccessControl delegates = new DelegateAccessControl(TestKeys.registry());

    @Test
    void integrationsAreAddedRemovedOrModified() {
        List<IntegrationAcl> current = integrations.enableIntegration(List.of(), GLAM, 0b001);
        current = integrations.enableIntegration(current, EXT_KAMINO, 0);
        List<IntegrationAcl> staged = integrations.enableIntegration(List.of(), GLAM, 0b110);
        staged = integrations.enableIntegration(staged, EXT_DRIFT, 0);

        Diff<IntegrationAcl, IntegrationChange> d = diffs.integrationAcls(current, staged);

        assertEquals(List.of(EXT_DRIFT), d.added().stream().map(IntegrationAcl::integrationProgram).toList());
        assertEquals(List.of(EXT_KAMINO), d.removed().stream().map(IntegrationAcl::integrationProgram).toList());
        IntegrationChange change = d.modified().get(0);
        assertEquals(GLAM, change.integrationProgram());
        assertEquals(0b110, change.enabledProtocols());
        assertEquals(0b001, change.disabledProtocols());
    }

    @Test
    void reorderedIntegrationsAreUnchanged() {
        List<IntegrationAcl> current = integrations.enableIntegration(List.of(), GLAM, 0);
        current = integrations.enableIntegration(current, EXT_DRIFT, 0);
        List<IntegrationAcl> staged = List.of(current.get(1), current.get(0));

        assertTrue(diffs.integrationAcls(current, staged).isEmpty());
    }

    @Test
    void policyPayloadListingTheSamePrincipalsInAnotherOrderIsUnchanged() {
        ProtocolPolicy ab = StandardProtocols.DRIFT_VAULTS_POLICY.newPolicy();
        ab.allowlist("vaultsAllowlist").addPrincipal(key(1));
        ab.allowlist("vaultsAllowlist").addPrincipal(key(2));
        ProtocolPolicy ba = StandardProtocols.DRIFT_VAULTS_POLICY.newPolicy();
        ba.allowlist("vaultsAllowlist").addPrincipal(key(2));
        ba.allowlist("vaultsAllowlist").addPrincipal(key(1));

        List<IntegrationAcl> base = integrations.enableIntegration(List.of(), EXT_DRIFT, 0);
        List<IntegrationAcl> current = integrations.setProtocolPolicy(base, EXT_DRIFT, 0b10, ab);
        List<IntegrationAcl> staged = integrations.setProtocolPolicy(base, EXT_DRIFT, 0b10, ba);

        assertTrue(diffs.integrationAcls(current, staged).isEmpty());
    }

    @Test
    void allowlistChangesAreReportedPerField() {
        ProtocolPolicy before = StandardProtocols.DRIFT_PROTOCOL_POLICY.newPolicy();
        before.allowlist("spotMarketsAllowlist").addPrincipal(MarketIndex.of(1));
        before.allowlist("spotMarketsAllowlist").addPrincipal(MarketIndex.of(2));
        ProtocolPolicy after = before.copy();
        after.allowlist("spotMarketsAllowlist").removePrincipal(MarketIndex.of(2));
        after.allowlist("spotMarketsAllowlist").addPrincipal(MarketIndex.of(3));

        List<IntegrationAcl> base = integrations.enableIntegration(List.of(), EXT_DRIFT, 0);
        Diff<IntegrationAcl, IntegrationChange> d = diffs.integrationAcls(
                integrations.setProtocolPolicy(base, EXT_DRIFT, 0b01, before),
                integrations.setProtocolPolicy(base, EXT_DRIFT, 0b01, after));

        PolicyChange pc = d.modified().get(0).policyChanges().get(0);
        assertEquals(0b01, pc.protocolBitflag());
        assertFalse(pc.opaque());
        assertEquals(List.of("spotMarketsAllowlist"), List.copyOf(pc.allowlistChanges().keySet()));
        assertEquals(List.of(MarketIndex.of(3)), pc.allowlistChanges().get("spotMarketsAllowlist").added());
        assertEquals(List.of(MarketIndex.of(2)), pc.allowlistChanges().get("spotMarketsAllowlist").removed());
        assertTrue(pc.scalarChanges().isEmpty());
    }

    @Test
    void newPolicyIsComparedAgainstTheDefault() {
        ProtocolPolicy swap = StandardProtocols.JUPITER_SWAP_POLICY.newPolicy();
        swap.setScalar("maxSlippageBps", 75);

        List<IntegrationAcl> base = integrations.enableIntegration(List.of(), GLAM, 0);
        Diff<IntegrationAcl, IntegrationChange> d = diffs.integrationAcls(
                base, integrations.setProtocolPolicy(base, GLAM, 0b100, swap));

        PolicyChange pc = d.modified().get(0).policyChanges().get(0);
        assertEquals(new ValueChange<>(50L, 75L), pc.scalarChanges().get("maxSlippageBps"));
        assertTrue(pc.allowlistChanges().isEmpty());
    }

    @Test
    void undecodablePolicyIsReportedAsOpaque() {
        List<IntegrationAcl> base = integrations.enableIntegration(List.of(), EXT_DRIFT, 0);
        IntegrationAcl corrupt = base.get(0).withPolicy(new ProtocolPolicyEntry(0b10, new byte[] {9, 0, 0, 0}));

        Diff<IntegrationAcl, IntegrationChange> d = diffs.integrationAcls(base, List.of(corrupt));

        assertTrue(d.modified().get(0).policyChanges().get(0).opaque());
    }

    @Test
    void delegatePermissionAndExpiryChanges() {
        List<DelegateAcl> current = delegates.grant(List.of(), D1, EXT_DRIFT, 0b01, 0b0011);
        List<DelegateAcl> staged = delegates.revoke(current, D1, EXT_DRIFT, 0b01, 0b0001);
        staged = delegates.grant(staged, D1, EXT_DRIFT, 0b01, 0b0100);
        staged = delegates.setExpiry(staged, D1, 1_800_000_000L);

        Diff<DelegateAcl, DelegateChange> d = diffs.delegateAcls(current, staged);

        DelegateChange change = d.modified().get(0);
        assertTrue(change.expiryChanged());
        assertEquals(List.of(new PermissionChange(EXT_DRIFT, 0b01, 0b0100, 0b0001)), change.permissionChanges());
    }

    @Test
    void delegateWithReorderedProtocolsIsUnchanged() {
        DelegateAcl a = new DelegateAcl(D1, 0, List.of(new IntegrationPermissions(EXT_DRIFT, List.of(
                new ProtocolPermissions(0b01, 0b1), new ProtocolPermissions(0b10, 0b1)))));
        DelegateAcl b = new DelegateAcl(D1, 0, List.of(new IntegrationPermissions(EXT_DRIFT, List.of(
                new ProtocolPermissions(0b10, 0b1), new ProtocolPermissions(0b01, 0b1)))));

        assertTrue(diffs.delegateAcls(List.of(a), List.of(b)).isEmpty());
    }

    @Test
    void durationDiff() {
        assertTrue(AclDiffs.duration(60, 60).isEmpty());
        assertEquals(List.of(new ValueChange<>(60L, 0L)), AclDiffs.duration(60, 0).modified());
    }
}

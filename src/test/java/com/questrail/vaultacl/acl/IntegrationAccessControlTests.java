package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.api.IntegrationNotEnabledException;
import com.questrail.vaultacl.api.MarketIndex;
import com.questrail.vaultacl.api.TestKeys;
import com.questrail.vaultacl.api.UnknownProtocolException;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.registry.StandardProtocols;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.vaultacl.api.TestKeys.EXT_DRIFT;
import static com.questrail.vaultacl.api.TestKeys.EXT_KAMINO;
import static com.questrail.vaultacl.api.TestKeys.GLAM;
import static com.questrail.vaultacl.api.TestKeys.key;
import static org.junit.jupiter.api.Assertions.*;

class IntegrationAccessControlTests
{
    private final IntegrationAccessControl control = new IntegrationAccessControl(TestKeys.registry());

    @Test
    void zeroMaskEnablesEveryDeclaredProtocol() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), EXT_DRIFT, 0);

        IntegrationAcl acl = IntegrationAccessControl.find(acls, EXT_DRIFT).orElseThrow();
        assertEquals(0b11, acl.protocolsBitmask());
        assertTrue(acl.protocolPolicies().isEmpty());
    }

    @Test
    void enablingTwiceIsRejected() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), GLAM, 0b001);

        assertThrows(IntegrationNotEnabledException.class, () -> control.enableIntegration(acls, GLAM, 0b010));
    }

    @Test
    void undeclaredProtocolBitIsRejected() {
        assertThrows(UnknownProtocolException.class, () -> control.enableIntegration(List.of(), EXT_DRIFT, 0b100));
        assertThrows(UnknownProtocolException.class, () -> control.enableIntegration(List.of(), key(99), 0));
    }

    @Test
    void protocolsToggleIndependently() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), GLAM, 0b001);
        acls = control.enableProtocols(acls, GLAM, 0b100);
        assertEquals(0b101, IntegrationAccessControl.find(acls, GLAM).orElseThrow().protocolsBitmask());

        acls = control.disableProtocols(acls, GLAM, 0b001);
        assertEquals(0b100, IntegrationAccessControl.find(acls, GLAM).orElseThrow().protocolsBitmask());
    }

    @Test
    void togglingProtocolsRequiresTheIntegration() {
        assertThrows(IntegrationNotEnabledException.class, () -> control.enableProtocols(List.of(), GLAM, 0b001));
    }

    @Test
    void policyNeedsItsProtocolEnabled() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), EXT_DRIFT, 0b10);
        ProtocolPolicy policy = StandardProtocols.DRIFT_PROTOCOL_POLICY.newPolicy();

        assertThrows(IntegrationNotEnabledException.class, () ->
                control.setProtocolPolicy(acls, EXT_DRIFT, 0b01, policy));
        assertThrows(IntegrationNotEnabledException.class, () ->
                control.setProtocolPolicy(List.of(), EXT_DRIFT, 0b01, policy));
    }

    @Test
    void policySchemaMustMatchTheProtocol() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), EXT_DRIFT, 0);

        assertThrows(IllegalArgumentException.class, () ->
                control.setProtocolPolicy(acls, EXT_DRIFT, 0b01, StandardProtocols.DRIFT_VAULTS_POLICY.newPolicy()));
    }

    @Test
    void protocolWithoutSchemaCannotTakeAPolicy() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), GLAM, 0);
        List<IntegrationAcl> kamino = control.enableIntegration(List.of(), EXT_KAMINO, 0);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> control.policy(acls, GLAM, 0b001));
        assertEquals("SystemProgram does not take a policy", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> control.policyOrDefault(kamino, EXT_KAMINO, 0b100));
    }

    @Test
    void unsetPolicyReadsAsDefault() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), GLAM, 0);

        assertTrue(control.policy(acls, GLAM, 0b100).isEmpty());
        ProtocolPolicy policy = control.policyOrDefault(acls, GLAM, 0b100);
        assertEquals(StandardProtocols.DEFAULT_MAX_SLIPPAGE_BPS, policy.scalar("maxSlippageBps"));
    }

    @Test
    void disabledProtocolKeepsItsPolicyDormant() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), EXT_DRIFT, 0);
        ProtocolPolicy policy = StandardProtocols.DRIFT_PROTOCOL_POLICY.newPolicy();
        policy.allowlist("spotMarketsAllowlist").addPrincipal(MarketIndex.of(1));
        acls = control.setProtocolPolicy(acls, EXT_DRIFT, 0b01, policy);

        acls = control.disableIntegration(acls, EXT_DRIFT);
        IntegrationAcl disabled = IntegrationAccessControl.find(acls, EXT_DRIFT).orElseThrow();
        assertFalse(disabled.isProtocolEnabled(0b01));
        assertEquals(policy, control.policy(acls, EXT_DRIFT, 0b01).orElseThrow());

        acls = control.enableProtocols(acls, EXT_DRIFT, 0b01);
        assertEquals(policy, control.policy(acls, EXT_DRIFT, 0b01).orElseThrow());
    }

    @Test
    void settingAPolicyReplacesThePreviousOne() {
        List<IntegrationAcl> acls = control.enableIntegration(List.of(), EXT_DRIFT, 0);
        ProtocolPolicy first = StandardProtocols.DRIFT_PROTOCOL_POLICY.newPolicy();
        first.allowlist("perpMarketsAllowlist").addPrincipal(MarketIndex.of(1));
        ProtocolPolicy second = StandardProtocols.DRIFT_PROTOCOL_POLICY.newPolicy();
        second.allowlist("perpMarketsAllowlist").addPrincipal(MarketIndex.of(2));

        acls = control.setProtocolPolicy(acls, EXT_DRIFT, 0b01, first);
        acls = control.setProtocolPolicy(acls, EXT_DRIFT, 0b01, second);

        assertEquals(1, IntegrationAccessControl.find(acls, EXT_DRIFT).orElseThrow().protocolPolicies().size());
        assertEquals(second, control.policy(acls, EXT_DRIFT, 0b01).orElseThrow());
    }
}

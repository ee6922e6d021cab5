package com.questrail.vaultacl.client;

import com.questrail.vaultacl.acl.IntegrationAccessControl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.api.IntegrationNotEnabledException;
import com.questrail.vaultacl.api.DomainAddress;
import com.questrail.vaultacl.api.MarketIndex;
import com.questrail.vaultacl.api.PolicyNotFoundException;
import com.questrail.vaultacl.api.PrincipalAlreadyAllowedException;
import com.questrail.vaultacl.api.PrincipalNotAllowedException;
import com.questrail.vaultacl.api.TestKeys;
import com.questrail.vaultacl.config.VaultAclConfig;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;
import com.questrail.vaultacl.registry.StandardProtocols;
import com.questrail.vaultacl.time.ManualEpochClock;
import com.questrail.vaultacl.timelock.TimelockState;
import com.questrail.vaultacl.timelock.VaultState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.vaultacl.api.TestKeys.EXT_DRIFT;
import static com.questrail.vaultacl.api.TestKeys.EXT_SPL;
import static com.questrail.vaultacl.api.TestKeys.GLAM;
import static com.questrail.vaultacl.api.TestKeys.key;
import static org.junit.jupiter.api.Assertions.*;

class PolicyEditorTests
{
    private static final String SPOT = "spotMarketsAllowlist";

    private final ProtocolPolicyRegistry registry = TestKeys.registry();
    private final IntegrationAccessControl integrations = new IntegrationAccessControl(registry);
    private final ManualEpochClock clock = new ManualEpochClock(1_700_000_000L);

    private InMemoryVaultStateStore store;
    private PolicyEditor editor;

    private void start(long duration) {
        List<IntegrationAcl> acls = integrations.enableIntegration(List.of(), GLAM, 0);
        acls = integrations.enableIntegration(acls, EXT_SPL, 0);
        acls = integrations.enableIntegration(acls, EXT_DRIFT, 0);
        ProtocolPolicy drift = StandardProtocols.DRIFT_PROTOCOL_POLICY.newPolicy();
        drift.allowlist(SPOT).addPrincipal(MarketIndex.of(1));
        drift.allowlist(SPOT).addPrincipal(MarketIndex.of(2));
        acls = integrations.setProtocolPolicy(acls, EXT_DRIFT, 0b01, drift);

        store = new InMemoryVaultStateStore(registry, clock,
                VaultState.of(acls, List.of(), List.of(), List.of(), TimelockState.idle(duration), 0));
        editor = VaultAccessService.builder()
                .withConfig(VaultAclConfig.builder().withPrograms(TestKeys.programs()).build())
                .withStateReader(store)
                .withStateMutator(store)
                .withClock(clock)
                .build()
                .policyEditor();
    }

    @Test
    void spotMarketsAllowAndDisallow() {
        start(0);

        editor.allow("DriftProtocol", SPOT, MarketIndex.of(3));
        assertEquals(List.of(MarketIndex.of(1), MarketIndex.of(2), MarketIndex.of(3)),
                editor.viewPolicy("DriftProtocol").allowlist(SPOT).entries());

        editor.disallow("DriftProtocol", SPOT, MarketIndex.of(2));
        assertEquals(List.of(MarketIndex.of(1), MarketIndex.of(3)),
                editor.viewPolicy("DriftProtocol").allowlist(SPOT).entries());
    }

    @Test
    void membershipPreconditionsFailBeforeSubmission() {
        start(0);

        assertThrows(PrincipalAlreadyAllowedException.class, () ->
                editor.allow("DriftProtocol", SPOT, MarketIndex.of(1)));
        assertThrows(PrincipalNotAllowedException.class, () ->
                editor.disallow("DriftProtocol", SPOT, MarketIndex.of(9)));
        assertThrows(IllegalArgumentException.class, () ->
                editor.allow("DriftProtocol", SPOT, key(1)));
        assertEquals(0, store.received());
    }

    @Test
    void viewingAPolicyThatWasNeverSetFails() {
        start(0);

        assertThrows(PolicyNotFoundException.class, () -> editor.viewPolicy("DriftVaults"));
        assertThrows(IllegalArgumentException.class, () -> editor.viewPolicy("SystemProgram"));
    }

    @Test
    void firstEditStartsFromTheDefaultPolicy() {
        start(0);

        editor.setScalar("JupiterSwap", "maxSlippageBps", 120);

        ProtocolPolicy swap = editor.viewPolicy("JupiterSwap");
        assertEquals(120, swap.scalar("maxSlippageBps"));
        assertTrue(swap.allowlist("swapAllowlist").isUnrestricted());
    }

    @Test
    void emptyAllowlistMeaningFollowsTheProtocol() {
        start(0);

        assertFalse(editor.permits("SplToken", "allowlist", key(4)));
        assertTrue(editor.permits("JupiterSwap", "swapAllowlist", key(4)));

        editor.allow("SplToken", "allowlist", key(4));
        assertTrue(editor.permits("SplToken", "allowlist", key(4)));
        assertFalse(editor.permits("SplToken", "allowlist", key(5)));

        editor.clearAllowlist("SplToken", "allowlist");
        assertFalse(editor.permits("SplToken", "allowlist", key(4)));

        int received = store.received();
        assertTrue(editor.clearAllowlist("SplToken", "allowlist").isEmpty());
        assertEquals(received, store.received());
    }

    @Test
    void editingADisabledIntegrationFails() {
        start(0);

        assertThrows(IntegrationNotEnabledException.class, () ->
                editor.allow("Cctp", "destinations", new DomainAddress(0, key(8))));
        assertEquals(0, store.received());
    }

    @Test
    void stagedEditsAccumulateOnTheStagedPolicy() {
        start(3600);

        editor.allow("DriftProtocol", SPOT, MarketIndex.of(3));
        editor.allow("DriftProtocol", SPOT, MarketIndex.of(4));

        VaultState state = store.fetchLiveState();
        ProtocolPolicy staged = integrations.policy(state.proposedIntegrationAcls(), EXT_DRIFT, 0b01).orElseThrow();
        assertEquals(List.of(MarketIndex.of(1), MarketIndex.of(2), MarketIndex.of(3), MarketIndex.of(4)),
                staged.allowlist(SPOT).entries());
        assertEquals(List.of(MarketIndex.of(1), MarketIndex.of(2)),
                editor.viewPolicy("DriftProtocol").allowlist(SPOT).entries());
    }
}

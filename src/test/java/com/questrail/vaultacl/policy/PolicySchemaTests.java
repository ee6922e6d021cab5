package com.questrail.vaultacl.policy;

import com.questrail.vaultacl.api.DomainAddress;
import com.questrail.vaultacl.api.MarketIndex;
import com.questrail.vaultacl.api.PolicyDecodeException;
import com.questrail.vaultacl.codec.PolicyBuffer;
import com.questrail.vaultacl.registry.StandardProtocols;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.vaultacl.api.TestKeys.key;
import static org.junit.jupiter.api.Assertions.*;

class PolicySchemaTests
{
    private static final String SPOT = "spotMarketsAllowlist";

    @Test
    void driftSpotMarketsSurviveRepeatedEditAndReencode() {
        PolicySchema schema = StandardProtocols.DRIFT_PROTOCOL_POLICY;
        ProtocolPolicy policy = schema.newPolicy();
        policy.allowlist(SPOT).addPrincipal(MarketIndex.of(1));
        policy.allowlist(SPOT).addPrincipal(MarketIndex.of(2));

        ProtocolPolicy stored = schema.decode(policy.encode());
        stored.allowlist(SPOT).addPrincipal(MarketIndex.of(3));
        stored = schema.decode(stored.encode());
        assertEquals(List.of(MarketIndex.of(1), MarketIndex.of(2), MarketIndex.of(3)),
                stored.allowlist(SPOT).entries());

        stored.allowlist(SPOT).removePrincipal(MarketIndex.of(2));
        stored = schema.decode(stored.encode());
        assertEquals(List.of(MarketIndex.of(1), MarketIndex.of(3)), stored.allowlist(SPOT).entries());
        assertTrue(stored.allowlist("perpMarketsAllowlist").isUnrestricted());
    }

    @Test
    void newSwapPolicyCarriesDefaultSlippage() {
        ProtocolPolicy policy = StandardProtocols.JUPITER_SWAP_POLICY.newPolicy();

        assertEquals(StandardProtocols.DEFAULT_MAX_SLIPPAGE_BPS, policy.scalar("maxSlippageBps"));
        assertEquals(6, policy.encode().length);
        assertEquals(6, StandardProtocols.JUPITER_SWAP_POLICY.minimumLength());
    }

    @Test
    void scalarsAreIndependentOfAllowlists() {
        PolicySchema schema = StandardProtocols.JUPITER_SWAP_POLICY;
        ProtocolPolicy policy = schema.newPolicy();
        policy.setScalar("maxSlippageBps", 100);
        policy.allowlist("swapAllowlist").addPrincipal(key(4));

        ProtocolPolicy decoded = schema.decode(policy.encode());

        assertEquals(100, decoded.scalar("maxSlippageBps"));
        assertEquals(List.of(key(4)), decoded.allowlist("swapAllowlist").entries());

        decoded.allowlist("swapAllowlist").clear();
        assertEquals(100, decoded.scalar("maxSlippageBps"));
    }

    @Test
    void scalarMustFitItsWidth() {
        ProtocolPolicy policy = StandardProtocols.JUPITER_SWAP_POLICY.newPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.setScalar("maxSlippageBps", 70_000));
        assertThrows(IllegalArgumentException.class, () -> policy.setScalar("slippage", 1));
        assertEquals(StandardProtocols.DEFAULT_MAX_SLIPPAGE_BPS, policy.scalar("maxSlippageBps"));
    }

    @Test
    void payloadShorterThanMinimumIsADecodeError() {
        assertThrows(PolicyDecodeException.class, () -> StandardProtocols.JUPITER_SWAP_POLICY.decode(new byte[5]));
        assertThrows(PolicyDecodeException.class, () -> StandardProtocols.DRIFT_PROTOCOL_POLICY.decode(new byte[8]));
    }

    @Test
    void declaredListLongerThanPayloadIsADecodeError() {
        byte[] bytes = PolicyBuffer.writer().u32(3).u16(1).u16(2).toByteArray();

        assertThrows(PolicyDecodeException.class, () -> StandardProtocols.DRIFT_VAULTS_POLICY.decode(bytes));
    }

    @Test
    void emptyMeaningComesFromTheSchema() {
        ProtocolPolicy transfer = StandardProtocols.TRANSFER_POLICY.newPolicy();
        ProtocolPolicy swap = StandardProtocols.JUPITER_SWAP_POLICY.newPolicy();
        ProtocolPolicy cctp = StandardProtocols.CCTP_POLICY.newPolicy();

        assertFalse(transfer.permits("allowlist", key(1)));
        assertTrue(swap.permits("swapAllowlist", key(1)));
        assertFalse(cctp.permits("destinations", new DomainAddress(0, key(1))));

        cctp.allowlist("destinations").addPrincipal(new DomainAddress(0, key(1)));
        assertTrue(cctp.permits("destinations", new DomainAddress(0, key(1))));
        assertFalse(cctp.permits("destinations", new DomainAddress(3, key(1))));
    }

    @Test
    void unknownAllowlistNameIsRejected() {
        ProtocolPolicy policy = StandardProtocols.TRANSFER_POLICY.newPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.allowlist("destinations"));
    }

    @Test
    void policyEqualityIgnoresAllowlistOrder() {
        PolicySchema schema = StandardProtocols.KAMINO_VAULTS_POLICY;
        ProtocolPolicy ab = schema.newPolicy();
        ab.allowlist("vaultsAllowlist").addPrincipal(key(1));
        ab.allowlist("vaultsAllowlist").addPrincipal(key(2));
        ProtocolPolicy ba = schema.newPolicy();
        ba.allowlist("vaultsAllowlist").addPrincipal(key(2));
        ba.allowlist("vaultsAllowlist").addPrincipal(key(1));

        assertEquals(ab, ba);
        assertNotEquals(ab, schema.newPolicy());
    }

    @Test
    void builderRejectsDuplicateFieldNames() {
        PolicySchema.Builder builder = PolicySchema.builder("Broken")
                .allowlist("list", PrincipalCodecs.PUBLIC_KEY, EmptyAllowlist.ALLOW_ALL);

        assertThrows(IllegalArgumentException.class, () ->
                builder.allowlist("list", PrincipalCodecs.MARKET_INDEX, EmptyAllowlist.ALLOW_ALL));
    }
}

package com.questrail.vaultacl.client;

import com.questrail.vaultacl.acl.IntegrationAccessControl;
import com.questrail.vaultacl.api.PolicyNotFoundException;
import com.questrail.vaultacl.api.Principal;
import com.questrail.vaultacl.api.PrincipalAlreadyAllowedException;
import com.questrail.vaultacl.api.PrincipalNotAllowedException;
import com.questrail.vaultacl.api.TransactionId;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.registry.ProtocolRef;

import java.util.Objects;
import java.util.Optional;

/**
 * PolicyEditor
 * -----------------------------------------------------------------------------
 * Allowlist and scalar edits on a protocol's policy, addressed by protocol
 * and field name, e.g. {@code allow("DriftProtocol", "spotMarketsAllowlist",
 * MarketIndex.of(3))}.
 *
 * <p>Each edit reads the policy the protocol will have once pending updates
 * land (or the schema default if none was ever set), checks the membership
 * precondition, and submits the whole policy as one integration update. A
 * failed precondition throws before anything is submitted.</p>
 */
public final class PolicyEditor
{
    private final VaultAccessService service;
    private final IntegrationAccessControl integrations;

    PolicyEditor(VaultAccessService service, IntegrationAccessControl integrations) {
        this.service = Objects.requireNonNull(service, "service");
        this.integrations = Objects.requireNonNull(integrations, "integrations");
    }

    /**
     * @throws PrincipalAlreadyAllowedException if the principal is already listed
     */
    public Optional<TransactionId> allow(String protocolName, String allowlist, Principal principal) {
        Objects.requireNonNull(allowlist, "allowlist");
        Objects.requireNonNull(principal, "principal");
        return service.updateProtocolPolicy(protocolName, p -> p.allowlist(allowlist).addPrincipal(principal));
    }

    /**
     * @throws PrincipalNotAllowedException if the principal is not listed
     */
    public Optional<TransactionId> disallow(String protocolName, String allowlist, Principal principal) {
        Objects.requireNonNull(allowlist, "allowlist");
        Objects.requireNonNull(principal, "principal");
        return service.updateProtocolPolicy(protocolName, p -> p.allowlist(allowlist).removePrincipal(principal));
    }

    /**
     * Empties an allowlist, which restores the protocol's empty-list meaning.
     * Returns empty without submitting if the list is already empty.
     */
    public Optional<TransactionId> clearAllowlist(String protocolName, String allowlist) {
        Objects.requireNonNull(allowlist, "allowlist");
        return service.updateProtocolPolicy(protocolName, p -> p.allowlist(allowlist).clear());
    }

    public Optional<TransactionId> setScalar(String protocolName, String field, long value) {
        Objects.requireNonNull(field, "field");
        return service.updateProtocolPolicy(protocolName, p -> p.setScalar(field, value));
    }

    /**
     * The live policy of a protocol.
     *
     * @throws PolicyNotFoundException if no policy was ever set
     */
    public ProtocolPolicy viewPolicy(String protocolName) {
        ProtocolRef ref = service.registry().resolveByName(protocolName);
        return integrations
                .policy(service.fetchState().integrationAcls(), ref.integrationProgram(), ref.protocolBitflag())
                .orElseThrow(() -> new PolicyNotFoundException(ref.name()));
    }

    /**
     * Whether the live policy lets {@code principal} through the named
     * allowlist, using the protocol's meaning for an empty list.
     */
    public boolean permits(String protocolName, String allowlist, Principal principal) {
        ProtocolRef ref = service.registry().resolveByName(protocolName);
        ProtocolPolicy policy = integrations.policyOrDefault(
                service.fetchState().integrationAcls(), ref.integrationProgram(), ref.protocolBitflag());
        return policy.permits(allowlist, principal);
    }
}

package com.questrail.vaultacl.acl;

import com.questrail.vaultacl.api.IntegrationNotEnabledException;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.api.UnknownProtocolException;
import com.questrail.vaultacl.policy.PolicySchema;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.registry.IntegrationDescriptor;
import com.questrail.vaultacl.registry.ProtocolDescriptor;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * IntegrationAccessControl
 * -----------------------------------------------------------------------------
 * Pure operations over a vault's {@code integrationAcls}: which integration
 * programs are enabled, which of their protocols are on, and the policy
 * attached to each protocol.
 *
 * <p>As with {@link DelegateAccessControl}, each mutation returns the
 * proposed replacement list and validates everything first.</p>
 */
public final class IntegrationAccessControl
{
    private final ProtocolPolicyRegistry registry;

    public IntegrationAccessControl(ProtocolPolicyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static Optional<IntegrationAcl> find(List<IntegrationAcl> acls, PublicKey integrationProgram) {
        Objects.requireNonNull(acls, "acls");
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        return acls.stream().filter(a -> a.integrationProgram().equals(integrationProgram)).findFirst();
    }

    /**
     * Adds an integration with the given protocols on. A mask of {@code 0}
     * enables every protocol the integration declares.
     *
     * @throws IntegrationNotEnabledException if the integration is already listed
     * @throws UnknownProtocolException       if the program or a protocol bit is unknown
     */
    public List<IntegrationAcl> enableIntegration(List<IntegrationAcl> acls,
                                                  PublicKey integrationProgram,
                                                  int protocolsBitmask) {
        IntegrationDescriptor integration = integration(integrationProgram);
        if (find(acls, integrationProgram).isPresent()) {
            throw new IntegrationNotEnabledException(
                    integration.name() + " (" + integrationProgram + ") is already enabled");
        }
        int mask = protocolsBitmask == 0 ? integration.allProtocolsMask() : protocolsBitmask;
        requireDeclared(integration, mask);

        List<IntegrationAcl> out = new ArrayList<>(acls);
        out.add(new IntegrationAcl(integrationProgram, mask, List.of()));
        return List.copyOf(out);
    }

    /**
     * Turns every protocol of the integration off. Policies stay attached.
     */
    public List<IntegrationAcl> disableIntegration(List<IntegrationAcl> acls, PublicKey integrationProgram) {
        IntegrationAcl acl = require(acls, integrationProgram);
        return replace(acls, acl.withProtocolsBitmask(0));
    }

    public List<IntegrationAcl> enableProtocols(List<IntegrationAcl> acls,
                                                PublicKey integrationProgram,
                                                int protocolsBitmask) {
        requireDeclared(integration(integrationProgram), protocolsBitmask);
        IntegrationAcl acl = require(acls, integrationProgram);
        return replace(acls, acl.withProtocolsBitmask(acl.protocolsBitmask() | protocolsBitmask));
    }

    /**
     * Clears protocol bits. Attached policies become dormant, not deleted.
     */
    public List<IntegrationAcl> disableProtocols(List<IntegrationAcl> acls,
                                                 PublicKey integrationProgram,
                                                 int protocolsBitmask) {
        requireDeclared(integration(integrationProgram), protocolsBitmask);
        IntegrationAcl acl = require(acls, integrationProgram);
        return replace(acls, acl.withProtocolsBitmask(acl.protocolsBitmask() & ~protocolsBitmask));
    }

    /**
     * Attaches (or replaces) the policy of one protocol.
     *
     * @throws IntegrationNotEnabledException if the integration is not listed or
     *         the protocol's bit is off
     * @throws IllegalArgumentException       if the policy's schema is not the
     *         protocol's schema
     */
    public List<IntegrationAcl> setProtocolPolicy(List<IntegrationAcl> acls,
                                                  PublicKey integrationProgram,
                                                  int protocolBitflag,
                                                  ProtocolPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        ProtocolDescriptor protocol = registry.resolve(integrationProgram, protocolBitflag);
        PolicySchema schema = schemaOf(protocol);
        if (policy.schema() != schema) {
            throw new IllegalArgumentException(protocol.name() + " takes a " + schema.name()
                    + ", not a " + policy.schema().name());
        }
        IntegrationAcl acl = require(acls, integrationProgram);
        if (!acl.isProtocolEnabled(protocolBitflag)) {
            throw new IntegrationNotEnabledException("Protocol " + protocol.name() + " is not enabled");
        }
        return replace(acls, acl.withPolicy(new ProtocolPolicyEntry(protocolBitflag, policy.encode())));
    }

    /**
     * Decodes the policy attached to one protocol, if any.
     *
     * @throws IllegalArgumentException if the protocol has no policy schema
     */
    public Optional<ProtocolPolicy> policy(List<IntegrationAcl> acls,
                                           PublicKey integrationProgram,
                                           int protocolBitflag) {
        PolicySchema schema = schemaOf(registry.resolve(integrationProgram, protocolBitflag));
        return find(acls, integrationProgram)
                .flatMap(a -> a.policy(protocolBitflag))
                .map(e -> schema.decode(e.data()));
    }

    /**
     * The attached policy, or a fresh default one if none was ever set.
     */
    public ProtocolPolicy policyOrDefault(List<IntegrationAcl> acls,
                                          PublicKey integrationProgram,
                                          int protocolBitflag) {
        return policy(acls, integrationProgram, protocolBitflag).orElseGet(() ->
                schemaOf(registry.resolve(integrationProgram, protocolBitflag)).newPolicy());
    }

    // ---------------------------------------------------------------------

    private IntegrationDescriptor integration(PublicKey integrationProgram) {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        return registry.integration(integrationProgram).orElseThrow(() ->
                new UnknownProtocolException("integration program " + integrationProgram));
    }

    private static void requireDeclared(IntegrationDescriptor integration, int protocolsBitmask) {
        int undeclared = protocolsBitmask & ~integration.allProtocolsMask();
        if (undeclared != 0) {
            throw new UnknownProtocolException(integration.program(), Integer.lowestOneBit(undeclared));
        }
        if (protocolsBitmask == 0) {
            throw new IllegalArgumentException("No protocols given for " + integration.name());
        }
    }

    private static PolicySchema schemaOf(ProtocolDescriptor protocol) {
        return protocol.policySchema().orElseThrow(() ->
                new IllegalArgumentException(protocol.name() + " does not take a policy"));
    }

    private static IntegrationAcl require(List<IntegrationAcl> acls, PublicKey integrationProgram) {
        return find(acls, integrationProgram).orElseThrow(() ->
                new IntegrationNotEnabledException("Integration " + integrationProgram + " is not enabled"));
    }

    private static List<IntegrationAcl> replace(List<IntegrationAcl> acls, IntegrationAcl updated) {
        List<IntegrationAcl> out = new ArrayList<>(acls.size());
        for (IntegrationAcl a : acls) {
            out.add(a.integrationProgram().equals(updated.integrationProgram()) ? updated : a);
        }
        return List.copyOf(out);
    }
}

package com.questrail.vaultacl.client;

import com.questrail.vaultacl.acl.DelegateAccessControl;
import com.questrail.vaultacl.acl.IntegrationAccessControl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.api.RemoteMutationRejectedException;
import com.questrail.vaultacl.api.TransactionId;
import com.questrail.vaultacl.api.UnknownProtocolException;
import com.questrail.vaultacl.api.VaultAclException;
import com.questrail.vaultacl.config.VaultAclConfig;
import com.questrail.vaultacl.observability.MutationSubmittedEvent;
import com.questrail.vaultacl.observability.NoChangeEvent;
import com.questrail.vaultacl.observability.NullObservabilitySink;
import com.questrail.vaultacl.observability.PreconditionRetryEvent;
import com.questrail.vaultacl.observability.TimelockTransitionEvent;
import com.questrail.vaultacl.observability.VaultAclErrorEvent;
import com.questrail.vaultacl.observability.VaultAclObservabilitySink;
import com.questrail.vaultacl.policy.ProtocolPolicy;
import com.questrail.vaultacl.registry.PermissionSelection;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;
import com.questrail.vaultacl.registry.ProtocolRef;
import com.questrail.vaultacl.registry.StandardProtocols;
import com.questrail.vaultacl.time.EpochClock;
import com.questrail.vaultacl.time.SystemEpochClock;
import com.questrail.vaultacl.timelock.FieldValue;
import com.questrail.vaultacl.timelock.Mutation;
import com.questrail.vaultacl.timelock.StateField;
import com.questrail.vaultacl.timelock.TimelockEngine;
import com.questrail.vaultacl.timelock.TimelockStatus;
import com.questrail.vaultacl.timelock.VaultState;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * VaultAccessService
 * =============================================================================
 * Entry point for every access-control change to a vault.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Resolve protocol and permission names before touching the ledger.</li>
 *   <li>Fetch a fresh {@link VaultState} immediately before building each
 *       mutation, and build it on the value the field will have once pending
 *       updates land.</li>
 *   <li>Run the mutation through {@link TimelockEngine} locally, so timelock
 *       preconditions fail here rather than at the ledger.</li>
 *   <li>Submit exactly one mutation per operation. A precondition mismatch is
 *       retried once from a new snapshot; any other rejection is surfaced.</li>
 *   <li>Submit nothing when a field update would leave the field as it is
 *       already going to be. Such operations succeed with an empty
 *       transaction id, and the timelock is left alone.</li>
 *   <li>Report submissions, timelock transitions, retries and failures to the
 *       {@link VaultAclObservabilitySink}.</li>
 * </ul>
 *
 * <p>The service keeps no vault state of its own.</p>
 */
public final class VaultAccessService
{
    @FunctionalInterface
    private interface MutationBuilder
    {
        Mutation build(VaultState state, long now);
    }

    @FunctionalInterface
    private interface FieldComputation
    {
        FieldValue compute(VaultState state, long now);
    }

    private final VaultAclConfig config;
    private final ProtocolPolicyRegistry registry;
    private final StateReader reader;
    private final StateMutator mutator;
    private final EpochClock clock;
    private final VaultAclObservabilitySink sink;

    private final TimelockEngine engine;
    private final DelegateAccessControl delegates;
    private final IntegrationAccessControl integrations;

    private VaultAccessService(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.registry = b.registry != null ? b.registry : StandardProtocols.registry(config.programs());
        this.reader = Objects.requireNonNull(b.reader, "reader");
        this.mutator = Objects.requireNonNull(b.mutator, "mutator");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.sink = Objects.requireNonNull(b.sink, "sink");

        this.engine = new TimelockEngine(registry);
        this.delegates = new DelegateAccessControl(registry);
        this.integrations = new IntegrationAccessControl(registry);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProtocolPolicyRegistry registry() {
        return registry;
    }

    public VaultState fetchState() {
        return reader.fetchLiveState();
    }

    public TimelockStatus status() {
        return engine.status(reader.fetchLiveState(), clock.nowSeconds());
    }

    public PolicyEditor policyEditor() {
        return new PolicyEditor(this, integrations);
    }

    // ---------------------------------------------------------------------
    // Delegates
    // ---------------------------------------------------------------------

    public Optional<TransactionId> grant(PublicKey delegate, String protocolName, Collection<String> permissionNames) {
        PermissionSelection selection = registry.selectPermissions(protocolName, permissionNames);
        return update(StateField.DELEGATE_ACLS, (state, now) -> new FieldValue.DelegateAcls(
                delegates.grant(state.proposedDelegateAcls(), delegate, selection)));
    }

    /**
     * Clears the named permissions. Revoking from a delegate or protocol
     * entry that does not exist changes nothing and submits nothing.
     */
    public Optional<TransactionId> revoke(PublicKey delegate, String protocolName, Collection<String> permissionNames) {
        PermissionSelection selection = registry.selectPermissions(protocolName, permissionNames);
        return update(StateField.DELEGATE_ACLS, (state, now) -> new FieldValue.DelegateAcls(
                delegates.revoke(state.proposedDelegateAcls(), delegate, selection)));
    }

    /**
     * Removes a delegate from live state at once, without waiting on the
     * timelock, and from any staged delegate list.
     */
    public TransactionId revokeAll(PublicKey delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return submit((state, now) -> new Mutation.EmergencyRevoke(state.revision(), delegate));
    }

    public Optional<TransactionId> setDelegateExpiry(PublicKey delegate, long expiresAt) {
        return update(StateField.DELEGATE_ACLS, (state, now) -> new FieldValue.DelegateAcls(
                delegates.setExpiry(state.proposedDelegateAcls(), delegate, expiresAt)));
    }

    public Optional<TransactionId> pruneExpiredDelegates() {
        return update(StateField.DELEGATE_ACLS, (state, now) -> new FieldValue.DelegateAcls(
                DelegateAccessControl.pruneExpired(state.proposedDelegateAcls(), now)));
    }

    // ---------------------------------------------------------------------
    // Integrations
    // ---------------------------------------------------------------------

    /**
     * Enables an integration with the named protocols, or all of its
     * protocols when none are named.
     */
    public Optional<TransactionId> enableIntegration(PublicKey integrationProgram, Collection<String> protocolNames) {
        int mask = protocolMask(integrationProgram, protocolNames);
        return update(StateField.INTEGRATION_ACLS, (state, now) -> new FieldValue.IntegrationAcls(
                integrations.enableIntegration(state.proposedIntegrationAcls(), integrationProgram, mask)));
    }

    public Optional<TransactionId> disableIntegration(PublicKey integrationProgram) {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        return update(StateField.INTEGRATION_ACLS, (state, now) -> new FieldValue.IntegrationAcls(
                integrations.disableIntegration(state.proposedIntegrationAcls(), integrationProgram)));
    }

    public Optional<TransactionId> enableProtocols(Collection<String> protocolNames) {
        Map<PublicKey, Integer> masks = protocolMasks(protocolNames);
        return update(StateField.INTEGRATION_ACLS, (state, now) -> {
            List<IntegrationAcl> acls = state.proposedIntegrationAcls();
            for (Map.Entry<PublicKey, Integer> e : masks.entrySet()) {
                acls = integrations.enableProtocols(acls, e.getKey(), e.getValue());
            }
            return new FieldValue.IntegrationAcls(acls);
        });
    }

    public Optional<TransactionId> disableProtocols(Collection<String> protocolNames) {
        Map<PublicKey, Integer> masks = protocolMasks(protocolNames);
        return update(StateField.INTEGRATION_ACLS, (state, now) -> {
            List<IntegrationAcl> acls = state.proposedIntegrationAcls();
            for (Map.Entry<PublicKey, Integer> e : masks.entrySet()) {
                acls = integrations.disableProtocols(acls, e.getKey(), e.getValue());
            }
            return new FieldValue.IntegrationAcls(acls);
        });
    }

    public Optional<TransactionId> setProtocolPolicy(String protocolName, ProtocolPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        ProtocolRef ref = registry.resolveByName(protocolName);
        return update(StateField.INTEGRATION_ACLS, (state, now) -> new FieldValue.IntegrationAcls(
                integrations.setProtocolPolicy(state.proposedIntegrationAcls(),
                        ref.integrationProgram(), ref.protocolBitflag(), policy)));
    }

    /**
     * Reads the protocol's policy (or its default if none was ever set),
     * applies {@code edit} to a copy and stores the result. On a retry the
     * edit runs again against the fresh policy.
     */
    public Optional<TransactionId> updateProtocolPolicy(String protocolName, Consumer<ProtocolPolicy> edit) {
        Objects.requireNonNull(edit, "edit");
        ProtocolRef ref = registry.resolveByName(protocolName);
        return update(StateField.INTEGRATION_ACLS, (state, now) -> {
            List<IntegrationAcl> acls = state.proposedIntegrationAcls();
            ProtocolPolicy policy = integrations
                    .policyOrDefault(acls, ref.integrationProgram(), ref.protocolBitflag())
                    .copy();
            edit.accept(policy);
            return new FieldValue.IntegrationAcls(
                    integrations.setProtocolPolicy(acls, ref.integrationProgram(), ref.protocolBitflag(), policy));
        });
    }

    // ---------------------------------------------------------------------
    // Other timelocked fields
    // ---------------------------------------------------------------------

    public Optional<TransactionId> setAssets(List<PublicKey> assets) {
        FieldValue value = new FieldValue.Assets(assets);
        return update(StateField.ASSETS, (state, now) -> value);
    }

    public Optional<TransactionId> setBorrowable(List<PublicKey> borrowable) {
        FieldValue value = new FieldValue.Borrowable(borrowable);
        return update(StateField.BORROWABLE, (state, now) -> value);
    }

    public Optional<TransactionId> setTimelockDuration(long seconds) {
        FieldValue value = new FieldValue.TimelockDuration(seconds);
        return update(StateField.TIMELOCK_DURATION, (state, now) -> value);
    }

    // ---------------------------------------------------------------------
    // Timelock
    // ---------------------------------------------------------------------

    public TransactionId applyTimelock() {
        return submit((state, now) -> new Mutation.ApplyTimelock(state.revision()));
    }

    public TransactionId cancelTimelock() {
        return submit((state, now) -> new Mutation.CancelTimelock(state.revision()));
    }

    // ---------------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------------

    private Optional<TransactionId> update(StateField field, FieldComputation computation) {
        return Optional.ofNullable(submit((state, now) -> {
            FieldValue value = computation.compute(state, now);
            if (value.field() != field) {
                throw new IllegalStateException("Computed " + value.field() + " for " + field);
            }
            if (value.equals(state.proposedValue(field))) {
                sink.onNoChange(new NoChangeEvent(clock.now(), field.wireName(), state.revision()));
                return null;
            }
            return new Mutation.UpdateField(state.revision(), value);
        }));
    }

    /**
     * Builds and submits one mutation, retrying once on a precondition
     * mismatch. Returns {@code null} without submitting when the builder
     * returns {@code null}.
     */
    private TransactionId submit(MutationBuilder builder) {
        int attempt = 1;
        while (true) {
            VaultState state = reader.fetchLiveState();
            long now = clock.nowSeconds();

            Mutation mutation;
            TimelockEngine.Result predicted;
            try {
                mutation = builder.build(state, now);
                if (mutation == null) {
                    return null;
                }
                predicted = engine.execute(state, mutation, now);
            } catch (VaultAclException | IllegalArgumentException e) {
                sink.onError(new VaultAclErrorEvent(clock.now(), e.getMessage(), e));
                throw e;
            }

            TransactionId tx;
            try {
                tx = mutator.submitMutation(mutation);
            } catch (RemoteMutationRejectedException e) {
                if (e.preconditionMismatch() && attempt <= config.preconditionRetries()) {
                    sink.onPreconditionRetry(new PreconditionRetryEvent(
                            clock.now(), mutation.fieldName(), attempt, e.getMessage()));
                    attempt++;
                    continue;
                }
                sink.onError(new VaultAclErrorEvent(clock.now(), e.getMessage(), e));
                throw e;
            }

            sink.onMutationSubmitted(new MutationSubmittedEvent(
                    clock.now(), mutation, predicted.outcome(), tx, attempt));
            sink.onTimelockTransition(new TimelockTransitionEvent(
                    clock.now(),
                    state.timelock().phase(now),
                    predicted.newState().timelock().phase(now),
                    predicted.newState().timelock().expiresAt(),
                    engine.status(predicted.newState(), now).pendingDescription()));
            return tx;
        }
    }

    // ---------------------------------------------------------------------
    // Name resolution
    // ---------------------------------------------------------------------

    private int protocolMask(PublicKey integrationProgram, Collection<String> protocolNames) {
        Objects.requireNonNull(integrationProgram, "integrationProgram");
        Objects.requireNonNull(protocolNames, "protocolNames");
        int mask = 0;
        for (String name : protocolNames) {
            ProtocolRef ref = registry.resolveByName(name);
            if (!ref.integrationProgram().equals(integrationProgram)) {
                throw new UnknownProtocolException(integrationProgram, ref.protocolBitflag());
            }
            mask |= ref.protocolBitflag();
        }
        return mask;
    }

    private Map<PublicKey, Integer> protocolMasks(Collection<String> protocolNames) {
        Objects.requireNonNull(protocolNames, "protocolNames");
        if (protocolNames.isEmpty()) {
            throw new IllegalArgumentException("At least one protocol name is required");
        }
        Map<PublicKey, Integer> masks = new LinkedHashMap<>();
        for (String name : protocolNames) {
            ProtocolRef ref = registry.resolveByName(name);
            masks.merge(ref.integrationProgram(), ref.protocolBitflag(), (a, b) -> a | b);
        }
        return masks;
    }

    /**
     * Builder for {@link VaultAccessService}.
     */
    public static final class Builder
    {
        private VaultAclConfig config;
        private ProtocolPolicyRegistry registry;
        private StateReader reader;
        private StateMutator mutator;
        private EpochClock clock = SystemEpochClock.INSTANCE;
        private VaultAclObservabilitySink sink = NullObservabilitySink.INSTANCE;

        private Builder() {}

        public Builder withConfig(VaultAclConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Overrides the registry built from the configured programs.
         */
        public Builder withRegistry(ProtocolPolicyRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withStateReader(StateReader reader) {
            this.reader = reader;
            return this;
        }

        public Builder withStateMutator(StateMutator mutator) {
            this.mutator = mutator;
            return this;
        }

        public Builder withClock(EpochClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withObservabilitySink(VaultAclObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public VaultAccessService build() {
            return new VaultAccessService(this);
        }
    }
}

package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.acl.DelegateAccessControl;
import com.questrail.vaultacl.api.DelegateNotFoundException;
import com.questrail.vaultacl.api.NothingStagedException;
import com.questrail.vaultacl.api.PublicKey;
import com.questrail.vaultacl.api.TimelockNotExpiredException;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;

import java.util.Objects;

/**
 * TimelockEngine
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for timelocked vault changes.
 *
 * <h2>Role in the architecture</h2>
 * Given a {@link VaultState}, a {@link Mutation} and the current time, the
 * engine computes the next {@code VaultState}. It never performs I/O and never
 * reads a clock. The same engine runs on both sides of a submission: the
 * client uses it to validate and predict a transition before sending it, and
 * a ledger stand-in uses it to perform the transition.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE --stage--> STAGED --(now >= expiresAt)--> READY
 *     ^               |                              |
 *     +----cancel-----+--------cancel / apply--------+
 * </pre>
 * <ul>
 *   <li>The delay starts on the first staged field. Staging more fields, or
 *       restaging one, never moves {@code expiresAt}.</li>
 *   <li>Staging the same field twice keeps only the later value.</li>
 *   <li>{@code apply} replaces every staged field at once and returns to
 *       IDLE. A staged {@code timelockDuration} is applied like any other
 *       field.</li>
 *   <li>With a duration of zero, updates bypass staging entirely.</li>
 * </ul>
 */
public final class TimelockEngine
{
    /**
     * What a transition did.
     */
    public enum Outcome {
        /** The field was replaced in live state. */
        APPLIED,
        /** The field was added to the pending updates. */
        STAGED,
        /** Pending updates were committed. */
        TIMELOCK_APPLIED,
        /** Pending updates were discarded. */
        TIMELOCK_CANCELLED,
        /** A delegate was removed from live state, bypassing the timelock. */
        EMERGENCY_APPLIED
    }

    /**
     * Result of applying a mutation to a vault state.
     *
     * @param newState the resulting state, with its revision advanced
     * @param outcome  which kind of transition took place
     */
    public record Result(VaultState newState, Outcome outcome) {}

    private final AclDiffs diffs;
    private final PendingUpdateDescriber describer;

    public TimelockEngine(ProtocolPolicyRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        this.diffs = new AclDiffs(registry);
        this.describer = new PendingUpdateDescriber(registry);
    }

    /**
     * Applies a single mutation.
     *
     * @throws NothingStagedException      on apply or cancel with nothing staged
     * @throws TimelockNotExpiredException on apply before {@code expiresAt}
     * @throws DelegateNotFoundException   on an emergency revoke of an unknown delegate
     */
    public Result execute(VaultState state, Mutation mutation, long now) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(mutation, "mutation");

        if (mutation instanceof Mutation.UpdateField m) {
            return propose(state, m.value(), now);
        }
        if (mutation instanceof Mutation.ApplyTimelock) {
            return apply(state, now);
        }
        if (mutation instanceof Mutation.CancelTimelock) {
            return cancel(state);
        }
        if (mutation instanceof Mutation.EmergencyRevoke m) {
            return revokeDelegate(state, m.delegate());
        }
        throw new IllegalArgumentException("Unsupported mutation: " + mutation);
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    /**
     * Replaces {@code field} immediately when the duration is zero, stages it
     * otherwise.
     */
    public Result propose(VaultState state, FieldValue value, long now) {
        if (state.timelockDuration() == 0) {
            VaultState next = state.withValue(value);
            return new Result(next.withRevision(state.revision() + 1), Outcome.APPLIED);
        }
        return stage(state, value, now);
    }

    public Result stage(VaultState state, FieldValue value, long now) {
        Objects.requireNonNull(value, "value");
        TimelockState t = state.timelock();
        long expiresAt = t.hasPending() ? t.expiresAt() : now + t.duration();
        VaultState next = state.withTimelock(t.withPending(value, expiresAt));
        return new Result(next.withRevision(state.revision() + 1), Outcome.STAGED);
    }

    public Result apply(VaultState state, long now) {
        TimelockState t = state.timelock();
        if (!t.hasPending()) {
            throw new NothingStagedException("apply");
        }
        if (now < t.expiresAt()) {
            throw new TimelockNotExpiredException(t.expiresAt(), now);
        }

        VaultState next = state;
        for (FieldValue v : t.pendingUpdates().values()) {
            next = next.withValue(v);
        }
        next = next.withTimelock(TimelockState.idle(next.timelockDuration()));
        return new Result(next.withRevision(state.revision() + 1), Outcome.TIMELOCK_APPLIED);
    }

    public Result cancel(VaultState state) {
        TimelockState t = state.timelock();
        if (!t.hasPending()) {
            throw new NothingStagedException("cancel");
        }
        VaultState next = state.withTimelock(TimelockState.idle(t.duration()));
        return new Result(next.withRevision(state.revision() + 1), Outcome.TIMELOCK_CANCELLED);
    }

    /**
     * Removes a delegate from live state at once and from the staged
     * delegate list, if one is staged.
     *
     * @throws DelegateNotFoundException if the delegate is in neither
     */
    public Result revokeDelegate(VaultState state, PublicKey delegate) {
        Objects.requireNonNull(delegate, "delegate");
        boolean live = DelegateAccessControl.find(state.delegateAcls(), delegate).isPresent();
        boolean staged = state.timelock().pending(StateField.DELEGATE_ACLS).isPresent()
                && DelegateAccessControl.find(state.proposedDelegateAcls(), delegate).isPresent();
        if (!live && !staged) {
            throw new DelegateNotFoundException(delegate);
        }

        VaultState next = state.withDelegateAcls(
                DelegateAccessControl.removeIfPresent(state.delegateAcls(), delegate));
        if (staged) {
            TimelockState t = state.timelock();
            FieldValue scrubbed = new FieldValue.DelegateAcls(
                    DelegateAccessControl.removeIfPresent(state.proposedDelegateAcls(), delegate));
            next = next.withTimelock(t.withPending(scrubbed, t.expiresAt()));
        }
        return new Result(next.withRevision(state.revision() + 1), Outcome.EMERGENCY_APPLIED);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public TimelockPhase phase(VaultState state, long now) {
        return state.timelock().phase(now);
    }

    /**
     * Difference between the live and staged value of one field; empty when
     * the field has nothing staged.
     */
    public Diff<?, ?> diff(VaultState state, StateField field) {
        Objects.requireNonNull(field, "field");
        if (state.timelock().pending(field).isEmpty()) {
            return Diff.empty();
        }
        return switch (field) {
            case INTEGRATION_ACLS -> diffs.integrationAcls(state.integrationAcls(), state.proposedIntegrationAcls());
            case DELEGATE_ACLS -> diffs.delegateAcls(state.delegateAcls(), state.proposedDelegateAcls());
            case ASSETS -> AclDiffs.keys(state.assets(), state.proposedAssets());
            case BORROWABLE -> AclDiffs.keys(state.borrowable(), state.proposedBorrowable());
            case TIMELOCK_DURATION -> AclDiffs.duration(state.timelockDuration(), state.proposedTimelockDuration());
        };
    }

    public TimelockStatus status(VaultState state, long now) {
        TimelockState t = state.timelock();
        return new TimelockStatus(
                t.duration(),
                t.phase(now),
                t.expiresAt(),
                t.secondsRemaining(now),
                describer.describe(state));
    }
}

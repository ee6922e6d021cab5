package com.questrail.vaultacl.client;

import com.questrail.vaultacl.api.RemoteMutationRejectedException;
import com.questrail.vaultacl.api.TransactionId;
import com.questrail.vaultacl.api.VaultAclException;
import com.questrail.vaultacl.registry.ProtocolPolicyRegistry;
import com.questrail.vaultacl.time.EpochClock;
import com.questrail.vaultacl.timelock.Mutation;
import com.questrail.vaultacl.timelock.TimelockEngine;
import com.questrail.vaultacl.timelock.VaultState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * In-memory ledger stand-in.
 *
 * <ul>
 *   <li>Rejects a mutation whose expected revision is stale, flagged as a
 *       precondition mismatch.</li>
 *   <li>{@link #interleaveOnce} simulates another client landing a change
 *       just before the next submission.</li>
 *   <li>{@link #rejectNext} refuses the next submission outright.</li>
 * </ul>
 */
public final class InMemoryVaultStateStore implements StateReader, StateMutator {

    private final TimelockEngine engine;
    private final EpochClock clock;
    private final List<Mutation> submitted = new ArrayList<>();

    private VaultState state;
    private UnaryOperator<VaultState> pendingInterleave;
    private int interleavesRemaining;
    private String pendingRejection;
    private int txCounter;
    private int received;

    public InMemoryVaultStateStore(ProtocolPolicyRegistry registry, EpochClock clock, VaultState initial) {
        this.engine = new TimelockEngine(registry);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.state = Objects.requireNonNull(initial, "initial");
    }

    @Override
    public synchronized VaultState fetchLiveState() {
        return state;
    }

    @Override
    public synchronized TransactionId submitMutation(Mutation mutation) {
        received++;
        if (interleavesRemaining > 0) {
            interleavesRemaining--;
            state = pendingInterleave.apply(state).withRevision(state.revision() + 1);
        }
        if (pendingRejection != null) {
            String reason = pendingRejection;
            pendingRejection = null;
            throw new RemoteMutationRejectedException(mutation.fieldName(), mutation, false, reason);
        }
        if (mutation.expectedRevision() != state.revision()) {
            throw new RemoteMutationRejectedException(mutation.fieldName(), mutation, true,
                "expected revision " + mutation.expectedRevision() + ", ledger is at " + state.revision());
        }
        try {
            state = engine.execute(state, mutation, clock.nowSeconds()).newState();
        } catch (VaultAclException e) {
            throw new RemoteMutationRejectedException(mutation.fieldName(), mutation, false, e.getMessage(), e);
        }
        submitted.add(mutation);
        return new TransactionId("tx-" + (++txCounter));
    }

    /**
     * Applies {@code change} to the ledger right before each of the next
     * {@code times} submissions, as a concurrent writer would.
     */
    public synchronized void interleave(int times, UnaryOperator<VaultState> change) {
        this.pendingInterleave = Objects.requireNonNull(change, "change");
        this.interleavesRemaining = times;
    }

    public synchronized void interleaveOnce(UnaryOperator<VaultState> change) {
        interleave(1, change);
    }

    public synchronized void rejectNext(String reason) {
        this.pendingRejection = Objects.requireNonNull(reason, "reason");
    }

    public synchronized void reset(VaultState newState) {
        this.state = Objects.requireNonNull(newState, "newState");
    }

    /**
     * Mutations the ledger accepted, in order.
     */
    public synchronized List<Mutation> submitted() {
        return new ArrayList<>(submitted);
    }

    /**
     * Number of submissions received, accepted or not.
     */
    public synchronized int received() {
        return received;
    }
}

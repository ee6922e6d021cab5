package com.questrail.vaultacl.client;

import com.questrail.vaultacl.api.RemoteMutationRejectedException;
import com.questrail.vaultacl.api.TransactionId;
import com.questrail.vaultacl.timelock.Mutation;

/**
 * Submits one mutation to the ledger.
 *
 * <p>A mutation either lands completely or not at all. Implementations do not
 * retry; {@link VaultAccessService} decides whether a rejection is worth a
 * second attempt.</p>
 */
@FunctionalInterface
public interface StateMutator
{
    /**
     * @throws RemoteMutationRejectedException if the ledger refuses the mutation;
     *         {@link RemoteMutationRejectedException#preconditionMismatch()} is
     *         set when the vault changed since {@link Mutation#expectedRevision()}
     */
    TransactionId submitMutation(Mutation mutation);
}

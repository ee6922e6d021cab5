package com.questrail.vaultacl.observability;

import com.questrail.vaultacl.api.TransactionId;
import com.questrail.vaultacl.timelock.Mutation;
import com.questrail.vaultacl.timelock.TimelockEngine;

import java.time.Instant;

/**
 * Record representing a mutation the ledger accepted.
 *
 * @param attempt 1 for the first submission, 2 after a precondition retry
 */
public record MutationSubmittedEvent(
    Instant timestamp,
    Mutation mutation,
    TimelockEngine.Outcome outcome,
    TransactionId transactionId,
    int attempt
) {
}

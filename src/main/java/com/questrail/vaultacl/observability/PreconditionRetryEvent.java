package com.questrail.vaultacl.observability;

import java.time.Instant;

/**
 * Record representing a mutation rebuilt and resubmitted after the ledger
 * reported that its preconditions no longer held.
 */
public record PreconditionRetryEvent(
    Instant timestamp,
    String field,
    int attempt,
    String reason
) {
}

package com.questrail.vaultacl.observability;

import java.time.Instant;

/**
 * Record representing a failure surfaced to the caller.
 */
public record VaultAclErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.vaultacl.observability;

import java.time.Instant;

/**
 * Record representing an update that was dropped because the field already
 * had, or was already staged to have, the requested value.
 */
public record NoChangeEvent(
    Instant timestamp,
    String field,
    long revision
) {
}

package com.questrail.vaultacl.observability;

import com.questrail.vaultacl.timelock.TimelockPhase;

import java.time.Instant;
import java.util.List;

/**
 * Record representing a change in the timelock after a mutation.
 */
public record TimelockTransitionEvent(
    Instant timestamp,
    TimelockPhase oldPhase,
    TimelockPhase newPhase,
    long expiresAt,
    List<String> pendingDescription
) {
    public TimelockTransitionEvent {
        pendingDescription = List.copyOf(pendingDescription);
    }

    /**
     * Checks if the phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldPhase != newPhase;
    }
}

package com.questrail.vaultacl.timelock;

/**
 * Phase of the timelock as seen at a given instant.
 *
 * <p>Only "something staged" and "nothing staged" are stored. {@link #READY}
 * is {@link #STAGED} with {@code now >= expiresAt}.</p>
 */
public enum TimelockPhase
{
    /** No pending updates. */
    IDLE,
    /** Pending updates exist and the delay has not elapsed. */
    STAGED,
    /** Pending updates exist and may be applied. */
    READY
}

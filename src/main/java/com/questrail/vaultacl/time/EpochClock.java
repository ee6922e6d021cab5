package com.questrail.vaultacl.time;

import java.time.Instant;

/**
 * EpochClock
 * =============================================================================
 * Source of "now" for timelock decisions, in unix seconds.
 *
 * <p>
 * Timelock expiry is compared against ledger timestamps, which are wall-clock
 * seconds; a monotonic clock would not be comparable. Pure code never calls
 * this directly: services read it once per operation and pass {@code now}
 * down.
 * </p>
 */
public interface EpochClock
{
    /**
     * Returns the current time in seconds since the unix epoch.
     */
    long nowSeconds();

    default Instant now() {
        return Instant.ofEpochSecond(nowSeconds());
    }
}

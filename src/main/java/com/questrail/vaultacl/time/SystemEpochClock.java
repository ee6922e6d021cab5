package com.questrail.vaultacl.time;

import java.time.Instant;

/**
 * SystemEpochClock
 * =============================================================================
 * Production {@link EpochClock} backed by {@link Instant#now()}.
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe.</p>
 */
public enum SystemEpochClock implements EpochClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public long nowSeconds() {
        return Instant.now().getEpochSecond();
    }
}

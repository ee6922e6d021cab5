package com.questrail.vaultacl.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic epoch clock for tests.
 *
 * - Starts at the given second
 * - Advances only when explicitly instructed
 * - Never goes backwards
 */
public final class ManualEpochClock implements EpochClock {

    private final AtomicLong nowSeconds;

    public ManualEpochClock(long startSeconds) {
        this.nowSeconds = new AtomicLong(startSeconds);
    }

    @Override
    public long nowSeconds() {
        return nowSeconds.get();
    }

    public void advanceSeconds(long deltaSeconds) {
        if (deltaSeconds < 0) {
            throw new IllegalArgumentException("Cannot advance epoch clock backwards");
        }
        nowSeconds.addAndGet(deltaSeconds);
    }
}

package com.questrail.vaultacl.api;

/**
 * {@code apply} was requested before the staged changes became eligible.
 */
public final class TimelockNotExpiredException extends VaultAclException
{
    private final long expiresAt;
    private final long now;

    public TimelockNotExpiredException(long expiresAt, long now) {
        super("Timelock has not expired: " + (expiresAt - now) + "s remaining (expires at " + expiresAt + ")");
        this.expiresAt = expiresAt;
        this.now = now;
    }

    public long expiresAt() {
        return expiresAt;
    }

    public long secondsRemaining() {
        return Math.max(0, expiresAt - now);
    }
}

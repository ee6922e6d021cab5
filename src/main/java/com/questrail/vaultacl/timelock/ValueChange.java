package com.questrail.vaultacl.timelock;

import java.util.Objects;

/**
 * A scalar that differs between live and staged state.
 */
public record ValueChange<T>(T current, T staged)
{
    public ValueChange {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(staged, "staged");
    }
}

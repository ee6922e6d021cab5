package com.questrail.vaultacl.api;

import java.util.Objects;

/**
 * The remote authority refused a mutation.
 *
 * <p>{@link #preconditionMismatch()} is {@code true} when the refusal was caused
 * by state having changed since it was read (a concurrent mutation landed
 * first). That case alone is eligible for a single re-fetch-and-retry.</p>
 */
public final class RemoteMutationRejectedException extends VaultAclException
{
    private final String field;
    private final Object attemptedValue;
    private final boolean preconditionMismatch;

    public RemoteMutationRejectedException(String field,
                                           Object attemptedValue,
                                           boolean preconditionMismatch,
                                           String reason) {
        this(field, attemptedValue, preconditionMismatch, reason, null);
    }

    public RemoteMutationRejectedException(String field,
                                           Object attemptedValue,
                                           boolean preconditionMismatch,
                                           String reason,
                                           Throwable cause) {
        super("Mutation of " + Objects.requireNonNull(field, "field") + " rejected"
                + (preconditionMismatch ? " (precondition mismatch)" : "")
                + ": " + reason, cause);
        this.field = field;
        this.attemptedValue = attemptedValue;
        this.preconditionMismatch = preconditionMismatch;
    }

    public String field() {
        return field;
    }

    public Object attemptedValue() {
        return attemptedValue;
    }

    public boolean preconditionMismatch() {
        return preconditionMismatch;
    }
}

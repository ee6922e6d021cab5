package com.questrail.vaultacl.api;

import java.util.Objects;

/**
 * Identifier the ledger returns for an accepted mutation.
 */
public record TransactionId(String value)
{
    public TransactionId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("TransactionId must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.api.PublicKey;

import java.util.Objects;

/**
 * Mutation
 * -----------------------------------------------------------------------------
 * One atomic state transition requested of the ledger.
 *
 * <p>Every mutation names the {@link VaultState#revision()} it was built
 * against. The ledger rejects it if the vault has moved on since, and the
 * caller rebuilds it from a fresh snapshot.</p>
 */
public sealed interface Mutation
{
    long expectedRevision();

    /** Name of the field (or facility) the mutation targets. */
    String fieldName();

    /**
     * Replace one field. Applied at once when the timelock duration is zero,
     * staged otherwise.
     */
    record UpdateField(long expectedRevision, FieldValue value) implements Mutation
    {
        public UpdateField {
            Objects.requireNonNull(value, "value");
        }

        public StateField field() {
            return value.field();
        }

        @Override
        public String fieldName() {
            return value.field().wireName();
        }
    }

    /** Commit every staged update. */
    record ApplyTimelock(long expectedRevision) implements Mutation
    {
        @Override
        public String fieldName() {
            return "timelock";
        }
    }

    /** Discard every staged update. */
    record CancelTimelock(long expectedRevision) implements Mutation
    {
        @Override
        public String fieldName() {
            return "timelock";
        }
    }

    /**
     * Remove a delegate from live state immediately, bypassing the timelock,
     * and from any staged delegate list.
     */
    record EmergencyRevoke(long expectedRevision, PublicKey delegate) implements Mutation
    {
        public EmergencyRevoke {
            Objects.requireNonNull(delegate, "delegate");
        }

        @Override
        public String fieldName() {
            return StateField.DELEGATE_ACLS.wireName();
        }
    }
}

package com.questrail.vaultacl.timelock;

import com.questrail.vaultacl.acl.DelegateAcl;
import com.questrail.vaultacl.acl.IntegrationAcl;
import com.questrail.vaultacl.api.PublicKey;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * FieldValue
 * -----------------------------------------------------------------------------
 * The full replacement value of one timelocked {@link StateField}, never a
 * delta. One record per field; construction validates and freezes the value.
 *
 * <p>The same records describe live values ({@link VaultState#value}), staged
 * values ({@link TimelockState#pending}) and requested updates
 * ({@link Mutation.UpdateField}), so any two can be compared with
 * {@code equals}.</p>
 */
public sealed interface FieldValue
{
    StateField field();

    /**
     * Returns {@code state} with this value written to the live field.
     */
    VaultState applyTo(VaultState state);

    record IntegrationAcls(List<IntegrationAcl> acls) implements FieldValue
    {
        public IntegrationAcls {
            acls = unique(acls, IntegrationAcl::integrationProgram, "integration");
        }

        @Override
        public StateField field() {
            return StateField.INTEGRATION_ACLS;
        }

        @Override
        public VaultState applyTo(VaultState state) {
            return state.withIntegrationAcls(acls);
        }
    }

    record DelegateAcls(List<DelegateAcl> acls) implements FieldValue
    {
        public DelegateAcls {
            acls = unique(acls, DelegateAcl::pubkey, "delegate");
        }

        @Override
        public StateField field() {
            return StateField.DELEGATE_ACLS;
        }

        @Override
        public VaultState applyTo(VaultState state) {
            return state.withDelegateAcls(acls);
        }
    }

    record Assets(List<PublicKey> keys) implements FieldValue
    {
        public Assets {
            keys = unique(keys, Function.identity(), "asset");
        }

        @Override
        public StateField field() {
            return StateField.ASSETS;
        }

        @Override
        public VaultState applyTo(VaultState state) {
            return state.withAssets(keys);
        }
    }

    record Borrowable(List<PublicKey> keys) implements FieldValue
    {
        public Borrowable {
            keys = unique(keys, Function.identity(), "borrowable asset");
        }

        @Override
        public StateField field() {
            return StateField.BORROWABLE;
        }

        @Override
        public VaultState applyTo(VaultState state) {
            return state.withBorrowable(keys);
        }
    }

    /**
     * @param seconds stored on the ledger as a u32
     */
    record TimelockDuration(long seconds) implements FieldValue
    {
        public static final long MAX_SECONDS = 0xFFFF_FFFFL;

        public TimelockDuration {
            if (seconds < 0 || seconds > MAX_SECONDS) {
                throw new IllegalArgumentException(
                        "timelockDuration out of range [0, " + MAX_SECONDS + "]: " + seconds);
            }
        }

        @Override
        public StateField field() {
            return StateField.TIMELOCK_DURATION;
        }

        @Override
        public VaultState applyTo(VaultState state) {
            return state.withTimelockDuration(seconds);
        }
    }

    private static <E> List<E> unique(List<E> values, Function<E, ?> identity, String kind) {
        Objects.requireNonNull(values, kind + " list");
        Set<Object> seen = new HashSet<>();
        for (E e : values) {
            Objects.requireNonNull(e, kind);
            if (!seen.add(identity.apply(e))) {
                throw new IllegalArgumentException("Duplicate " + kind + ": " + identity.apply(e));
            }
        }
        return List.copyOf(values);
    }
}

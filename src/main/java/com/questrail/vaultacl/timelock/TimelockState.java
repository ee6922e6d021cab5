package com.questrail.vaultacl.timelock;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Timelock portion of the vault state.
 *
 * @param duration       configured delay in seconds; {@code 0} applies changes immediately
 * @param expiresAt      when staged changes become applicable; {@code 0} when nothing is staged
 * @param pendingUpdates proposed full replacement value per field
 */
public record TimelockState(long duration, long expiresAt, Map<StateField, FieldValue> pendingUpdates)
{
    public TimelockState {
        Objects.requireNonNull(pendingUpdates, "pendingUpdates");
        EnumMap<StateField, FieldValue> copy = new EnumMap<>(StateField.class);
        pendingUpdates.forEach((f, v) -> {
            if (v.field() != f) {
                throw new IllegalArgumentException("Value for " + v.field() + " staged under " + f);
            }
            copy.put(f, v);
        });
        pendingUpdates = Collections.unmodifiableMap(copy);
        if (pendingUpdates.isEmpty() && expiresAt != 0) {
            throw new IllegalArgumentException("expiresAt must be 0 when nothing is staged");
        }
    }

    public static TimelockState idle(long duration) {
        return new TimelockState(duration, 0, Map.of());
    }

    /**
     * Builds a state from staged values, keyed by their own field.
     */
    public static TimelockState staged(long duration, long expiresAt, Collection<? extends FieldValue> values) {
        Map<StateField, FieldValue> pending = new EnumMap<>(StateField.class);
        for (FieldValue v : values) {
            pending.put(v.field(), v);
        }
        return new TimelockState(duration, expiresAt, pending);
    }

    public boolean hasPending() {
        return !pendingUpdates.isEmpty();
    }

    public Optional<FieldValue> pending(StateField field) {
        return Optional.ofNullable(pendingUpdates.get(field));
    }

    /**
     * Returns a copy with {@code value} staged, replacing any earlier value
     * for the same field.
     */
    public TimelockState withPending(FieldValue value, long newExpiresAt) {
        Map<StateField, FieldValue> pending = new EnumMap<>(StateField.class);
        pending.putAll(pendingUpdates);
        pending.put(value.field(), value);
        return new TimelockState(duration, newExpiresAt, pending);
    }

    public TimelockState withDuration(long newDuration) {
        return new TimelockState(newDuration, expiresAt, pendingUpdates);
    }

    public TimelockPhase phase(long now) {
        if (!hasPending()) {
            return TimelockPhase.IDLE;
        }
        return now >= expiresAt ? TimelockPhase.READY : TimelockPhase.STAGED;
    }

    /**
     * Seconds until staged changes may be applied, never negative.
     */
    public long secondsRemaining(long now) {
        return hasPending() ? Math.max(0, expiresAt - now) : 0;
    }
}

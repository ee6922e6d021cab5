package com.questrail.vaultacl.mapping;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * PermissionIndex
 * -----------------------------------------------------------------------------
 * {@code PermissionIndex} defines the mapping between permission names and the
 * 0-based bit positions they occupy in a protocol's permissions bitmask.
 *
 * <h2>Why this exists</h2>
 * Each protocol declares a closed list of named operations ("Deposit",
 * "Withdraw", "CreateModifyOrders", ...). On the ledger those operations are
 * bits in a {@code u64}. This interface isolates that layout so that:
 * <ul>
 *   <li>Callers refer to permissions by name, never by bit position</li>
 *   <li>The permission set of a protocol is closed: names outside the index
 *       are rejected rather than coerced</li>
 *   <li>Read and write paths share one bit-to-name mapping</li>
 * </ul>
 *
 * <h2>Index Semantics</h2>
 * The index returned by {@link #indexOf(String)} is always:
 * <ul>
 *   <li>0-based</li>
 *   <li>the bit ordinal within the permissions bitmask</li>
 *   <li>stable for a given {@code PermissionIndex} instance</li>
 * </ul>
 */
public interface PermissionIndex
{
    /**
     * Returns the number of permissions in the universe (max index + 1).
     */
    int size();

    /**
     * Returns the bit ordinal of the permission with exactly this name.
     *
     * @throws IllegalArgumentException if the name is unknown to this index
     */
    int indexOf(String name);

    /**
     * Reverse-lookup: returns the permission name at the given bit ordinal.
     *
     * @throws IndexOutOfBoundsException if index is out of range
     */
    String nameAt(int index);

    /**
     * Returns every permission name in bit order.
     */
    List<String> allNames();

    /**
     * Returns true if this index contains a permission with exactly this name.
     */
    default boolean contains(String name) {
        Objects.requireNonNull(name, "name");
        try {
            indexOf(name);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Returns the name at {@code index}, or empty if the index is outside the
     * universe.
     */
    default Optional<String> tryNameAt(int index) {
        if (index < 0 || index >= size()) {
            return Optional.empty();
        }
        return Optional.of(nameAt(index));
    }

    /**
     * Resolves user input to a canonical permission name, ignoring case.
     * <p>
     * This is intended for input parsing. Output always uses the canonical
     * spelling returned here.
     */
    default Optional<String> tryResolve(String input) {
        Objects.requireNonNull(input, "input");
        String wanted = input.trim().toLowerCase(Locale.ROOT);
        for (String name : allNames()) {
            if (name.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}

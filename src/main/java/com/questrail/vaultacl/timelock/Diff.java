package com.questrail.vaultacl.timelock;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural difference between a live value and its staged replacement.
 *
 * <p>Elements are matched by their natural identity, never by position, so
 * reordering alone yields an empty diff. {@code modified} holds one change
 * record per element present on both sides whose contents differ.</p>
 *
 * @param <E> element type
 * @param <M> change record type for elements present on both sides
 */
public record Diff<E, M>(List<E> added, List<E> removed, List<M> modified)
{
    public Diff {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
    }

    public static <E, M> Diff<E, M> empty() {
        return new Diff<>(List.of(), List.of(), List.of());
    }

    /**
     * Set difference of two collections with no notion of modification.
     * Added elements keep the staged order, removed ones the current order.
     */
    public static <E> Diff<E, Void> ofSets(Collection<? extends E> current, Collection<? extends E> staged) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(staged, "staged");
        Set<E> cur = new LinkedHashSet<>(current);
        Set<E> stg = new LinkedHashSet<>(staged);

        List<E> added = new ArrayList<>();
        for (E e : stg) {
            if (!cur.contains(e)) {
                added.add(e);
            }
        }
        List<E> removed = new ArrayList<>();
        for (E e : cur) {
            if (!stg.contains(e)) {
                removed.add(e);
            }
        }
        return new Diff<>(added, removed, List.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}

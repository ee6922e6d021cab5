package com.questrail.vaultacl.mapping;

import java.util.*;

/**
 * ArrayPermissionIndex
 * -----------------------------------------------------------------------------
 * A straightforward {@link PermissionIndex} backed by:
 *
 * <ul>
 *   <li>an array for ordinal -> name</li>
 *   <li>a map for name -> ordinal</li>
 * </ul>
 *
 * The position in the constructor arguments is the bit ordinal.
 */
public final class ArrayPermissionIndex implements PermissionIndex
{
    private static final int MAX_PERMISSIONS = 64;

    private final String[] nameByIndex;
    private final Map<String, Integer> indexByName;
    private final List<String> all;

    public ArrayPermissionIndex(String... namesInBitOrder) {
        Objects.requireNonNull(namesInBitOrder, "namesInBitOrder");
        if (namesInBitOrder.length > MAX_PERMISSIONS) {
            throw new IllegalArgumentException(
                    "At most " + MAX_PERMISSIONS + " permissions fit a u64 bitmask, got " + namesInBitOrder.length);
        }

        this.nameByIndex = Arrays.copyOf(namesInBitOrder, namesInBitOrder.length);

        Map<String, Integer> tmp = new HashMap<>(namesInBitOrder.length * 2);
        Set<String> folded = new HashSet<>();
        for (int i = 0; i < nameByIndex.length; i++) {
            String name = Objects.requireNonNull(nameByIndex[i], "name at index " + i);
            Integer prev = tmp.put(name, i);
            if (prev != null || !folded.add(name.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate permission name in index: " + name);
            }
        }
        this.indexByName = Collections.unmodifiableMap(tmp);
        this.all = List.of(nameByIndex);
    }

    /**
     * An index with no permissions, for protocols that are enable/disable only.
     */
    public static ArrayPermissionIndex empty() {
        return new ArrayPermissionIndex();
    }

    @Override
    public int size() {
        return nameByIndex.length;
    }

    @Override
    public int indexOf(String name) {
        Objects.requireNonNull(name, "name");
        Integer idx = indexByName.get(name);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown permission: " + name);
        }
        return idx;
    }

    @Override
    public String nameAt(int index) {
        if (index < 0 || index >= nameByIndex.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + nameByIndex.length);
        }
        return nameByIndex[index];
    }

    @Override
    public List<String> allNames() {
        return all;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.schema;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable name to position lookup over a list of column names, using open addressing
 * with linear probing. Names are expected to be unique; for duplicates the first
 * position wins.
 */
final class ColumnNameIndex {

    static final int NOT_FOUND = -1;

    private final String[] slots;
    private final int[] positions;
    private final int mask;

    ColumnNameIndex(List<String> names) {
        int capacity = capacityFor(names.size());
        this.slots = new String[capacity];
        this.positions = new int[capacity];
        this.mask = capacity - 1;
        Arrays.fill(positions, NOT_FOUND);

        for (int i = 0; i < names.size(); i++) {
            insert(names.get(i), i);
        }
    }

    private void insert(String name, int position) {
        int slot = spread(name.hashCode()) & mask;
        while (slots[slot] != null) {
            if (slots[slot].equals(name)) {
                return;
            }
            slot = (slot + 1) & mask;
        }
        slots[slot] = name;
        positions[slot] = position;
    }

    /**
     * Position of the given name, or {@link #NOT_FOUND}.
     */
    int indexOf(String name) {
        int slot = spread(name.hashCode()) & mask;
        while (slots[slot] != null) {
            if (slots[slot].equals(name)) {
                return positions[slot];
            }
            slot = (slot + 1) & mask;
        }
        return NOT_FOUND;
    }

    boolean contains(String name) {
        return indexOf(name) != NOT_FOUND;
    }

    private static int spread(int hash) {
        return hash ^ (hash >>> 16);
    }

    // at most half full, power of two
    private static int capacityFor(int size) {
        int capacity = 16;
        while (capacity < size * 2) {
            capacity <<= 1;
        }
        return capacity;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Specifies which columns of a CSV input end up in the resulting table.
 *
 * <p>Fields of unselected columns are still tokenized, but never converted,
 * so selecting a subset saves conversion work and memory.</p>
 *
 * <p>Usage examples:</p>
 * <pre>{@code
 * // All columns (default)
 * ColumnSelection.all()
 *
 * // By resolved column name
 * ColumnSelection.names("id", "amount")
 *
 * // By position within the row
 * ColumnSelection.indices(0, 1, 3)
 * }</pre>
 *
 * <p>Selected columns keep the order in which they appear in the input.</p>
 */
public final class ColumnSelection {

    private static final ColumnSelection ALL = new ColumnSelection(null, null);

    private final Set<String> names;
    private final Set<Integer> indices;

    private ColumnSelection(Set<String> names, Set<Integer> indices) {
        this.names = names;
        this.indices = indices;
    }

    /**
     * Returns a selection that includes all columns.
     */
    public static ColumnSelection all() {
        return ALL;
    }

    /**
     * Returns a selection of the columns with the given names.
     *
     * @throws IllegalArgumentException if no names are given, or a name is null or empty
     */
    public static ColumnSelection names(String... names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("At least one column name must be specified");
        }
        Set<String> nameSet = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name cannot be null or empty");
            }
            nameSet.add(name);
        }
        return new ColumnSelection(Collections.unmodifiableSet(nameSet), null);
    }

    /**
     * Returns a selection of the columns at the given positions.
     *
     * @throws IllegalArgumentException if no positions are given, or one is negative
     */
    public static ColumnSelection indices(int... indices) {
        if (indices == null || indices.length == 0) {
            throw new IllegalArgumentException("At least one column index must be specified");
        }
        Set<Integer> indexSet = new LinkedHashSet<>();
        for (int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("Column index cannot be negative: " + index);
            }
            indexSet.add(index);
        }
        return new ColumnSelection(null, Collections.unmodifiableSet(indexSet));
    }

    /**
     * Returns true if this selection includes all columns.
     */
    public boolean selectsAll() {
        return names == null && indices == null;
    }

    public boolean isByName() {
        return names != null;
    }

    /**
     * Returns the selected names, or null if this selection is not by name.
     */
    public Set<String> getNames() {
        return names;
    }

    /**
     * Returns the selected positions, or null if this selection is not by position.
     */
    public Set<Integer> getIndices() {
        return indices;
    }

    @Override
    public String toString() {
        if (selectsAll()) {
            return "all";
        }
        return names != null ? "names" + names : "indices" + indices;
    }
}

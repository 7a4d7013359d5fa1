/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives column names from header rows, explicit names or column positions.
 */
public final class HeaderNames {

    static final String UNNAMED_PREFIX = "Unnamed: ";

    private HeaderNames() {
    }

    /**
     * Names taken from a header row. Empty fields become {@code "Unnamed: <position>"};
     * duplicates are mangled.
     */
    public static List<String> fromHeader(List<String> headerFields) {
        List<String> names = new ArrayList<>(headerFields.size());
        for (int i = 0; i < headerFields.size(); i++) {
            String field = headerFields.get(i);
            names.add(field == null || field.isEmpty() ? UNNAMED_PREFIX + i : field);
        }
        return mangleDuplicates(names);
    }

    /**
     * Names for a table without header: {@code prefix + position}, or just the position
     * when no prefix is given.
     */
    public static List<String> generated(int columnCount, String prefix) {
        List<String> names = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            names.add(prefix != null ? prefix + i : String.valueOf(i));
        }
        return names;
    }

    /**
     * Makes names unique by appending {@code .1}, {@code .2}, ... to repeated names, left
     * to right. The first occurrence keeps its name; suffixes already in use are skipped.
     */
    public static List<String> mangleDuplicates(List<String> names) {
        Set<String> original = new HashSet<>(names);
        if (original.size() == names.size()) {
            return List.copyOf(names);
        }

        Set<String> assigned = new HashSet<>();
        Map<String, Integer> counters = new HashMap<>();
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            if (assigned.add(name)) {
                result.add(name);
                continue;
            }
            int suffix = counters.getOrDefault(name, 0);
            String candidate;
            do {
                suffix++;
                candidate = name + "." + suffix;
            } while (assigned.contains(candidate) || original.contains(candidate));
            counters.put(name, suffix);
            assigned.add(candidate);
            result.add(candidate);
        }
        return result;
    }
}

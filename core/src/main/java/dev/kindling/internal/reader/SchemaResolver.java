/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.kindling.reader.ColumnSelection;
import dev.kindling.reader.CsvOptions;
import dev.kindling.reader.IndexColumn;
import dev.kindling.schema.DType;
import dev.kindling.schema.HeaderNames;

/**
 * Determines column count, names, selection and explicit types of a read.
 */
final class SchemaResolver {

    /** Returned by {@link #explicitColumnCount} if the count must be detected from data rows. */
    static final int DETECT = -1;

    private SchemaResolver() {
    }

    /**
     * The number of columns as given by the options or the header: the number of names, else
     * the header width, else the length of a complete positional type list.
     *
     * @param header the header fields, or null
     * @return the column count, or {@link #DETECT}
     */
    static int explicitColumnCount(CsvOptions options, List<String> header) {
        if (options.names() != null) {
            return options.names().size();
        }
        if (header != null) {
            return header.size();
        }
        List<DType> types = options.dtypeList();
        if (types != null && !types.isEmpty() && !types.contains(null)) {
            return types.size();
        }
        return DETECT;
    }

    /**
     * Explicit names, names from the header row, or generated names, made unique.
     */
    static List<String> columnNames(CsvOptions options, List<String> header, int columnCount) {
        if (options.names() != null) {
            return HeaderNames.mangleDuplicates(options.names());
        }
        if (header != null) {
            return HeaderNames.fromHeader(header);
        }
        return HeaderNames.generated(columnCount, options.prefix());
    }

    /**
     * Applies types, column selection and index column to the resolved names.
     *
     * @throws IllegalArgumentException if the options refer to columns that do not exist
     */
    static ReadLayout resolve(CsvOptions options, List<String> columnNames) {
        int count = columnNames.size();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < count; i++) {
            positions.put(columnNames.get(i), i);
        }

        DType[] allTypes = new DType[count];
        if (options.dtypeList() != null) {
            List<DType> types = options.dtypeList();
            if (types.size() > count) {
                throw new IllegalArgumentException("Got " + types.size() + " column types for " + count + " columns");
            }
            for (int i = 0; i < types.size(); i++) {
                allTypes[i] = types.get(i);
            }
        }
        if (options.dtypeMap() != null) {
            for (Map.Entry<String, DType> entry : options.dtypeMap().entrySet()) {
                Integer position = positions.get(entry.getKey());
                if (position == null) {
                    throw new IllegalArgumentException("Type given for unknown column: " + entry.getKey());
                }
                allTypes[position] = entry.getValue();
            }
        }

        int[] selected = select(options.useColumns(), positions, count);
        DType[] types = new DType[selected.length];
        for (int i = 0; i < selected.length; i++) {
            types[i] = allTypes[selected[i]];
        }

        int indexColumn = indexColumn(options.indexColumn(), columnNames, selected);
        return new ReadLayout(columnNames, selected, types, indexColumn);
    }

    private static int[] select(ColumnSelection selection, Map<String, Integer> positions, int count) {
        if (selection.selectsAll()) {
            int[] all = new int[count];
            for (int i = 0; i < count; i++) {
                all[i] = i;
            }
            return all;
        }
        int[] selected;
        if (selection.isByName()) {
            Set<String> names = selection.getNames();
            selected = new int[names.size()];
            int i = 0;
            for (String name : names) {
                Integer position = positions.get(name);
                if (position == null) {
                    throw new IllegalArgumentException("Column not found: " + name);
                }
                selected[i++] = position;
            }
        }
        else {
            Set<Integer> indices = selection.getIndices();
            selected = new int[indices.size()];
            int i = 0;
            for (int index : indices) {
                if (index >= count) {
                    throw new IllegalArgumentException("Column index " + index + " out of range for " + count + " columns");
                }
                selected[i++] = index;
            }
        }
        Arrays.sort(selected);
        return selected;
    }

    private static int indexColumn(IndexColumn indexColumn, List<String> columnNames, int[] selected) {
        if (indexColumn instanceof IndexColumn.Named named) {
            for (int i = 0; i < selected.length; i++) {
                if (columnNames.get(selected[i]).equals(named.name())) {
                    return i;
                }
            }
            throw new IllegalArgumentException("Index column not found: " + named.name());
        }
        if (indexColumn instanceof IndexColumn.At at) {
            if (at.position() >= selected.length) {
                throw new IllegalArgumentException("Index column " + at.position() + " out of range for "
                        + selected.length + " columns");
            }
            return at.position();
        }
        return -1;
    }
}

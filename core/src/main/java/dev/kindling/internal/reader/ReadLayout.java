/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.util.List;

import dev.kindling.schema.DType;

/**
 * Resolved column layout of a read, before types are inferred.
 *
 * @param columnNames names of all columns of the input, selected or not
 * @param selected source positions of the selected columns, ascending
 * @param types explicit type of each selected column; null where it is inferred
 * @param indexColumn position of the index column among the selected ones, or -1
 */
record ReadLayout(List<String> columnNames, int[] selected, DType[] types, int indexColumn) {

    int columnCount() {
        return columnNames.size();
    }

    String selectedName(int i) {
        return columnNames.get(selected[i]);
    }
}

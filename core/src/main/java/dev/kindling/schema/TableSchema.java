/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolved schema of a parsed table: the ordered columns and, optionally, which of them
 * serves as the row index.
 */
public final class TableSchema {

    private final List<ColumnSchema> columns;
    private final ColumnNameIndex columnNameToIndex;
    private final int indexColumn;

    /**
     * @param columns the columns, in output order; names must be unique
     * @param indexColumn position of the index column within {@code columns}, or -1
     */
    public TableSchema(List<ColumnSchema> columns, int indexColumn) {
        if (indexColumn < -1 || indexColumn >= columns.size()) {
            throw new IllegalArgumentException("Index column " + indexColumn + " out of range for "
                    + columns.size() + " columns");
        }
        this.columns = List.copyOf(columns);
        this.indexColumn = indexColumn;

        List<String> names = new ArrayList<>(columns.size());
        for (ColumnSchema column : columns) {
            names.add(column.name());
        }
        this.columnNameToIndex = new ColumnNameIndex(names);
        for (int i = 0; i < names.size(); i++) {
            if (columnNameToIndex.indexOf(names.get(i)) != i) {
                throw new IllegalArgumentException("Duplicate column name: " + names.get(i));
            }
        }
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    public ColumnSchema getColumn(String name) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return columns.get(index);
    }

    /**
     * Position of the named column, or -1 if there is no such column.
     */
    public int indexOf(String name) {
        return columnNameToIndex.indexOf(name);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnSchema column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * Position of the index column, or -1 if the table has none.
     */
    public int getIndexColumn() {
        return indexColumn;
    }

    public boolean hasIndexColumn() {
        return indexColumn >= 0;
    }

    /**
     * Returns true if both schemas have the same column names and types, in the same order.
     */
    public boolean isCompatibleWith(TableSchema other) {
        if (other.columns.size() != columns.size()) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema mine = columns.get(i);
            ColumnSchema theirs = other.columns.get(i);
            if (!mine.name().equals(theirs.name()) || mine.type() != theirs.type()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("table {\n");
        for (int i = 0; i < columns.size(); i++) {
            sb.append("  ").append(columns.get(i));
            if (i == indexColumn) {
                sb.append(" [index]");
            }
            sb.append(";\n");
        }
        return sb.append("}").toString();
    }
}

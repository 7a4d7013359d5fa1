/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.table;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import dev.kindling.schema.ColumnSchema;
import dev.kindling.schema.TableSchema;

/**
 * The result of parsing one CSV input (or one byte range of it): a schema plus one
 * column per schema entry, all of the same length.
 *
 * <pre>{@code
 * Table table = CsvReader.read(path, CsvOptions.defaults());
 * Column.Int64Column ids = (Column.Int64Column) table.column("id");
 * for (int row = 0; row < table.rowCount(); row++) {
 *     if (!ids.isNull(row)) {
 *         long id = ids.get(row);
 *     }
 * }
 * }</pre>
 */
public final class Table {

    private final TableSchema schema;
    private final List<Column> columns;
    private final int rowCount;

    public Table(TableSchema schema, List<Column> columns, int rowCount) {
        if (schema.getColumnCount() != columns.size()) {
            throw new IllegalArgumentException("Schema has " + schema.getColumnCount() + " columns, but "
                    + columns.size() + " were given");
        }
        for (Column column : columns) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                        + " values, expected " + rowCount);
            }
        }
        this.schema = schema;
        this.columns = List.copyOf(columns);
        this.rowCount = rowCount;
    }

    public TableSchema schema() {
        return schema;
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<Column> columns() {
        return columns;
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public Column column(String name) {
        int index = schema.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return columns.get(index);
    }

    public List<String> columnNames() {
        return schema.getColumnNames();
    }

    public Object getValue(String column, int row) {
        return column(column).getValue(row);
    }

    /**
     * The column marked as row index, or null if the table has none.
     */
    public Column indexColumn() {
        return schema.hasIndexColumn() ? columns.get(schema.getIndexColumn()) : null;
    }

    /**
     * All columns except the index column.
     */
    public List<Column> dataColumns() {
        if (!schema.hasIndexColumn()) {
            return columns;
        }
        List<Column> data = new ArrayList<>(columns.size() - 1);
        for (int i = 0; i < columns.size(); i++) {
            if (i != schema.getIndexColumn()) {
                data.add(columns.get(i));
            }
        }
        return data;
    }

    /**
     * Appends the rows of the given tables in order, e.g. the results of reading
     * consecutive byte ranges of one input.
     * <p>
     * All non-empty tables must have compatible schemas (same names and types). Empty
     * tables contribute no rows and are not checked.
     * </p>
     *
     * @throws IllegalArgumentException if the list is empty or schemas differ
     */
    public static Table concat(List<Table> tables) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("At least one table must be given");
        }

        List<Table> nonEmpty = new ArrayList<>();
        for (Table table : tables) {
            if (table.rowCount > 0) {
                nonEmpty.add(table);
            }
        }
        if (nonEmpty.isEmpty()) {
            return tables.get(0);
        }
        if (nonEmpty.size() == 1) {
            return nonEmpty.get(0);
        }

        Table first = nonEmpty.get(0);
        int totalRows = 0;
        for (Table table : nonEmpty) {
            if (!first.schema.isCompatibleWith(table.schema)) {
                throw new IllegalArgumentException("Cannot concatenate tables with different schemas: "
                        + first.schema + " and " + table.schema);
            }
            totalRows += table.rowCount;
        }

        List<Column> merged = new ArrayList<>(first.columnCount());
        for (int c = 0; c < first.columnCount(); c++) {
            List<Column> parts = new ArrayList<>(nonEmpty.size());
            for (Table table : nonEmpty) {
                parts.add(table.columns.get(c));
            }
            merged.add(concatColumn(first.schema.getColumn(c), parts, totalRows));
        }
        return new Table(first.schema, merged, totalRows);
    }

    private static Column concatColumn(ColumnSchema schema, List<Column> parts, int totalRows) {
        BitSet nulls = new BitSet(totalRows);
        int offset = 0;
        for (Column part : parts) {
            BitSet partNulls = part.nulls();
            for (int i = partNulls.nextSetBit(0); i >= 0; i = partNulls.nextSetBit(i + 1)) {
                nulls.set(offset + i);
            }
            offset += part.size();
        }

        return switch (schema.type()) {
            case INT32 -> {
                int[] values = new int[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.Int32Column typed = (Column.Int32Column) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.Int32Column(schema, values, nulls, totalRows);
            }
            case INT64 -> {
                long[] values = new long[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.Int64Column typed = (Column.Int64Column) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.Int64Column(schema, values, nulls, totalRows);
            }
            case FLOAT32 -> {
                float[] values = new float[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.Float32Column typed = (Column.Float32Column) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.Float32Column(schema, values, nulls, totalRows);
            }
            case FLOAT64 -> {
                double[] values = new double[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.Float64Column typed = (Column.Float64Column) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.Float64Column(schema, values, nulls, totalRows);
            }
            case BOOL -> {
                boolean[] values = new boolean[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.BoolColumn typed = (Column.BoolColumn) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.BoolColumn(schema, values, nulls, totalRows);
            }
            case DATE -> {
                long[] values = new long[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.DateColumn typed = (Column.DateColumn) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.DateColumn(schema, values, nulls, totalRows);
            }
            case CATEGORY -> {
                int[] values = new int[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.CategoryColumn typed = (Column.CategoryColumn) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.CategoryColumn(schema, values, nulls, totalRows);
            }
            case STR -> {
                String[] values = new String[totalRows];
                int pos = 0;
                for (Column part : parts) {
                    Column.StringColumn typed = (Column.StringColumn) part;
                    System.arraycopy(typed.values(), 0, values, pos, typed.size());
                    pos += typed.size();
                }
                yield new Column.StringColumn(schema, values, nulls, totalRows);
            }
        };
    }

    @Override
    public String toString() {
        return "Table[" + rowCount + " rows x " + columns.size() + " columns " + schema.getColumnNames() + "]";
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.schema;

/**
 * A column of a parsed table.
 *
 * @param name the resolved, unique column name
 * @param type the column's data type
 * @param sourceIndex position of the column's field within a CSV row
 */
public record ColumnSchema(String name, DType type, int sourceIndex) {

    @Override
    public String toString() {
        return type.name().toLowerCase() + " " + name + " (#" + sourceIndex + ")";
    }
}

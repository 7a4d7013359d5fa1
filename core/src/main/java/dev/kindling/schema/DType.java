/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.schema;

import java.util.Locale;

/**
 * Data types a CSV column can be parsed into.
 * <p>
 * {@link #CATEGORY} and {@link #STR} both originate from text; categories are stored
 * as stable 32-bit hash codes instead of strings.
 * </p>
 */
public enum DType {
    INT32,
    INT64,
    FLOAT32,
    FLOAT64,
    BOOL,
    /** Timestamp with millisecond resolution, UTC-naive. */
    DATE,
    CATEGORY,
    STR;

    public boolean isIntegral() {
        return this == INT32 || this == INT64;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isNumeric() {
        return isIntegral() || isFloatingPoint();
    }

    /**
     * Resolves a type name as commonly used in dataframe libraries, e.g. {@code "int64"},
     * {@code "double"} or {@code "category"}.
     *
     * @throws IllegalArgumentException if the name is not known
     */
    public static DType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Type name cannot be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "short", "int16", "int", "int32" -> INT32;
            case "long", "int64" -> INT64;
            case "float", "float32" -> FLOAT32;
            case "double", "float64" -> FLOAT64;
            case "bool", "boolean" -> BOOL;
            case "date", "datetime", "datetime64", "timestamp" -> DATE;
            case "category" -> CATEGORY;
            case "str", "string", "object" -> STR;
            default -> throw new IllegalArgumentException("Unknown data type: " + name);
        };
    }
}

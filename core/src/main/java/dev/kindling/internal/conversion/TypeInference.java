/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import dev.kindling.schema.DType;

/**
 * Infers the type of a column from its values, observed one at a time.
 * <p>
 * A type remains a candidate while every non-missing value converts to it. The result
 * is the first remaining candidate of {@code INT64, FLOAT64, BOOL, DATE}, else {@code STR}.
 * Boolean tokens never count as numbers here, and numbers never as booleans. A column
 * without any non-missing value is {@code INT64}. Categories are never inferred.
 * </p>
 * <p>
 * Inferences over disjoint parts of a column can be {@linkplain #merge merged}; the result
 * is the type inferred over the whole column.
 * </p>
 */
public final class TypeInference {

    private final ValueParser parser;
    private boolean canInt = true;
    private boolean canFloat = true;
    private boolean canBool = true;
    private boolean canDate = true;

    public TypeInference(ValueParser parser) {
        this.parser = parser;
    }

    /**
     * Observes one present field value, in raw (untrimmed) form.
     */
    public void observe(byte[] data, int start, int end) {
        if (!isUndecided()) {
            return;
        }
        int s = ValueParser.trimStart(data, start, end);
        int e = ValueParser.trimEnd(data, s, end);
        if (parser.isNa(data, s, e)) {
            return;
        }
        if (canInt && !parser.parseLong(data, s, e, false)) {
            canInt = false;
        }
        if (!canInt && canFloat && !parser.parseDouble(data, s, e, false)) {
            canFloat = false;
        }
        if (canBool && !parser.parseBoolean(data, s, e)) {
            canBool = false;
        }
        if (canDate && !parser.parseDate(data, s, e)) {
            canDate = false;
        }
    }

    /**
     * Whether further values can still change the result.
     */
    public boolean isUndecided() {
        return canInt || canFloat || canBool || canDate;
    }

    /**
     * Folds the observations of another part of the same column into this one.
     */
    public void merge(TypeInference other) {
        canInt &= other.canInt;
        canFloat &= other.canFloat;
        canBool &= other.canBool;
        canDate &= other.canDate;
    }

    public DType result() {
        if (canInt) {
            return DType.INT64;
        }
        if (canFloat) {
            return DType.FLOAT64;
        }
        if (canBool) {
            return DType.BOOL;
        }
        if (canDate) {
            return DType.DATE;
        }
        return DType.STR;
    }
}

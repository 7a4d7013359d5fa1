/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import dev.kindling.reader.CsvOptions;

/**
 * Converts the raw bytes of one field into a typed value, according to the NA, boolean,
 * numeric and date conventions of a read.
 * <p>
 * Each read owns one instance; the conversion methods store the last parsed value and
 * are not thread-safe. All methods expect the field to be trimmed with {@link #trimStart}
 * and {@link #trimEnd} first.
 * </p>
 */
public final class ValueParser {

    private final NaValues naValues;
    private final BooleanTokens booleanTokens;
    private final NumberParser numbers;
    private final DateParser dates;

    private long longValue;
    private double doubleValue;
    private boolean booleanValue;

    public ValueParser(NaValues naValues, BooleanTokens booleanTokens, NumberParser numbers, DateParser dates) {
        this.naValues = naValues;
        this.booleanTokens = booleanTokens;
        this.numbers = numbers;
        this.dates = dates;
    }

    public static ValueParser create(CsvOptions options) {
        return new ValueParser(
                NaValues.create(options.naValues(), options.keepDefaultNa(), options.naFilter()),
                new BooleanTokens(options.trueValues(), options.falseValues()),
                new NumberParser(options.decimal(), options.thousands()),
                new DateParser(options.dayFirst()));
    }

    public static int trimStart(byte[] data, int start, int end) {
        while (start < end && (data[start] == ' ' || data[start] == '\t')) {
            start++;
        }
        return start;
    }

    public static int trimEnd(byte[] data, int start, int end) {
        while (end > start && (data[end - 1] == ' ' || data[end - 1] == '\t')) {
            end--;
        }
        return end;
    }

    /**
     * Whether missing values are detected; if not, failed conversions yield missing values.
     */
    public boolean naFilter() {
        return naValues.isEnabled();
    }

    public boolean isNa(byte[] data, int start, int end) {
        return naValues.isNa(data, start, end);
    }

    /**
     * @param acceptBooleans whether boolean tokens convert to 1 and 0
     */
    public boolean parseLong(byte[] data, int start, int end, boolean acceptBooleans) {
        if (numbers.parseLong(data, start, end)) {
            longValue = numbers.longValue();
            return true;
        }
        return acceptBooleans && booleanAsLong(data, start, end);
    }

    public boolean parseInt(byte[] data, int start, int end, boolean acceptBooleans) {
        if (numbers.parseInt(data, start, end)) {
            longValue = numbers.longValue();
            return true;
        }
        return acceptBooleans && booleanAsLong(data, start, end);
    }

    public boolean parseDouble(byte[] data, int start, int end, boolean acceptBooleans) {
        if (numbers.parseDouble(data, start, end)) {
            doubleValue = numbers.doubleValue();
            return true;
        }
        if (acceptBooleans && booleanAsLong(data, start, end)) {
            doubleValue = longValue;
            return true;
        }
        return false;
    }

    public boolean parseFloat(byte[] data, int start, int end, boolean acceptBooleans) {
        if (numbers.parseFloat(data, start, end)) {
            doubleValue = numbers.floatValue();
            return true;
        }
        if (acceptBooleans && booleanAsLong(data, start, end)) {
            doubleValue = longValue;
            return true;
        }
        return false;
    }

    public boolean parseBoolean(byte[] data, int start, int end) {
        int match = booleanTokens.match(data, start, end);
        if (match == BooleanTokens.NO_MATCH) {
            return false;
        }
        booleanValue = match == 1;
        return true;
    }

    public boolean parseDate(byte[] data, int start, int end) {
        if (dates.parse(data, start, end)) {
            longValue = dates.millis();
            return true;
        }
        return false;
    }

    public int categoryCode(byte[] data, int start, int end) {
        return CategoryHash.hash(data, start, end - start);
    }

    public long longValue() {
        return longValue;
    }

    public double doubleValue() {
        return doubleValue;
    }

    public float floatValue() {
        return (float) doubleValue;
    }

    /** Value of the last successful {@link #parseDate}, in epoch milliseconds. */
    public long dateValue() {
        return longValue;
    }

    public boolean booleanValue() {
        return booleanValue;
    }

    private boolean booleanAsLong(byte[] data, int start, int end) {
        int match = booleanTokens.match(data, start, end);
        if (match == BooleanTokens.NO_MATCH) {
            return false;
        }
        longValue = match;
        return true;
    }
}

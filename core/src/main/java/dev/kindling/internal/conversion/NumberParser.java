/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.util.Arrays;

/**
 * Parses integers and floating point numbers from trimmed field bytes, honoring the
 * configured decimal and thousands separators.
 * <p>
 * Thousands separators are accepted between digits of the integral part only. Floats accept
 * an exponent ({@code e}/{@code E} with optional sign) as well as {@code inf}, {@code infinity}
 * and {@code nan} in any case and with optional sign.
 * </p>
 * <p>
 * Instances hold the last parsed value and are not thread-safe.
 * </p>
 */
public final class NumberParser {

    private final int decimal;
    private final int thousands;
    private char[] scratch = new char[32];
    private int scratchLength;

    private long longValue;
    private double doubleValue;

    /**
     * @param decimal the decimal separator
     * @param thousands the thousands separator, or -1
     */
    public NumberParser(int decimal, int thousands) {
        this.decimal = decimal;
        this.thousands = thousands;
    }

    /**
     * Parses a 64-bit integer. Fractional content, an exponent or overflow fail.
     */
    public boolean parseLong(byte[] data, int start, int end) {
        int i = start;
        if (i >= end) {
            return false;
        }
        boolean negative = false;
        int c = data[i] & 0xFF;
        if (c == '-' || c == '+') {
            negative = c == '-';
            i++;
        }

        // accumulated negatively to cover Long.MIN_VALUE
        long result = 0;
        int digits = 0;
        for (; i < end; i++) {
            c = data[i] & 0xFF;
            if (c >= '0' && c <= '9') {
                int digit = c - '0';
                if (result < (Long.MIN_VALUE + digit) / 10) {
                    return false;
                }
                result = result * 10 - digit;
                digits++;
            }
            else if (c != thousands || digits == 0 || i == end - 1) {
                return false;
            }
        }
        if (digits == 0) {
            return false;
        }
        if (!negative) {
            if (result == Long.MIN_VALUE) {
                return false;
            }
            result = -result;
        }
        longValue = result;
        return true;
    }

    /**
     * Parses a 32-bit integer.
     */
    public boolean parseInt(byte[] data, int start, int end) {
        return parseLong(data, start, end) && longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE;
    }

    /**
     * Parses a double; integral text is accepted.
     */
    public boolean parseDouble(byte[] data, int start, int end) {
        if (!normalize(data, start, end)) {
            return false;
        }
        doubleValue = Double.parseDouble(new String(scratch, 0, scratchLength));
        return true;
    }

    /**
     * Parses a float, rounding the decimal text directly to single precision.
     */
    public boolean parseFloat(byte[] data, int start, int end) {
        if (!normalize(data, start, end)) {
            return false;
        }
        doubleValue = Float.parseFloat(new String(scratch, 0, scratchLength));
        return true;
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

    /**
     * Validates the text and writes it to the scratch buffer in the form accepted by
     * {@link Double#parseDouble(String)}.
     */
    private boolean normalize(byte[] data, int start, int end) {
        int length = end - start;
        if (length <= 0) {
            return false;
        }
        if (scratch.length < length + 1) {
            scratch = Arrays.copyOf(scratch, length + 16);
        }
        scratchLength = 0;

        int i = start;
        int c = data[i] & 0xFF;
        if (c == '-' || c == '+') {
            if (c == '-') {
                scratch[scratchLength++] = '-';
            }
            i++;
        }

        if (i < end && isLetter(data[i] & 0xFF)) {
            return special(data, i, end);
        }

        int digits = 0;
        boolean inFraction = false;
        for (; i < end; i++) {
            c = data[i] & 0xFF;
            if (c >= '0' && c <= '9') {
                scratch[scratchLength++] = (char) c;
                digits++;
            }
            else if (c == decimal && !inFraction) {
                scratch[scratchLength++] = '.';
                inFraction = true;
            }
            else if (c == thousands && !inFraction && digits > 0 && i < end - 1) {
                continue;
            }
            else {
                break;
            }
        }
        if (digits == 0) {
            return false;
        }

        if (i < end) {
            c = data[i] & 0xFF;
            if (c != 'e' && c != 'E') {
                return false;
            }
            scratch[scratchLength++] = 'e';
            i++;
            if (i < end && ((data[i] & 0xFF) == '-' || (data[i] & 0xFF) == '+')) {
                scratch[scratchLength++] = (char) (data[i] & 0xFF);
                i++;
            }
            int exponentDigits = 0;
            for (; i < end; i++) {
                c = data[i] & 0xFF;
                if (c < '0' || c > '9') {
                    return false;
                }
                scratch[scratchLength++] = (char) c;
                exponentDigits++;
            }
            return exponentDigits > 0;
        }
        return true;
    }

    private boolean special(byte[] data, int start, int end) {
        String word = asciiLowerCase(data, start, end);
        switch (word) {
            case "inf", "infinity" -> appendWord("Infinity");
            case "nan" -> {
                // sign is irrelevant for NaN
                scratchLength = 0;
                appendWord("NaN");
            }
            default -> {
                return false;
            }
        }
        return true;
    }

    private void appendWord(String word) {
        for (int i = 0; i < word.length(); i++) {
            scratch[scratchLength++] = word.charAt(i);
        }
    }

    private static boolean isLetter(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static String asciiLowerCase(byte[] data, int start, int end) {
        char[] chars = new char[end - start];
        for (int i = start; i < end; i++) {
            int c = data[i] & 0xFF;
            chars[i - start] = (c >= 'A' && c <= 'Z') ? (char) (c + 32) : (char) c;
        }
        return new String(chars);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Parses dates and timestamps into milliseconds since 1970-01-01T00:00, without time zone.
 * <p>
 * Supported forms, with optional spaces around the date separators:
 * </p>
 * <ul>
 *   <li>{@code y-m-d}, {@code y/m/d} (four digit year first)</li>
 *   <li>{@code d/m/y}, {@code m/d/y}, {@code d-m-y}, {@code m-d-y} (four digit year last);
 *       day-first or month-first as configured, falling back to the other order if the
 *       preferred one does not denote a valid date</li>
 *   <li>an optional time {@code H:M[:S[.fff]]} after {@code T} or spaces, with optional
 *       {@code AM}/{@code PM} and trailing {@code Z}</li>
 * </ul>
 * <p>
 * Instances hold the last parsed value and are not thread-safe.
 * </p>
 */
public final class DateParser {

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private final boolean dayFirst;

    private byte[] data;
    private int pos;
    private int end;
    private int lastDigits;
    private long millis;

    public DateParser(boolean dayFirst) {
        this.dayFirst = dayFirst;
    }

    public long millis() {
        return millis;
    }

    /**
     * @return whether the trimmed text is a valid date or timestamp
     */
    public boolean parse(byte[] data, int start, int end) {
        this.data = data;
        this.pos = start;
        this.end = end;

        int first = number(4);
        int firstDigits = lastDigits;
        if (first < 0) {
            return false;
        }
        skipSpaces();
        int separator = peek();
        if (separator != '-' && separator != '/') {
            return false;
        }
        pos++;
        skipSpaces();
        int second = number(2);
        if (second < 0) {
            return false;
        }
        skipSpaces();
        if (peek() != separator) {
            return false;
        }
        pos++;
        skipSpaces();
        int third = number(4);
        int thirdDigits = lastDigits;
        if (third < 0) {
            return false;
        }

        int year;
        int month;
        int day;
        if (firstDigits == 4) {
            if (thirdDigits > 2) {
                return false;
            }
            year = first;
            month = second;
            day = third;
        }
        else if (thirdDigits == 4) {
            year = third;
            if (dayFirst) {
                day = first;
                month = second;
            }
            else {
                month = first;
                day = second;
            }
            if (!isValidDate(year, month, day)) {
                int swap = day;
                day = month;
                month = swap;
            }
        }
        else {
            return false;
        }
        if (!isValidDate(year, month, day)) {
            return false;
        }

        long timeOfDay = 0;
        if (pos < end) {
            timeOfDay = time();
            if (timeOfDay < 0) {
                return false;
            }
        }
        millis = LocalDate.of(year, month, day).toEpochDay() * MILLIS_PER_DAY + timeOfDay;
        return true;
    }

    /**
     * @return milliseconds since midnight, or -1 if the rest of the text is not a valid time
     */
    private long time() {
        if (peek() == 'T') {
            pos++;
        }
        else if (peek() == ' ' || peek() == '\t') {
            skipSpaces();
        }
        else {
            return -1;
        }

        int hour = number(2);
        if (hour < 0 || peek() != ':') {
            return -1;
        }
        pos++;
        int minute = number(2);
        if (minute < 0) {
            return -1;
        }
        int second = 0;
        int milli = 0;
        if (peek() == ':') {
            pos++;
            second = number(2);
            if (second < 0) {
                return -1;
            }
            if (peek() == '.') {
                pos++;
                milli = fraction();
                if (milli < 0) {
                    return -1;
                }
            }
        }

        skipSpaces();
        int meridiem = peek();
        if (meridiem == 'A' || meridiem == 'a' || meridiem == 'P' || meridiem == 'p') {
            pos++;
            int m = peek();
            if (m != 'M' && m != 'm') {
                return -1;
            }
            pos++;
            if (hour < 1 || hour > 12) {
                return -1;
            }
            boolean pm = meridiem == 'P' || meridiem == 'p';
            if (hour == 12) {
                hour = pm ? 12 : 0;
            }
            else if (pm) {
                hour += 12;
            }
        }
        if (peek() == 'Z') {
            pos++;
        }
        if (pos != end || hour > 23 || minute > 59 || second > 59) {
            return -1;
        }
        return ((hour * 60L + minute) * 60L + second) * 1000L + milli;
    }

    /**
     * Reads 1 to 9 fraction digits, returning the first three as milliseconds.
     */
    private int fraction() {
        int value = 0;
        int digits = 0;
        while (pos < end && isDigit(data[pos])) {
            if (digits < 3) {
                value = value * 10 + (data[pos] - '0');
            }
            digits++;
            pos++;
        }
        if (digits == 0 || digits > 9) {
            return -1;
        }
        for (int i = digits; i < 3; i++) {
            value *= 10;
        }
        return value;
    }

    /**
     * Reads an unsigned number of 1 to {@code maxDigits} digits.
     *
     * @return the value, or -1 if there are no digits or too many
     */
    private int number(int maxDigits) {
        int value = 0;
        int digits = 0;
        while (pos < end && isDigit(data[pos])) {
            value = value * 10 + (data[pos] - '0');
            digits++;
            pos++;
            if (digits > maxDigits) {
                return -1;
            }
        }
        lastDigits = digits;
        return digits == 0 ? -1 : value;
    }

    private int peek() {
        return pos < end ? data[pos] & 0xFF : -1;
    }

    private void skipSpaces() {
        while (pos < end && (data[pos] == ' ' || data[pos] == '\t')) {
            pos++;
        }
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private static boolean isValidDate(int year, int month, int day) {
        return month >= 1 && month <= 12 && day >= 1 && day <= YearMonth.of(year, month).lengthOfMonth();
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DateParserTest {

    private final DateParser dayFirst = new DateParser(true);
    private final DateParser monthFirst = new DateParser(false);

    // ==================== Dates ====================

    @Test
    void testDayFirstDates() {
        assertThat(parse(dayFirst, "31/10/2010")).isEqualTo(LocalDateTime.of(2010, 10, 31, 0, 0));
        assertThat(parse(dayFirst, "05/03/2001")).isEqualTo(LocalDateTime.of(2001, 3, 5, 0, 0));
        assertThat(parse(dayFirst, "18/04/1995")).isEqualTo(LocalDateTime.of(1995, 4, 18, 0, 0));
        assertThat(parse(dayFirst, "1/1/1970")).isEqualTo(LocalDateTime.of(1970, 1, 1, 0, 0));
    }

    @Test
    void testMonthFirstDates() {
        assertThat(parse(monthFirst, "05/03/2001")).isEqualTo(LocalDateTime.of(2001, 5, 3, 0, 0));
        assertThat(parse(monthFirst, "11/22/1995")).isEqualTo(LocalDateTime.of(1995, 11, 22, 0, 0));
    }

    @Test
    void testImpossibleOrderFallsBackToSwap() {
        assertThat(parse(monthFirst, "31/10/2010")).isEqualTo(LocalDateTime.of(2010, 10, 31, 0, 0));
        assertThat(parse(dayFirst, "11/22/1995")).isEqualTo(LocalDateTime.of(1995, 11, 22, 0, 0));
    }

    @Test
    void testIsoDates() {
        assertThat(parse(dayFirst, "2016-04-30")).isEqualTo(LocalDateTime.of(2016, 4, 30, 0, 0));
        assertThat(parse(monthFirst, "2007-4-3")).isEqualTo(LocalDateTime.of(2007, 4, 3, 0, 0));
        assertThat(parse(monthFirst, "1995/11/22")).isEqualTo(LocalDateTime.of(1995, 11, 22, 0, 0));
    }

    @Test
    void testSpacesAroundSeparators() {
        assertThat(parse(dayFirst, "14 / 07 / 1994")).isEqualTo(LocalDateTime.of(1994, 7, 14, 0, 0));
    }

    @Test
    void testEpochMillis() {
        assertThat(millis(dayFirst, "1/1/1970")).isEqualTo(0L);
        assertThat(millis(dayFirst, "2/1/1970")).isEqualTo(86_400_000L);
        assertThat(millis(monthFirst, "1969-12-31")).isEqualTo(-86_400_000L);
    }

    // ==================== Times ====================

    @Test
    void testIsoTimestamp() {
        assertThat(parse(dayFirst, "2016-04-30T01:02:03.400"))
                .isEqualTo(LocalDateTime.of(2016, 4, 30, 1, 2, 3, 400_000_000));
        assertThat(parse(dayFirst, "2016-04-30T01:02:03Z"))
                .isEqualTo(LocalDateTime.of(2016, 4, 30, 1, 2, 3));
        assertThat(parse(dayFirst, "2016-04-30 23:59"))
                .isEqualTo(LocalDateTime.of(2016, 4, 30, 23, 59));
    }

    @Test
    void testFractionIsTruncatedToMillis() {
        assertThat(parse(dayFirst, "2016-04-30T01:02:03.123456789"))
                .isEqualTo(LocalDateTime.of(2016, 4, 30, 1, 2, 3, 123_000_000));
        assertThat(parse(dayFirst, "2016-04-30T01:02:03.5"))
                .isEqualTo(LocalDateTime.of(2016, 4, 30, 1, 2, 3, 500_000_000));
    }

    @Test
    void testTwelveHourClock() {
        assertThat(parse(dayFirst, "2007-4-30 1:6:40.000PM"))
                .isEqualTo(LocalDateTime.of(2007, 4, 30, 13, 6, 40));
        assertThat(parse(dayFirst, "2020-01-01 12:30 AM"))
                .isEqualTo(LocalDateTime.of(2020, 1, 1, 0, 30));
        assertThat(parse(dayFirst, "2020-01-01 12:30 pm"))
                .isEqualTo(LocalDateTime.of(2020, 1, 1, 12, 30));
        assertThat(parse(dayFirst, "2020-01-01 13:30 PM")).isNull();
    }

    // ==================== Invalid ====================

    @Test
    void testRejectsInvalidText() {
        assertThat(parse(dayFirst, "")).isNull();
        assertThat(parse(dayFirst, "abc")).isNull();
        assertThat(parse(dayFirst, "2020")).isNull();
        assertThat(parse(dayFirst, "3977")).isNull();
        assertThat(parse(dayFirst, "1.5")).isNull();
        assertThat(parse(dayFirst, "2019-02-30")).isNull();
        assertThat(parse(dayFirst, "13/13/2020")).isNull();
        assertThat(parse(dayFirst, "1/2/03")).isNull();
        assertThat(parse(dayFirst, "2020-01/01")).isNull();
        assertThat(parse(dayFirst, "2020-01-01T25:00")).isNull();
        assertThat(parse(dayFirst, "2020-01-01 10:00 xyz")).isNull();
    }

    private static LocalDateTime parse(DateParser parser, String text) {
        Long millis = millis(parser, text);
        return millis == null ? null : LocalDateTime.ofEpochSecond(Math.floorDiv(millis, 1000L),
                (int) Math.floorMod(millis, 1000L) * 1_000_000, ZoneOffset.UTC);
    }

    private static Long millis(DateParser parser, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return parser.parse(bytes, 0, bytes.length) ? parser.millis() : null;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.tokenizer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.kindling.reader.MalformedQuotingException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenizerTest {

    private static final Dialect COMMA = new Dialect((byte) ',', false, true, (byte) '"', -1, true);

    // ==================== Plain fields ====================

    @Test
    void testSimpleRows() throws IOException {
        assertThat(tokenize("a,b,c\n1,2,3\n", COMMA))
                .containsExactly(List.of("a", "b", "c"), List.of("1", "2", "3"));
    }

    @Test
    void testLastLineWithoutTerminator() throws IOException {
        assertThat(tokenize("a,b\n1,2", COMMA))
                .containsExactly(List.of("a", "b"), List.of("1", "2"));
    }

    @Test
    void testEmptyInput() throws IOException {
        assertThat(tokenize("", COMMA)).isEmpty();
    }

    @Test
    void testUnquotedFieldsAreTrimmed() throws IOException {
        assertThat(tokenize("  a , b\t,c  \n", COMMA))
                .containsExactly(List.of("a", "b", "c"));
    }

    @Test
    void testTrailingDelimiterYieldsEmptyField() throws IOException {
        assertThat(tokenize("a,b,\n,,\n", COMMA))
                .containsExactly(List.of("a", "b", ""), List.of("", "", ""));
    }

    @Test
    void testTabDelimiterIsNotTrimmed() throws IOException {
        Dialect tab = COMMA.withDelimiter((byte) '\t');
        assertThat(tokenize("a\t\tb\n 1 \t2\n", tab))
                .containsExactly(List.of("a", "", "b"), List.of("1", "2"));
    }

    // ==================== Line endings ====================

    @Test
    void testCrLfLineEndings() throws IOException {
        assertThat(tokenize("a,b\r\n1,2\r\n", COMMA))
                .containsExactly(List.of("a", "b"), List.of("1", "2"));
    }

    @Test
    void testLoneCarriageReturn() throws IOException {
        assertThat(tokenize("a,b\r1,2\r", COMMA))
                .containsExactly(List.of("a", "b"), List.of("1", "2"));
    }

    // ==================== Quoting ====================

    @Test
    void testQuotedFieldsWithDelimitersAndNewlines() throws IOException {
        String text = "\"1,,1\",\"2,\n,2\",3\n4,5,6\n";
        assertThat(tokenize(text, COMMA))
                .containsExactly(List.of("1,,1", "2,\n,2", "3"), List.of("4", "5", "6"));
    }

    @Test
    void testSpacesAroundQuotedFields() throws IOException {
        String text = "\"1,one,\" , \",2,two\" ,3\n";
        assertThat(tokenize(text, COMMA))
                .containsExactly(List.of("1,one,", ",2,two", "3"));
    }

    @Test
    void testSpacesInsideQuotesAreKept() throws IOException {
        List<Row> rows = rows(" \" a \" ,b\n", COMMA);

        assertThat(rows.get(0).fields()).containsExactly(" a ", "b");
        assertThat(rows.get(0).isQuoted(0)).isTrue();
        assertThat(rows.get(0).isQuoted(1)).isFalse();
    }

    @Test
    void testDoubledQuotes() throws IOException {
        assertThat(tokenize("\"say \"\"hi\"\"\",x\n", COMMA))
                .containsExactly(List.of("say \"hi\"", "x"));
    }

    @Test
    void testQuoteInsideUnquotedFieldIsLiteral() throws IOException {
        assertThat(tokenize("ab\"c,d\n", COMMA))
                .containsExactly(List.of("ab\"c", "d"));
    }

    @Test
    void testTextAfterClosingQuoteIsAppended() throws IOException {
        assertThat(tokenize("\"ab\"cd,e\n", COMMA))
                .containsExactly(List.of("abcd", "e"));
    }

    @Test
    void testQuotingDisabled() throws IOException {
        Dialect unquoted = new Dialect((byte) ',', false, false, (byte) '"', -1, true);
        assertThat(tokenize("\"a,b\"\n", unquoted))
                .containsExactly(List.of("\"a", "b\""));
    }

    @Test
    void testUnterminatedQuote() {
        assertThatThrownBy(() -> tokenize("x,y\na,\"bc\n", COMMA))
                .isInstanceOf(MalformedQuotingException.class)
                .satisfies(e -> {
                    MalformedQuotingException malformed = (MalformedQuotingException) e;
                    assertThat(malformed.getByteOffset()).isEqualTo(4);
                    assertThat(malformed.getColumn()).isEqualTo(1);
                });
    }

    // ==================== Comments and blank lines ====================

    @Test
    void testCommentLinesAndTrailingComments() throws IOException {
        Dialect comments = new Dialect((byte) ',', false, true, (byte) '"', '#', true);
        assertThat(tokenize("# header comment\na,b\n1,2 # trailing\n  # indented\n3,4\n", comments))
                .containsExactly(List.of("a", "b"), List.of("1", "2"), List.of("3", "4"));
    }

    @Test
    void testCommentCharInsideQuotes() throws IOException {
        Dialect comments = new Dialect((byte) ',', false, true, (byte) '"', '#', true);
        assertThat(tokenize("\"a#b\",c\n", comments))
                .containsExactly(List.of("a#b", "c"));
    }

    @Test
    void testBlankLinesSkipped() throws IOException {
        assertThat(tokenize("a\n\n  \r\nb\n", COMMA))
                .containsExactly(List.of("a"), List.of("b"));
    }

    @Test
    void testBlankLinesKept() throws IOException {
        assertThat(tokenize("a\n\n  \nb\n", COMMA.withSkipBlankLines(false)))
                .containsExactly(List.of("a"), List.of(""), List.of(""), List.of("b"));
    }

    // ==================== Whitespace separation ====================

    @Test
    void testWhitespaceSeparatedFields() throws IOException {
        Dialect whitespace = COMMA.withWhitespace();
        assertThat(tokenize("  a   b\tc  \n1 2 3\n", whitespace))
                .containsExactly(List.of("a", "b", "c"), List.of("1", "2", "3"));
    }

    @Test
    void testWhitespaceSeparatedQuotedFields() throws IOException {
        Dialect whitespace = COMMA.withWhitespace();
        assertThat(tokenize("\"a b\" c\n", whitespace))
                .containsExactly(List.of("a b", "c"));
    }

    // ==================== Offsets and input ====================

    @Test
    void testRowOffsets() throws IOException {
        List<Row> rows = rows("ab,c\r\nd\n", COMMA);

        assertThat(rows.get(0).startOffset()).isEqualTo(0);
        assertThat(rows.get(0).endOffset()).isEqualTo(6);
        assertThat(rows.get(1).startOffset()).isEqualTo(6);
        assertThat(rows.get(1).endOffset()).isEqualTo(8);
    }

    @Test
    void testStartOffset() throws IOException {
        byte[] bytes = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        Tokenizer tokenizer = new Tokenizer(BufferByteInput.of(bytes), COMMA, 4);
        Row row = new Row();

        assertThat(tokenizer.next(row)).isTrue();
        assertThat(row.fields()).containsExactly("1", "2");
        assertThat(tokenizer.next(row)).isFalse();
        assertThat(tokenizer.position()).isEqualTo(8);
    }

    @Test
    void testStreamInputMatchesBufferInput() throws IOException {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            text.append(i).append(",\"quoted ").append(i).append("\n line\",").append(i * 2).append('\n');
        }
        byte[] bytes = text.toString().getBytes(StandardCharsets.UTF_8);

        List<List<String>> fromBuffer = tokenize(BufferByteInput.of(bytes), COMMA);
        List<List<String>> fromStream = tokenize(new StreamByteInput(new ByteArrayInputStream(bytes), 16), COMMA);

        assertThat(fromBuffer).hasSize(5000);
        assertThat(fromStream).isEqualTo(fromBuffer);
        assertThat(fromBuffer.get(4999)).containsExactly("4999", "quoted 4999\n line", "9998");
    }

    private static List<List<String>> tokenize(String text, Dialect dialect) throws IOException {
        return tokenize(BufferByteInput.of(text.getBytes(StandardCharsets.UTF_8)), dialect);
    }

    private static List<List<String>> tokenize(ByteInput input, Dialect dialect) throws IOException {
        Tokenizer tokenizer = new Tokenizer(input, dialect, 0);
        Row row = new Row();
        List<List<String>> result = new ArrayList<>();
        while (tokenizer.next(row)) {
            result.add(row.fields());
        }
        return result;
    }

    private static List<Row> rows(String text, Dialect dialect) throws IOException {
        Tokenizer tokenizer = new Tokenizer(BufferByteInput.of(text.getBytes(StandardCharsets.UTF_8)), dialect, 0);
        Row row = new Row();
        List<Row> result = new ArrayList<>();
        while (tokenizer.next(row)) {
            result.add(row.copy());
        }
        return result;
    }
}

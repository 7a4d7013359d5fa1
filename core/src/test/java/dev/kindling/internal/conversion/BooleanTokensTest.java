/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BooleanTokensTest {

    @Test
    void testBuiltInTokensIgnoreCase() {
        BooleanTokens tokens = new BooleanTokens(Set.of(), Set.of());

        assertThat(match(tokens, "True")).isEqualTo(1);
        assertThat(match(tokens, "TRUE")).isEqualTo(1);
        assertThat(match(tokens, "false")).isEqualTo(0);
        assertThat(match(tokens, "FaLsE")).isEqualTo(0);
    }

    @Test
    void testCustomTokens() {
        BooleanTokens tokens = new BooleanTokens(Set.of("Yes", "on"), Set.of("no"));

        assertThat(match(tokens, "yes")).isEqualTo(1);
        assertThat(match(tokens, "ON")).isEqualTo(1);
        assertThat(match(tokens, "No")).isEqualTo(0);
        assertThat(match(tokens, "true")).isEqualTo(1);
    }

    @Test
    void testNoMatch() {
        BooleanTokens tokens = new BooleanTokens(Set.of(), Set.of());

        assertThat(match(tokens, "")).isEqualTo(BooleanTokens.NO_MATCH);
        assertThat(match(tokens, "1")).isEqualTo(BooleanTokens.NO_MATCH);
        assertThat(match(tokens, "3977")).isEqualTo(BooleanTokens.NO_MATCH);
        assertThat(match(tokens, "truee")).isEqualTo(BooleanTokens.NO_MATCH);
        assertThat(match(tokens, "a much longer text than any token")).isEqualTo(BooleanTokens.NO_MATCH);
    }

    private static int match(BooleanTokens tokens, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return tokens.match(bytes, 0, bytes.length);
    }
}

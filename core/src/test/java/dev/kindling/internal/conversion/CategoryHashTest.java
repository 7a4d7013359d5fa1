/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryHashTest {

    @Test
    void testReferenceCodes() {
        assertThat(CategoryHash.hash("HBM0676")).isEqualTo(2022314536);
        assertThat(CategoryHash.hash("KRC0842")).isEqualTo(-189888986);
        assertThat(CategoryHash.hash("ILM1441")).isEqualTo(1512937027);
        assertThat(CategoryHash.hash("EJV0094")).isEqualTo(397836265);
    }

    @Test
    void testShortValues() {
        assertThat(CategoryHash.hash("")).isEqualTo(-85127662);
        assertThat(CategoryHash.hash("a")).isEqualTo(849518034);
        assertThat(CategoryHash.hash("M")).isEqualTo(-109074492);
        assertThat(CategoryHash.hash("F")).isEqualTo(229921322);
        assertThat(CategoryHash.hash("abcd")).isEqualTo(555342687);
    }

    @Test
    void testHashesUtf8Bytes() {
        assertThat(CategoryHash.hash("Ünïcode")).isEqualTo(1310765057);
    }

    @Test
    void testHashOfSubrange() {
        byte[] bytes = "xxHBM0676yy".getBytes(StandardCharsets.UTF_8);

        assertThat(CategoryHash.hash(bytes, 2, 7)).isEqualTo(CategoryHash.hash("HBM0676"));
    }
}

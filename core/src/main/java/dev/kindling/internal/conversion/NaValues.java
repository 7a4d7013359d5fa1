/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

/**
 * Tokens denoting missing values. Matching is exact (case-sensitive) on trimmed text;
 * the empty string is always missing while filtering is enabled.
 */
public final class NaValues {

    public static final Set<String> DEFAULT_TOKENS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan",
            "1.#IND", "1.#QNAN", "N/A", "NA", "NULL", "NaN", "n/a", "nan", "null");

    private static final NaValues DISABLED = new NaValues(Set.of(), false);

    private final Set<String> tokens;
    private final int maxLength;
    private final boolean enabled;

    private NaValues(Set<String> tokens, boolean enabled) {
        this.tokens = tokens;
        this.enabled = enabled;
        int max = 0;
        for (String token : tokens) {
            max = Math.max(max, token.getBytes(StandardCharsets.UTF_8).length);
        }
        this.maxLength = max;
    }

    /**
     * @param custom additional tokens
     * @param keepDefaults whether {@link #DEFAULT_TOKENS} apply
     * @param filter whether missing values are detected at all
     */
    public static NaValues create(Set<String> custom, boolean keepDefaults, boolean filter) {
        if (!filter) {
            return DISABLED;
        }
        Set<String> tokens = new HashSet<>(custom);
        if (keepDefaults) {
            tokens.addAll(DEFAULT_TOKENS);
        }
        return new NaValues(Set.copyOf(tokens), true);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Whether the given trimmed text denotes a missing value.
     */
    public boolean isNa(byte[] data, int start, int end) {
        if (!enabled) {
            return false;
        }
        int length = end - start;
        if (length == 0) {
            return true;
        }
        if (length > maxLength) {
            return false;
        }
        return tokens.contains(new String(data, start, length, StandardCharsets.UTF_8));
    }

    public boolean isNa(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return isNa(bytes, 0, bytes.length);
    }
}

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
import java.util.Locale;
import java.util.Set;

/**
 * Literal tokens for true and false, matched case-insensitively on trimmed text.
 * {@code True}/{@code TRUE} and {@code False}/{@code FALSE} are always recognized.
 * Numbers are never booleans unless explicitly configured as tokens.
 */
public final class BooleanTokens {

    public static final int NO_MATCH = -1;

    private final Set<String> trueTokens;
    private final Set<String> falseTokens;
    private final int maxLength;

    public BooleanTokens(Set<String> trueValues, Set<String> falseValues) {
        this.trueTokens = lowerCase(trueValues, "true");
        this.falseTokens = lowerCase(falseValues, "false");
        int max = 0;
        for (String token : trueTokens) {
            max = Math.max(max, token.length());
        }
        for (String token : falseTokens) {
            max = Math.max(max, token.length());
        }
        this.maxLength = max;
    }

    private static Set<String> lowerCase(Set<String> values, String builtIn) {
        Set<String> tokens = new HashSet<>();
        tokens.add(builtIn);
        for (String value : values) {
            tokens.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(tokens);
    }

    /**
     * @return 1 for a true token, 0 for a false token, {@link #NO_MATCH} otherwise
     */
    public int match(byte[] data, int start, int end) {
        int length = end - start;
        if (length == 0 || length > maxLength * 4) {
            return NO_MATCH;
        }
        String text = new String(data, start, length, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        if (trueTokens.contains(text)) {
            return 1;
        }
        if (falseTokens.contains(text)) {
            return 0;
        }
        return NO_MATCH;
    }
}

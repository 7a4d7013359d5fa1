/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.conversion;

import java.nio.charset.StandardCharsets;

/**
 * Category codes: MurmurHash3 (x86, 32 bit) with seed 33 over the UTF-8 bytes of a value.
 * Equal text always yields the same code, in any read and any process.
 */
public final class CategoryHash {

    static final int SEED = 33;

    private static final int C1 = 0xcc9e2d51;
    private static final int C2 = 0x1b873593;

    private CategoryHash() {
    }

    public static int hash(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        return hash(bytes, 0, bytes.length);
    }

    public static int hash(byte[] data, int offset, int length) {
        int h = SEED;
        int blockEnd = offset + (length & ~3);
        for (int i = offset; i < blockEnd; i += 4) {
            int k = (data[i] & 0xFF)
                    | (data[i + 1] & 0xFF) << 8
                    | (data[i + 2] & 0xFF) << 16
                    | (data[i + 3] & 0xFF) << 24;
            h ^= mixK(k);
            h = Integer.rotateLeft(h, 13);
            h = h * 5 + 0xe6546b64;
        }

        int k = 0;
        switch (length & 3) {
            case 3:
                k ^= (data[blockEnd + 2] & 0xFF) << 16;
            case 2:
                k ^= (data[blockEnd + 1] & 0xFF) << 8;
            case 1:
                k ^= data[blockEnd] & 0xFF;
                h ^= mixK(k);
            default:
                break;
        }

        h ^= length;
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    private static int mixK(int k) {
        k *= C1;
        k = Integer.rotateLeft(k, 15);
        return k * C2;
    }
}

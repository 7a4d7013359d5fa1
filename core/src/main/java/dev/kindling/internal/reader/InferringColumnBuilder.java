/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.util.Arrays;
import java.util.BitSet;

import dev.kindling.internal.conversion.TypeInference;
import dev.kindling.internal.conversion.ValueParser;
import dev.kindling.reader.ConversionException;
import dev.kindling.reader.EmptyInputException;
import dev.kindling.schema.DType;
import dev.kindling.table.Column;

/**
 * Buffers the raw text of a column without explicit type. Once all rows are read, the
 * type is inferred from every buffered value and the values are converted to it.
 */
class InferringColumnBuilder implements ColumnAccumulator {

    private final String name;
    private final int sourceIndex;
    private final ValueParser parser;

    private byte[] data = new byte[4096];
    private int dataLength;
    private int[] offsets = new int[1025];
    private final BitSet missing = new BitSet();
    private final BitSet quoted = new BitSet();
    private int size;
    private TypeInference inference;

    InferringColumnBuilder(String name, int sourceIndex, ValueParser parser) {
        this.name = name;
        this.sourceIndex = sourceIndex;
        this.parser = parser;
    }

    @Override
    public void append(byte[] field, int start, int end, boolean isQuoted, long row, long byteOffset) {
        int length = end - start;
        if (dataLength + length > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, dataLength + length));
        }
        System.arraycopy(field, start, data, dataLength, length);
        dataLength += length;
        if (isQuoted) {
            quoted.set(size);
        }
        next();
    }

    @Override
    public void appendNull() {
        missing.set(size);
        next();
    }

    private void next() {
        size++;
        if (size == offsets.length) {
            offsets = Arrays.copyOf(offsets, offsets.length * 2);
        }
        offsets[size] = dataLength;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * The inferred type; {@code STR} for an empty range of a partitioned read.
     *
     * @throws EmptyInputException if there are no rows to infer from
     */
    DType inferType(boolean partial) throws EmptyInputException {
        if (size == 0) {
            if (partial) {
                return DType.STR;
            }
            throw new EmptyInputException(name);
        }
        return inference().result();
    }

    /**
     * The inference over all buffered values; undecided if there are none.
     */
    TypeInference inference() {
        if (inference == null) {
            inference = new TypeInference(parser);
            for (int i = 0; i < size && inference.isUndecided(); i++) {
                if (!missing.get(i)) {
                    inference.observe(data, offsets[i], offsets[i + 1]);
                }
            }
        }
        return inference;
    }

    @Override
    public Column build(boolean partial) throws EmptyInputException, ConversionException {
        DType type = inferType(partial);
        ColumnBuilder builder = ColumnBuilder.forType(type, name, sourceIndex, parser);
        for (int i = 0; i < size; i++) {
            if (missing.get(i)) {
                builder.appendNull();
            }
            else {
                builder.append(data, offsets[i], offsets[i + 1], quoted.get(i), i, -1);
            }
        }
        return builder.build(partial);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.kindling.schema.DType;

/**
 * Immutable options controlling how a CSV input is tokenized and converted.
 *
 * <pre>{@code
 * CsvOptions options = CsvOptions.builder()
 *         .delimiter(';')
 *         .decimal(',')
 *         .names(List.of("id", "amount"))
 *         .dtypes(List.of(DType.INT64, DType.FLOAT64))
 *         .build();
 * }</pre>
 *
 * <p>Combinations that cannot work together are rejected by {@link Builder#build()}
 * with a {@link ConflictingOptionsException}.</p>
 */
public final class CsvOptions {

    /** Value of {@link #nrows()} if the number of rows is not limited. */
    public static final long NO_LIMIT = -1;

    /** Value of {@link #commentChar()} and {@link #thousands()} if not set. */
    public static final int NONE = -1;

    static final int DEFAULT_SAMPLE_ROWS = 1024;

    private static final CsvOptions DEFAULTS = builder().build();

    private final byte delimiter;
    private final boolean explicitDelimiter;
    private final boolean delimWhitespace;
    private final boolean sniffDelimiter;
    private final byte quoteChar;
    private final boolean quoting;
    private final int commentChar;
    private final boolean skipBlankLines;
    private final HeaderSpec header;
    private final int skipRows;
    private final Set<Integer> skipRowIndices;
    private final int skipFooter;
    private final long nrows;
    private final List<String> names;
    private final List<DType> dtypeList;
    private final Map<String, DType> dtypeMap;
    private final byte decimal;
    private final int thousands;
    private final Set<String> trueValues;
    private final Set<String> falseValues;
    private final Set<String> naValues;
    private final boolean keepDefaultNa;
    private final boolean naFilter;
    private final boolean dayFirst;
    private final String prefix;
    private final IndexColumn indexColumn;
    private final ColumnSelection useColumns;
    private final ByteRange byteRange;
    private final int sampleRows;

    private CsvOptions(Builder builder) {
        this.delimiter = builder.delimiter;
        this.explicitDelimiter = builder.delimiterSet;
        this.delimWhitespace = builder.delimWhitespace;
        this.sniffDelimiter = builder.sniffDelimiter;
        this.quoteChar = builder.quoteChar;
        this.quoting = builder.quoting;
        this.commentChar = builder.commentChar;
        this.skipBlankLines = builder.skipBlankLines;
        this.header = builder.header;
        this.skipRows = builder.skipRows;
        this.skipRowIndices = Collections.unmodifiableSet(new LinkedHashSet<>(builder.skipRowIndices));
        this.skipFooter = builder.skipFooter;
        this.nrows = builder.nrows;
        this.names = builder.names != null ? List.copyOf(builder.names) : null;
        this.dtypeList = builder.dtypeList != null ? Collections.unmodifiableList(new ArrayList<>(builder.dtypeList)) : null;
        this.dtypeMap = builder.dtypeMap != null ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.dtypeMap)) : null;
        this.decimal = builder.decimal;
        this.thousands = builder.thousands;
        this.trueValues = Set.copyOf(builder.trueValues);
        this.falseValues = Set.copyOf(builder.falseValues);
        this.naValues = Set.copyOf(builder.naValues);
        this.keepDefaultNa = builder.keepDefaultNa;
        this.naFilter = builder.naFilter;
        this.dayFirst = builder.dayFirst;
        this.prefix = builder.prefix;
        this.indexColumn = builder.indexColumn;
        this.useColumns = builder.useColumns;
        this.byteRange = builder.byteRange;
        this.sampleRows = builder.sampleRows;
    }

    /**
     * Options with all defaults: comma separated, double-quote quoting, header inferred.
     */
    public static CsvOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with these options.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns these options, restricted to the given byte range.
     */
    public CsvOptions withByteRange(ByteRange range) {
        return toBuilder().byteRange(range).build();
    }

    public byte delimiter() {
        return delimiter;
    }

    public boolean delimWhitespace() {
        return delimWhitespace;
    }

    public boolean sniffDelimiter() {
        return sniffDelimiter;
    }

    public byte quoteChar() {
        return quoteChar;
    }

    public boolean quoting() {
        return quoting;
    }

    /** The comment byte, or {@link #NONE}. */
    public int commentChar() {
        return commentChar;
    }

    public boolean skipBlankLines() {
        return skipBlankLines;
    }

    public HeaderSpec header() {
        return header;
    }

    public int skipRows() {
        return skipRows;
    }

    public Set<Integer> skipRowIndices() {
        return skipRowIndices;
    }

    public int skipFooter() {
        return skipFooter;
    }

    /** Maximum number of data rows, or {@link #NO_LIMIT}. */
    public long nrows() {
        return nrows;
    }

    /** Explicit column names, or null. */
    public List<String> names() {
        return names;
    }

    /** Column types by position, or null. */
    public List<DType> dtypeList() {
        return dtypeList;
    }

    /** Column types by name, or null. */
    public Map<String, DType> dtypeMap() {
        return dtypeMap;
    }

    public byte decimal() {
        return decimal;
    }

    /** The thousands separator byte, or {@link #NONE}. */
    public int thousands() {
        return thousands;
    }

    public Set<String> trueValues() {
        return trueValues;
    }

    public Set<String> falseValues() {
        return falseValues;
    }

    public Set<String> naValues() {
        return naValues;
    }

    public boolean keepDefaultNa() {
        return keepDefaultNa;
    }

    public boolean naFilter() {
        return naFilter;
    }

    public boolean dayFirst() {
        return dayFirst;
    }

    /** Prefix of generated column names, or null. */
    public String prefix() {
        return prefix;
    }

    public IndexColumn indexColumn() {
        return indexColumn;
    }

    public ColumnSelection useColumns() {
        return useColumns;
    }

    /** The byte range to read, or null for the whole input. */
    public ByteRange byteRange() {
        return byteRange;
    }

    public int sampleRows() {
        return sampleRows;
    }

    /**
     * Builder for {@link CsvOptions}.
     */
    public static final class Builder {

        private byte delimiter = ',';
        private boolean delimiterSet;
        private boolean delimWhitespace;
        private boolean sniffDelimiter;
        private byte quoteChar = '"';
        private boolean quoting = true;
        private int commentChar = NONE;
        private boolean skipBlankLines = true;
        private HeaderSpec header = HeaderSpec.infer();
        private int skipRows;
        private Set<Integer> skipRowIndices = new LinkedHashSet<>();
        private int skipFooter;
        private long nrows = NO_LIMIT;
        private List<String> names;
        private List<DType> dtypeList;
        private Map<String, DType> dtypeMap;
        private byte decimal = '.';
        private int thousands = NONE;
        private Set<String> trueValues = new LinkedHashSet<>();
        private Set<String> falseValues = new LinkedHashSet<>();
        private Set<String> naValues = new LinkedHashSet<>();
        private boolean keepDefaultNa = true;
        private boolean naFilter = true;
        private boolean dayFirst;
        private String prefix;
        private IndexColumn indexColumn = IndexColumn.none();
        private ColumnSelection useColumns = ColumnSelection.all();
        private ByteRange byteRange;
        private int sampleRows = DEFAULT_SAMPLE_ROWS;

        private Builder() {
        }

        private Builder(CsvOptions options) {
            this.delimiter = options.delimiter;
            this.delimiterSet = options.explicitDelimiter;
            this.delimWhitespace = options.delimWhitespace;
            this.sniffDelimiter = options.sniffDelimiter;
            this.quoteChar = options.quoteChar;
            this.quoting = options.quoting;
            this.commentChar = options.commentChar;
            this.skipBlankLines = options.skipBlankLines;
            this.header = options.header;
            this.skipRows = options.skipRows;
            this.skipRowIndices = new LinkedHashSet<>(options.skipRowIndices);
            this.skipFooter = options.skipFooter;
            this.nrows = options.nrows;
            this.names = options.names;
            this.dtypeList = options.dtypeList;
            this.dtypeMap = options.dtypeMap;
            this.decimal = options.decimal;
            this.thousands = options.thousands;
            this.trueValues = new LinkedHashSet<>(options.trueValues);
            this.falseValues = new LinkedHashSet<>(options.falseValues);
            this.naValues = new LinkedHashSet<>(options.naValues);
            this.keepDefaultNa = options.keepDefaultNa;
            this.naFilter = options.naFilter;
            this.dayFirst = options.dayFirst;
            this.prefix = options.prefix;
            this.indexColumn = options.indexColumn;
            this.useColumns = options.useColumns;
            this.byteRange = options.byteRange;
            this.sampleRows = options.sampleRows;
        }

        /**
         * The field separator; a single ASCII character.
         */
        public Builder delimiter(char delimiter) {
            this.delimiter = singleByte("delimiter", delimiter);
            this.delimiterSet = true;
            return this;
        }

        /**
         * Alias of {@link #delimiter(char)}.
         */
        public Builder separator(char separator) {
            return delimiter(separator);
        }

        /**
         * Separate fields by runs of spaces and tabs instead of a delimiter character.
         */
        public Builder delimWhitespace(boolean delimWhitespace) {
            this.delimWhitespace = delimWhitespace;
            return this;
        }

        /**
         * Detect the delimiter from the first rows of the input.
         */
        public Builder sniffDelimiter(boolean sniffDelimiter) {
            this.sniffDelimiter = sniffDelimiter;
            return this;
        }

        public Builder quoteChar(char quoteChar) {
            this.quoteChar = singleByte("quoteChar", quoteChar);
            return this;
        }

        public Builder quoting(boolean quoting) {
            this.quoting = quoting;
            return this;
        }

        public Builder commentChar(char commentChar) {
            this.commentChar = singleByte("commentChar", commentChar);
            return this;
        }

        public Builder skipBlankLines(boolean skipBlankLines) {
            this.skipBlankLines = skipBlankLines;
            return this;
        }

        public Builder header(HeaderSpec header) {
            if (header == null) {
                throw new IllegalArgumentException("Header spec cannot be null");
            }
            this.header = header;
            return this;
        }

        /**
         * Skip the given number of rows at the start of the input.
         */
        public Builder skipRows(int skipRows) {
            if (skipRows < 0) {
                throw new IllegalArgumentException("skipRows cannot be negative: " + skipRows);
            }
            this.skipRows = skipRows;
            return this;
        }

        /**
         * Skip the rows with the given 0-based indices.
         */
        public Builder skipRows(Set<Integer> rowIndices) {
            for (Integer index : rowIndices) {
                if (index == null || index < 0) {
                    throw new IllegalArgumentException("Skipped row index must be non-negative: " + index);
                }
            }
            this.skipRowIndices = new LinkedHashSet<>(rowIndices);
            return this;
        }

        /**
         * Drop the given number of data rows at the end of the input.
         */
        public Builder skipFooter(int skipFooter) {
            if (skipFooter < 0) {
                throw new IllegalArgumentException("skipFooter cannot be negative: " + skipFooter);
            }
            this.skipFooter = skipFooter;
            return this;
        }

        /**
         * Read at most the given number of data rows.
         */
        public Builder nrows(long nrows) {
            if (nrows < 0) {
                throw new IllegalArgumentException("nrows cannot be negative: " + nrows);
            }
            this.nrows = nrows;
            return this;
        }

        public Builder names(List<String> names) {
            this.names = names != null ? new ArrayList<>(names) : null;
            return this;
        }

        /**
         * Column types by position. May be shorter than the number of columns; the
         * remaining types are inferred. Null entries are inferred as well.
         */
        public Builder dtypes(List<DType> dtypes) {
            this.dtypeList = dtypes != null ? new ArrayList<>(dtypes) : null;
            this.dtypeMap = null;
            return this;
        }

        /**
         * Column types by column name; columns not in the map are inferred.
         */
        public Builder dtypes(Map<String, DType> dtypes) {
            this.dtypeMap = dtypes != null ? new LinkedHashMap<>(dtypes) : null;
            this.dtypeList = null;
            return this;
        }

        public Builder decimal(char decimal) {
            this.decimal = singleByte("decimal", decimal);
            return this;
        }

        public Builder thousands(char thousands) {
            this.thousands = singleByte("thousands", thousands);
            return this;
        }

        public Builder trueValues(Set<String> trueValues) {
            this.trueValues = new LinkedHashSet<>(trueValues);
            return this;
        }

        public Builder falseValues(Set<String> falseValues) {
            this.falseValues = new LinkedHashSet<>(falseValues);
            return this;
        }

        public Builder naValues(Set<String> naValues) {
            this.naValues = new LinkedHashSet<>(naValues);
            return this;
        }

        public Builder keepDefaultNa(boolean keepDefaultNa) {
            this.keepDefaultNa = keepDefaultNa;
            return this;
        }

        public Builder naFilter(boolean naFilter) {
            this.naFilter = naFilter;
            return this;
        }

        public Builder dayFirst(boolean dayFirst) {
            this.dayFirst = dayFirst;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder indexColumn(IndexColumn indexColumn) {
            this.indexColumn = indexColumn != null ? indexColumn : IndexColumn.none();
            return this;
        }

        public Builder useColumns(ColumnSelection useColumns) {
            this.useColumns = useColumns != null ? useColumns : ColumnSelection.all();
            return this;
        }

        public Builder byteRange(ByteRange byteRange) {
            this.byteRange = byteRange;
            return this;
        }

        /**
         * Number of rows looked at when detecting the column count or the delimiter.
         */
        public Builder sampleRows(int sampleRows) {
            if (sampleRows <= 0) {
                throw new IllegalArgumentException("sampleRows must be positive: " + sampleRows);
            }
            this.sampleRows = sampleRows;
            return this;
        }

        /**
         * Validates the options and creates the immutable {@link CsvOptions}.
         *
         * @throws ConflictingOptionsException if mutually exclusive options are set
         */
        public CsvOptions build() {
            if (delimWhitespace && delimiterSet) {
                throw new ConflictingOptionsException("delimWhitespace", "delimiter",
                        "whitespace delimiting replaces the delimiter character");
            }
            if (sniffDelimiter && (delimiterSet || delimWhitespace)) {
                throw new ConflictingOptionsException("sniffDelimiter", delimWhitespace ? "delimWhitespace" : "delimiter",
                        "the delimiter is either detected or given");
            }
            if (skipFooter > 0 && nrows != NO_LIMIT) {
                throw new ConflictingOptionsException("skipFooter", "nrows",
                        "dropping footer rows needs a full scan while nrows stops early");
            }
            if (skipFooter > 0 && byteRange != null) {
                throw new ConflictingOptionsException("skipFooter", "byteRange",
                        "a byte range does not see the end of the input");
            }
            if (thousands == decimal) {
                throw new ConflictingOptionsException("decimal", "thousands",
                        "both use '" + (char) decimal + "'");
            }
            if (quoting && !delimWhitespace && quoteChar == delimiter) {
                throw new ConflictingOptionsException("quoteChar", "delimiter",
                        "both use '" + (char) delimiter + "'");
            }
            if (names != null) {
                for (String name : names) {
                    if (name == null) {
                        throw new IllegalArgumentException("Column names cannot contain null");
                    }
                }
            }
            if (dtypeMap != null) {
                for (Map.Entry<String, DType> entry : dtypeMap.entrySet()) {
                    if (entry.getKey() == null || entry.getValue() == null) {
                        throw new IllegalArgumentException("Types by name cannot contain null keys or values");
                    }
                }
            }
            return new CsvOptions(this);
        }

        private static byte singleByte(String option, char c) {
            if (c == '\n' || c == '\r' || c > 0x7f) {
                throw new IllegalArgumentException("Option '" + option + "' must be a single ASCII character other than a line break: '" + c + "'");
            }
            return (byte) c;
        }
    }
}

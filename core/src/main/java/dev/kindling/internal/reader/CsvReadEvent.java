/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted for each read of a CSV input or of one byte range of it.
 */
@Name("dev.kindling.CsvRead")
@Label("CSV Read")
@Category({"Kindling", "Parsing"})
@Description("Tokenizing and converting a CSV input or byte range into a table")
public class CsvReadEvent extends Event {

    @Label("Source")
    @Description("File path or description of the input")
    public String source;

    @Label("Range Offset")
    @Description("Offset of the byte range, 0 for full reads")
    public long rangeOffset;

    @Label("Bytes Scanned")
    @Description("Bytes between the first and the last row read")
    @DataAmount
    public long bytesScanned;

    @Label("Rows")
    @Description("Number of data rows in the resulting table")
    public long rows;

    @Label("Columns")
    @Description("Number of columns in the resulting table")
    public int columns;

    @Label("Delimiter")
    @Description("Field delimiter in effect")
    public String delimiter;
}

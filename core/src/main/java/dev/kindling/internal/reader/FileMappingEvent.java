/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when Kindling memory-maps a CSV file.
 * <p>
 * Memory-mapped I/O loads data through page faults rather than explicit read() calls,
 * so it does not show up as {@code jdk.FileRead} events.
 * </p>
 */
@Name("dev.kindling.FileMapping")
@Label("File Mapping")
@Category({"Kindling", "I/O"})
@Description("Memory-mapping of a CSV file for reading")
public class FileMappingEvent extends Event {

    @Label("File Path")
    @Description("Path to the file being mapped")
    public String path;

    @Label("Offset")
    @Description("Starting offset in the file (bytes)")
    public long offset;

    @Label("Size")
    @Description("Size of the mapped region (bytes)")
    public long size;
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.internal.reader;

import java.util.List;

import dev.kindling.internal.conversion.TypeInference;
import dev.kindling.internal.tokenizer.Dialect;
import dev.kindling.table.Table;

/**
 * Outcome of a {@link CsvReadTask}.
 *
 * @param table the parsed table
 * @param columnNames names of all input columns, including unselected ones
 * @param dialect the dialect used, with a detected delimiter resolved
 * @param inferences type inference of each table column; null where the type was given
 */
public record ReadResult(Table table, List<String> columnNames, Dialect dialect, TypeInference[] inferences) {
}

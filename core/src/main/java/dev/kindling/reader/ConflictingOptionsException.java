/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.kindling.reader;

/**
 * Options that cannot be used together were set. Raised when the options are built,
 * before any input is read.
 */
public class ConflictingOptionsException extends IllegalArgumentException {

    public ConflictingOptionsException(String first, String second, String reason) {
        super("Options '" + first + "' and '" + second + "' cannot be combined: " + reason);
    }
}

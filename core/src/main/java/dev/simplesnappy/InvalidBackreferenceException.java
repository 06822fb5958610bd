/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

/**
 * Thrown for a copy element whose offset is zero or points before the start of the output.
 */
public class InvalidBackreferenceException extends SnappyException {

    private final long offset;
    private final long outputLength;

    public InvalidBackreferenceException(long offset, long outputLength) {
        super(offset == 0
                ? "Copy offset must not be 0"
                : "Copy offset " + offset + " exceeds the " + outputLength + " bytes decompressed so far");
        this.offset = offset;
        this.outputLength = outputLength;
    }

    public long getOffset() {
        return offset;
    }

    public long getOutputLength() {
        return outputLength;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

/**
 * Thrown when a framed stream violates the container rules: a missing or bad stream identifier,
 * a reserved unskippable chunk, an oversized chunk or a checksum rejected under
 * {@link dev.simplesnappy.frame.ChecksumPolicy#STRICT}.
 */
public class CorruptFrameException extends SnappyException {

    public CorruptFrameException(String message) {
        super(message);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

/**
 * Thrown when the input ends before a field it declares has been fully read,
 * e.g. a literal shorter than its length prefix or a frame payload shorter than its header says.
 */
public class TruncatedInputException extends SnappyException {

    public TruncatedInputException(String message) {
        super(message);
    }
}

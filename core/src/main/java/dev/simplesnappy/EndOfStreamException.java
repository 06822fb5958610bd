/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

/**
 * Signals that the input ended cleanly where the next frame would have started.
 * <p>
 * This is the expected way for a framed stream to end and not a sign of corruption;
 * compare {@link TruncatedInputException}.
 * </p>
 */
public class EndOfStreamException extends SnappyException {

    public EndOfStreamException(String message) {
        super(message);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

/**
 * Thrown when the decompressed data does not have the length declared in the block preamble,
 * or when the declared length is more than the decoder accepts. In the latter case decoding
 * does not start and {@link #getActualLength()} is 0.
 */
public class LengthMismatchException extends SnappyException {

    private final long declaredLength;
    private final long actualLength;

    public LengthMismatchException(long declaredLength, long actualLength) {
        super("Snappy decompression size mismatch: expected " + declaredLength + ", got " + actualLength);
        this.declaredLength = declaredLength;
        this.actualLength = actualLength;
    }

    private LengthMismatchException(String message, long declaredLength) {
        super(message);
        this.declaredLength = declaredLength;
        this.actualLength = 0;
    }

    /**
     * The block declares more than {@code maxLength} bytes.
     *
     * @param declaredLength the declared length, as an unsigned value
     */
    public static LengthMismatchException exceedingLimit(long declaredLength, long maxLength) {
        return new LengthMismatchException("Declared uncompressed length " + Long.toUnsignedString(declaredLength)
                + " exceeds the maximum of " + maxLength + " bytes", declaredLength);
    }

    public long getDeclaredLength() {
        return declaredLength;
    }

    public long getActualLength() {
        return actualLength;
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.block;

import java.io.IOException;
import java.util.Arrays;

import dev.simplesnappy.InvalidBackreferenceException;
import dev.simplesnappy.TruncatedInputException;
import dev.simplesnappy.internal.io.PrimitiveReader;

/**
 * Append-only buffer receiving the decompressed bytes of one block.
 * <p>
 * Bytes are never modified once written; back-references only read them. At most the length
 * declared in the block preamble is ever stored. Once an element would take the output beyond
 * it, the buffer stops storing and only keeps counting: literal bytes are still consumed and
 * copy offsets are still checked against the counted length, so the block is validated to its
 * end and the length mismatch is left to the caller's final check.
 * </p>
 */
class OutputBuffer {

    private static final int MAX_INITIAL_CAPACITY = 1 << 20;

    // Literals are read in slices of this size so a bogus length cannot force a huge allocation
    private static final int LITERAL_READ_SIZE = 1 << 16;

    private final int limit;
    private byte[] buffer;
    private long size;
    // Bytes held in buffer; equals size until the first overshoot
    private int stored;
    private boolean overflowed;

    OutputBuffer(int limit) {
        this.limit = limit;
        this.buffer = new byte[Math.min(limit, MAX_INITIAL_CAPACITY)];
    }

    /**
     * Number of bytes produced so far, including any produced beyond the declared length.
     */
    long size() {
        return size;
    }

    /**
     * Append {@code length} bytes read verbatim from {@code input}.
     */
    void appendLiteral(PrimitiveReader input, long length) throws IOException {
        boolean store = fits(length);
        byte[] scratch = store ? null : new byte[(int) Math.min(length, LITERAL_READ_SIZE)];

        long remaining = length;
        while (remaining > 0) {
            int sliceLength = (int) Math.min(remaining, LITERAL_READ_SIZE);
            int read;
            if (store) {
                ensureCapacity(stored + sliceLength);
                read = input.read(buffer, stored, sliceLength);
                stored += read;
            }
            else {
                read = input.read(scratch, 0, sliceLength);
            }
            size += read;
            remaining -= read;
            if (read < sliceLength) {
                throw new TruncatedInputException("Unexpected EOF at input offset " + input.position()
                        + ": literal of " + length + " bytes is missing its last " + remaining + " bytes");
            }
        }
    }

    /**
     * Append {@code length} bytes starting {@code offset} bytes before the current end.
     * <p>
     * If {@code length > offset} the source range runs into the bytes being written, and the
     * result is the same as copying one byte at a time: the {@code offset} bytes at the source
     * position repeat until {@code length} bytes have been produced.
     * </p>
     */
    void copy(long offset, int length) throws IOException {
        if (offset == 0 || offset > size) {
            throw new InvalidBackreferenceException(offset, size);
        }
        if (!fits(length)) {
            size += length;
            return;
        }

        int start = stored;
        ensureCapacity(start + length);

        int source = start - (int) offset;
        int end = start + length;

        if (offset >= length) {
            System.arraycopy(buffer, source, buffer, start, length);
        }
        else {
            // [source, target) always holds a whole number of periods, so copying it
            // to target continues the pattern; each pass doubles the copied span
            int target = start;
            while (target < end) {
                int chunk = Math.min(end - target, target - source);
                System.arraycopy(buffer, source, buffer, target, chunk);
                target += chunk;
            }
        }
        size = end;
        stored = end;
    }

    /**
     * The stored bytes. Only complete if the output never went beyond the declared length.
     */
    byte[] toByteArray() {
        return stored == buffer.length ? buffer : Arrays.copyOf(buffer, stored);
    }

    // Once false, stays false: nothing is stored after the first overshoot
    private boolean fits(long length) {
        if (!overflowed && length > limit - size) {
            overflowed = true;
        }
        return !overflowed;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            int newCapacity = (int) Math.min(limit, Math.max(required, 2L * buffer.length));
            buffer = Arrays.copyOf(buffer, newCapacity);
        }
    }
}

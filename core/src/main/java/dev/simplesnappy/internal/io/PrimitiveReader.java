/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.io;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

import dev.simplesnappy.TruncatedInputException;

/**
 * Reads single bytes and fixed-width little-endian unsigned integers from an {@link InputStream},
 * keeping track of the number of bytes consumed.
 * <p>
 * End of input is reported differently depending on the read: {@link #readByte()} returns
 * {@code -1}, as running out of data between two elements is how a Snappy block ends, while all
 * fixed-width reads fail with {@link TruncatedInputException} since a partially present field
 * can only mean corrupt input.
 * </p>
 * <p>
 * The reader does no buffering of its own; wrap slow streams in a
 * {@link java.io.BufferedInputStream} before handing them in.
 * </p>
 */
public class PrimitiveReader {

    private final InputStream input;
    private long position;

    public PrimitiveReader(InputStream input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    /**
     * Number of bytes consumed from the underlying stream so far.
     */
    public long position() {
        return position;
    }

    /**
     * Read a single unsigned byte.
     *
     * @return the byte value (0-255), or -1 if the stream is exhausted
     */
    public int readByte() throws IOException {
        int b = input.read();
        if (b != -1) {
            position++;
        }
        return b;
    }

    /**
     * Read a single unsigned byte that is required to be present.
     */
    public int readUInt8() throws IOException {
        int b = readByte();
        if (b == -1) {
            throw truncated(1, 0);
        }
        return b;
    }

    public int readUInt16() throws IOException {
        byte[] bytes = readFully(2);
        return (bytes[0] & 0xFF)
                | (bytes[1] & 0xFF) << 8;
    }

    /**
     * Read a 24-bit little-endian unsigned integer, zero-extended to 32 bits.
     */
    public int readUInt24() throws IOException {
        byte[] bytes = readFully(3);
        return (bytes[0] & 0xFF)
                | (bytes[1] & 0xFF) << 8
                | (bytes[2] & 0xFF) << 16;
    }

    /**
     * Read a 32-bit little-endian unsigned integer. Returned as {@code long} so values
     * of 2^31 and above stay positive.
     */
    public long readUInt32() throws IOException {
        byte[] bytes = readFully(4);
        return (bytes[0] & 0xFFL)
                | (bytes[1] & 0xFFL) << 8
                | (bytes[2] & 0xFFL) << 16
                | (bytes[3] & 0xFFL) << 24;
    }

    /**
     * Read exactly {@code length} bytes.
     *
     * @throws TruncatedInputException if the stream ends before {@code length} bytes were read
     */
    public byte[] readFully(int length) throws IOException {
        byte[] bytes = input.readNBytes(length);
        position += bytes.length;
        if (bytes.length < length) {
            throw truncated(length, bytes.length);
        }
        return bytes;
    }

    /**
     * Read up to {@code length} bytes into {@code target}, blocking until either all of them
     * have arrived or the stream is exhausted.
     *
     * @return the number of bytes read, less than {@code length} only at end of stream
     */
    public int read(byte[] target, int offset, int length) throws IOException {
        int read = input.readNBytes(target, offset, length);
        position += read;
        return read;
    }

    private TruncatedInputException truncated(int required, int available) {
        return new TruncatedInputException("Unexpected EOF at input offset " + position + ": needed "
                + required + " bytes, got " + available);
    }
}

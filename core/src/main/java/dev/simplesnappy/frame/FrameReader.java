/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.frame;

import java.io.IOException;
import java.io.InputStream;

import dev.simplesnappy.EndOfStreamException;
import dev.simplesnappy.TruncatedInputException;
import dev.simplesnappy.internal.io.PrimitiveReader;

/**
 * Splits a Snappy framed stream into its chunks.
 * <p>
 * Each chunk is a one byte identifier, a 24-bit little-endian payload length and the payload.
 * This class only does the splitting: checksums, decompression and the rules on chunk order
 * are left to the caller (see {@link FramedSnappyInputStream}).
 * </p>
 */
public class FrameReader {

    public static final int HEADER_SIZE = 4;

    private final PrimitiveReader input;

    public FrameReader(InputStream input) {
        this.input = new PrimitiveReader(input);
    }

    /**
     * Read a single frame from {@code input}.
     *
     * @see #readFrame()
     */
    public static Frame readFrame(InputStream input) throws IOException {
        return new FrameReader(input).readFrame();
    }

    /**
     * Read the next frame.
     *
     * @throws EndOfStreamException if the input is exhausted before the first header byte
     * @throws TruncatedInputException if the input ends inside the header or the payload
     */
    public Frame readFrame() throws IOException {
        int id = input.readByte();
        if (id == -1) {
            throw new EndOfStreamException("No more frames at input offset " + input.position());
        }
        int length = input.readUInt24();
        byte[] payload = input.readFully(length);
        return new Frame(id, payload);
    }

    /**
     * Number of bytes consumed from the input so far.
     */
    public long position() {
        return input.position();
    }
}

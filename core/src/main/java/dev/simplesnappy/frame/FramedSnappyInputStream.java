/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.frame;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

import dev.simplesnappy.CorruptFrameException;
import dev.simplesnappy.EndOfStreamException;
import dev.simplesnappy.checksum.Crc32c;
import dev.simplesnappy.internal.block.BlockDecoder;
import dev.simplesnappy.internal.io.PrimitiveReader;

/**
 * Decompresses a Snappy framed stream.
 *
 * <pre>{@code
 * try (InputStream in = new FramedSnappyInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
 *     byte[] data = in.readAllBytes();
 * }
 * }</pre>
 *
 * <p>
 * The stream must start with a stream identifier chunk. Compressed and uncompressed data chunks
 * are handed out in order; padding and reserved skippable chunks are skipped, while reserved
 * unskippable chunks fail the stream. Further stream identifiers, as found in concatenated
 * streams, are checked and otherwise ignored. Checksums are handled according to the
 * {@link ChecksumPolicy} given at construction.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public class FramedSnappyInputStream extends InputStream {

    private static final System.Logger LOG = System.getLogger(FramedSnappyInputStream.class.getName());

    /**
     * Payload of the stream identifier chunk: "sNaPpY".
     */
    public static final byte[] STREAM_IDENTIFIER = { 0x73, 0x4E, 0x61, 0x50, 0x70, 0x59 };

    /**
     * Maximum number of uncompressed bytes a single data chunk may carry.
     */
    public static final int MAX_CHUNK_DATA_LENGTH = 65536;

    private static final byte[] EMPTY = new byte[0];

    private final InputStream input;
    private final FrameReader frameReader;
    private final ChecksumPolicy checksumPolicy;

    private byte[] buffer = EMPTY;
    private int bufferPosition;
    private boolean started;
    private boolean finished;
    private boolean closed;

    /**
     * Create a stream using the checksum policy configured via {@value ChecksumPolicy#PROPERTY}.
     */
    public FramedSnappyInputStream(InputStream input) {
        this(input, ChecksumPolicy.fromSystemProperty());
    }

    public FramedSnappyInputStream(InputStream input, ChecksumPolicy checksumPolicy) {
        this.input = Objects.requireNonNull(input, "input");
        this.frameReader = new FrameReader(input);
        this.checksumPolicy = Objects.requireNonNull(checksumPolicy, "checksumPolicy");
    }

    public ChecksumPolicy getChecksumPolicy() {
        return checksumPolicy;
    }

    @Override
    public int read() throws IOException {
        if (!fillBuffer()) {
            return -1;
        }
        return buffer[bufferPosition++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!fillBuffer()) {
            return -1;
        }

        int count = Math.min(len, buffer.length - bufferPosition);
        System.arraycopy(buffer, bufferPosition, b, off, count);
        bufferPosition += count;
        return count;
    }

    @Override
    public int available() throws IOException {
        ensureOpen();
        return buffer.length - bufferPosition;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            buffer = EMPTY;
            bufferPosition = 0;
            input.close();
        }
    }

    /**
     * Make sure there is at least one unread byte in the buffer, reading chunks as needed.
     *
     * @return false if the end of the stream has been reached
     */
    private boolean fillBuffer() throws IOException {
        ensureOpen();
        while (bufferPosition == buffer.length) {
            if (finished) {
                return false;
            }

            Frame frame;
            try {
                frame = frameReader.readFrame();
            }
            catch (EndOfStreamException e) {
                finished = true;
                return false;
            }
            buffer = decodeChunk(frame);
            bufferPosition = 0;
        }
        return true;
    }

    private byte[] decodeChunk(Frame frame) throws IOException {
        ChunkType chunkType = frame.chunkType();
        if (!started && chunkType != ChunkType.STREAM_IDENTIFIER) {
            throw new CorruptFrameException("Expected stream identifier chunk at the start of the stream, got "
                    + frame);
        }

        switch (chunkType) {
            case STREAM_IDENTIFIER -> {
                if (!Arrays.equals(frame.payload(), STREAM_IDENTIFIER)) {
                    throw new CorruptFrameException("Invalid stream identifier chunk at input offset "
                            + chunkOffset(frame));
                }
                started = true;
                return EMPTY;
            }
            case COMPRESSED_DATA -> {
                int checksum = readChecksum(frame);
                PrimitiveReader block = new PrimitiveReader(new ByteArrayInputStream(frame.payload(),
                        Frame.CHECKSUM_SIZE, frame.length() - Frame.CHECKSUM_SIZE));
                byte[] data = BlockDecoder.decompress(block, MAX_CHUNK_DATA_LENGTH);
                verifyChecksum(checksum, data, frame);
                return data;
            }
            case UNCOMPRESSED_DATA -> {
                int checksum = readChecksum(frame);
                if (frame.length() - Frame.CHECKSUM_SIZE > MAX_CHUNK_DATA_LENGTH) {
                    throw new CorruptFrameException("Uncompressed chunk at input offset " + chunkOffset(frame)
                            + " carries " + (frame.length() - Frame.CHECKSUM_SIZE) + " bytes, more than the maximum of "
                            + MAX_CHUNK_DATA_LENGTH);
                }
                byte[] data = frame.data();
                verifyChecksum(checksum, data, frame);
                return data;
            }
            case RESERVED_UNSKIPPABLE -> throw new CorruptFrameException("Unsupported unskippable chunk type 0x"
                    + Integer.toHexString(frame.id()) + " at input offset " + chunkOffset(frame));
            default -> {
                // padding or reserved skippable
                LOG.log(System.Logger.Level.DEBUG, "Skipping {0} chunk of {1} bytes", chunkType, frame.length());
                return EMPTY;
            }
        }
    }

    private int readChecksum(Frame frame) throws CorruptFrameException {
        if (frame.length() < Frame.CHECKSUM_SIZE) {
            throw new CorruptFrameException(frame.chunkType() + " chunk at input offset " + chunkOffset(frame)
                    + " is too short to hold a checksum: " + frame.length() + " bytes");
        }
        return frame.maskedChecksum();
    }

    private void verifyChecksum(int expected, byte[] data, Frame frame) throws CorruptFrameException {
        if (checksumPolicy == ChecksumPolicy.SKIP) {
            return;
        }

        int actual = Crc32c.mask(Crc32c.crc32c(data));
        if (actual == expected) {
            return;
        }

        String message = "Checksum mismatch in " + frame.chunkType() + " chunk at input offset " + chunkOffset(frame)
                + ": expected 0x" + Integer.toHexString(expected) + ", got 0x" + Integer.toHexString(actual);
        if (checksumPolicy == ChecksumPolicy.STRICT) {
            throw new CorruptFrameException(message);
        }
        LOG.log(System.Logger.Level.WARNING, message);
    }

    // Only valid for the frame read last
    private long chunkOffset(Frame frame) {
        return frameReader.position() - FrameReader.HEADER_SIZE - frame.length();
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}

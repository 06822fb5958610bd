/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import dev.simplesnappy.checksum.Crc32c;
import dev.simplesnappy.frame.ChecksumPolicy;
import dev.simplesnappy.frame.Frame;
import dev.simplesnappy.frame.FrameReader;
import dev.simplesnappy.frame.FramedSnappyInputStream;
import dev.simplesnappy.internal.block.BlockDecoder;

/**
 * Entry point for decoding Snappy data.
 *
 * <p>Raw blocks, as embedded by many file formats:</p>
 * <pre>{@code
 * byte[] data = SimpleSnappy.decompress(block);
 * }</pre>
 *
 * <p>Framed streams ({@code .sz} files, {@code x-snappy-framed}):</p>
 * <pre>{@code
 * try (InputStream in = SimpleSnappy.openFramed(Files.newInputStream(path))) {
 *     in.transferTo(out);
 * }
 * }</pre>
 *
 * <p>For custom handling of framed streams, {@link #readFrame(InputStream)} and
 * {@link #checkMaskedCrc(int, byte[])} give access to the individual chunks and checksums.</p>
 */
public final class SimpleSnappy {

    private SimpleSnappy() {
    }

    /**
     * Decompress a raw Snappy block.
     *
     * @param input the block; everything up to the end of the stream is taken to be part of it
     * @return the uncompressed data
     * @throws TruncatedInputException if the input ends inside an element
     * @throws InvalidBackreferenceException if a copy refers to data not yet produced
     * @throws LengthMismatchException if the data does not have the declared length
     */
    public static byte[] decompress(InputStream input) throws IOException {
        return BlockDecoder.decompress(input);
    }

    /**
     * Decompress a raw Snappy block held in memory.
     *
     * @see #decompress(InputStream)
     */
    public static byte[] decompress(byte[] block) throws IOException {
        return BlockDecoder.decompress(new ByteArrayInputStream(block));
    }

    /**
     * Read the next chunk of a framed stream, without interpreting it.
     *
     * @throws EndOfStreamException if the input ends cleanly before the chunk
     * @throws TruncatedInputException if the input ends inside the chunk
     */
    public static Frame readFrame(InputStream input) throws IOException {
        return FrameReader.readFrame(input);
    }

    /**
     * Compute the CRC32C of {@code data}.
     */
    public static int crc32c(byte[] data) {
        return Crc32c.crc32c(data);
    }

    /**
     * Whether {@code claimedCrc} is the masked CRC32C of {@code data}, as stored in the data
     * chunks of framed streams.
     */
    public static boolean checkMaskedCrc(int claimedCrc, byte[] data) {
        return Crc32c.checkMaskedCrc(claimedCrc, data);
    }

    /**
     * Open a framed stream, handling checksums as configured via {@value ChecksumPolicy#PROPERTY}.
     */
    public static FramedSnappyInputStream openFramed(InputStream input) {
        return new FramedSnappyInputStream(input);
    }

    /**
     * Open a framed stream with the given checksum policy.
     */
    public static FramedSnappyInputStream openFramed(InputStream input, ChecksumPolicy checksumPolicy) {
        return new FramedSnappyInputStream(input, checksumPolicy);
    }

    /**
     * Decompress a complete framed stream held in memory.
     *
     * @throws CorruptFrameException if the stream violates the framing format or a checksum does not match
     */
    public static byte[] decompressFramed(byte[] framed) throws IOException {
        try (InputStream in = openFramed(new ByteArrayInputStream(framed))) {
            return in.readAllBytes();
        }
    }
}

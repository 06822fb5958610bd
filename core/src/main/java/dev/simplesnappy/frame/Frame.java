/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.frame;

import java.util.Arrays;

/**
 * One chunk of a Snappy framed stream.
 * <p>
 * Equality is by content. {@code payload} is held as passed in, not copied.
 * </p>
 *
 * @param id the chunk identifier byte (0-255)
 * @param payload the chunk contents, exactly as many bytes as the chunk header declared
 */
public record Frame(int id, byte[] payload) {

    /**
     * Size of the masked CRC32C that leads the payload of data chunks.
     */
    public static final int CHECKSUM_SIZE = 4;

    public ChunkType chunkType() {
        return ChunkType.of(id);
    }

    public int length() {
        return payload.length;
    }

    /**
     * The masked CRC32C stored little-endian in the first four payload bytes of a data chunk.
     *
     * @throws IllegalStateException if the payload is too short to hold a checksum
     */
    public int maskedChecksum() {
        requireChecksum();
        return (payload[0] & 0xFF)
                | (payload[1] & 0xFF) << 8
                | (payload[2] & 0xFF) << 16
                | (payload[3] & 0xFF) << 24;
    }

    /**
     * The payload of a data chunk without its leading checksum.
     *
     * @throws IllegalStateException if the payload is too short to hold a checksum
     */
    public byte[] data() {
        requireChecksum();
        return Arrays.copyOfRange(payload, CHECKSUM_SIZE, payload.length);
    }

    private void requireChecksum() {
        if (payload.length < CHECKSUM_SIZE) {
            throw new IllegalStateException("Payload of " + payload.length + " bytes holds no checksum");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Frame other && id == other.id && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * id + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame[id=0x" + Integer.toHexString(id) + ", type=" + chunkType() + ", length=" + payload.length + "]";
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.frame;

/**
 * Kinds of chunks in a Snappy framed stream, keyed by the chunk's identifier byte.
 */
public enum ChunkType {
    /**
     * 0x00: masked CRC32C of the uncompressed data, followed by a raw Snappy block.
     */
    COMPRESSED_DATA,
    /**
     * 0x01: masked CRC32C of the data, followed by the data itself.
     */
    UNCOMPRESSED_DATA,
    /**
     * 0x02-0x7f: must not be skipped; a decoder that does not know them has to fail.
     */
    RESERVED_UNSKIPPABLE,
    /**
     * 0x80-0xfd: may be skipped.
     */
    RESERVED_SKIPPABLE,
    /**
     * 0xfe: filler, skipped.
     */
    PADDING,
    /**
     * 0xff: the six bytes "sNaPpY", starting every stream.
     */
    STREAM_IDENTIFIER;

    public static ChunkType of(int id) {
        return switch (id & 0xFF) {
            case 0x00 -> COMPRESSED_DATA;
            case 0x01 -> UNCOMPRESSED_DATA;
            case 0xFE -> PADDING;
            case 0xFF -> STREAM_IDENTIFIER;
            default -> (id & 0x80) == 0 ? RESERVED_UNSKIPPABLE : RESERVED_SKIPPABLE;
        };
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.io;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalLong;

import dev.simplesnappy.TruncatedInputException;

/**
 * Reads unsigned little-endian base-128 varints: seven payload bits per byte, lowest group
 * first, with the high bit set on every byte but the last.
 */
public final class VarintReader {

    /**
     * Upper bound on the number of bytes read for one varint. Reading stops after this many
     * bytes even if the last one still has its continuation bit set.
     */
    public static final int MAX_VARINT_BYTES = 10;

    private VarintReader() {
    }

    /**
     * Read a varint.
     *
     * @return the varint, or empty if the stream was already exhausted
     * @throws TruncatedInputException if the stream ends in the middle of the varint
     */
    public static Optional<Varint> read(PrimitiveReader input) throws IOException {
        byte[] raw = new byte[MAX_VARINT_BYTES];
        int count = 0;
        long value = 0;

        while (count < MAX_VARINT_BYTES) {
            int b = input.readByte();
            if (b == -1) {
                if (count == 0) {
                    return Optional.empty();
                }
                throw new TruncatedInputException("Unexpected EOF at input offset " + input.position()
                        + " while reading varint");
            }
            raw[count] = (byte) b;
            value |= (long) (b & 0x7F) << (7 * count);
            count++;
            if ((b & 0x80) == 0) {
                break;
            }
        }
        return Optional.of(new Varint(value, Arrays.copyOf(raw, count)));
    }

    /**
     * Read a varint, returning only its value.
     *
     * @return the value, or empty if the stream was already exhausted
     * @throws TruncatedInputException if the stream ends in the middle of the varint
     */
    public static OptionalLong readValue(PrimitiveReader input) throws IOException {
        Optional<Varint> varint = read(input);
        return varint.isPresent() ? OptionalLong.of(varint.get().value()) : OptionalLong.empty();
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.io;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * An unsigned base-128 varint together with the bytes it was decoded from.
 * <p>
 * Equality is by content. {@code rawBytes} is held as passed in, not copied.
 * </p>
 *
 * @param value the decoded value
 * @param rawBytes the encoded bytes, in stream order
 */
public record Varint(long value, byte[] rawBytes) {

    @Override
    public boolean equals(Object o) {
        return o instanceof Varint other && value == other.value && Arrays.equals(rawBytes, other.rawBytes);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(value) + Arrays.hashCode(rawBytes);
    }

    @Override
    public String toString() {
        return "Varint[value=" + Long.toUnsignedString(value) + ", rawBytes=" + HexFormat.of().formatHex(rawBytes) + "]";
    }
}

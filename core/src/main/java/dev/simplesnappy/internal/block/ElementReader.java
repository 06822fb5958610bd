/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.block;

import java.io.IOException;

import dev.simplesnappy.internal.io.PrimitiveReader;

/**
 * Turns a tag byte, plus the length or offset bytes that follow it, into an {@link Element}.
 * <p>
 * Tag byte layout (bits 7..0):
 * </p>
 * <pre>
 * literal:    LLLLLL 00   L = length - 1 (0-59), or 60-63 for a 1-4 byte length after the tag
 * copy 1:     OOO LLL 01  L = length - 4, O = offset bits 10-8, offset bits 7-0 follow
 * copy 2:     LLLLLL 10   L = length - 1, 16-bit offset follows
 * copy 4:     LLLLLL 11   L = length - 1, 32-bit offset follows
 * </pre>
 */
public final class ElementReader {

    private static final int MAX_EMBEDDED_LITERAL_LENGTH = 59;

    private ElementReader() {
    }

    public static Element read(int tag, PrimitiveReader input) throws IOException {
        ElementType type = ElementType.of(tag);
        return switch (type) {
            case LITERAL -> new Element.Literal(readLiteralLength(tag, input));
            case COPY_1_BYTE_OFFSET -> new Element.Copy(type, ((tag >> 2) & 0x07) + 4,
                    ((tag & 0xE0) << 3) | input.readUInt8());
            case COPY_2_BYTE_OFFSET -> new Element.Copy(type, ((tag >> 2) & 0x3F) + 1, input.readUInt16());
            case COPY_4_BYTE_OFFSET -> new Element.Copy(type, ((tag >> 2) & 0x3F) + 1, input.readUInt32());
        };
    }

    private static long readLiteralLength(int tag, PrimitiveReader input) throws IOException {
        int selector = (tag >> 2) & 0x3F;
        if (selector <= MAX_EMBEDDED_LITERAL_LENGTH) {
            return selector + 1;
        }

        long length = switch (selector) {
            case 60 -> input.readUInt8();
            case 61 -> input.readUInt16();
            case 62 -> input.readUInt24();
            default -> input.readUInt32();
        };
        return length + 1;
    }
}

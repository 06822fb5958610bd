/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.block;

/**
 * One decoded element of a Snappy block: the tag byte and whatever length or offset
 * fields follow it, but not the literal bytes themselves.
 */
public sealed interface Element permits Element.Literal, Element.Copy {

    ElementType type();

    /**
     * A run of {@code length} bytes stored verbatim right after the element header.
     */
    record Literal(long length) implements Element {

        @Override
        public ElementType type() {
            return ElementType.LITERAL;
        }
    }

    /**
     * A back-reference repeating {@code length} bytes that start {@code offset} bytes
     * before the current end of the output. {@code length} may exceed {@code offset}.
     */
    record Copy(ElementType type, int length, long offset) implements Element {
    }
}

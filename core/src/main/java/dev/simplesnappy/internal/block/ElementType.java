/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.block;

/**
 * Kind of element in a Snappy block, selected by the two low bits of its tag byte.
 */
public enum ElementType {
    LITERAL,            // 0
    COPY_1_BYTE_OFFSET, // 1
    COPY_2_BYTE_OFFSET, // 2
    COPY_4_BYTE_OFFSET; // 3

    // Indexed by tag & 0x03
    private static final ElementType[] BY_TAG = values();

    public static ElementType of(int tag) {
        return BY_TAG[tag & 0x03];
    }
}

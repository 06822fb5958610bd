/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import org.junit.jupiter.api.Test;

import dev.simplesnappy.TruncatedInputException;

import static dev.simplesnappy.internal.io.PrimitiveReaders.reader;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrimitiveReaderTest {

    @Test
    void readsLittleEndianUnsignedIntegers() throws IOException {
        PrimitiveReader reader = reader(
                0x34, 0x12,                         // u16 0x1234
                0x56, 0x34, 0x12,                   // u24 0x123456
                0xFF, 0xFF, 0xFF, 0xFF,             // u32 0xFFFFFFFF
                0x80);                              // u8 0x80

        assertThat(reader.readUInt16()).isEqualTo(0x1234);
        assertThat(reader.readUInt24()).isEqualTo(0x123456);
        assertThat(reader.readUInt32()).isEqualTo(0xFFFFFFFFL);
        assertThat(reader.readUInt8()).isEqualTo(0x80);
        assertThat(reader.position()).isEqualTo(10);
    }

    @Test
    void readByteSignalsEndOfStreamWithoutThrowing() throws IOException {
        PrimitiveReader reader = reader(0xFE);

        assertThat(reader.readByte()).isEqualTo(0xFE);
        assertThat(reader.readByte()).isEqualTo(-1);
        assertThat(reader.readByte()).isEqualTo(-1);
        assertThat(reader.position()).isEqualTo(1);
    }

    @Test
    void fixedWidthReadsFailOnShortInput() {
        assertThatThrownBy(() -> reader(0x01, 0x02, 0x03).readUInt32())
                .isInstanceOf(TruncatedInputException.class)
                .hasMessageContaining("needed 4 bytes, got 3");
        assertThatThrownBy(() -> reader(0x01).readUInt16())
                .isInstanceOf(TruncatedInputException.class);
        assertThatThrownBy(() -> reader().readUInt8())
                .isInstanceOf(TruncatedInputException.class);
    }

    @Test
    void readFullyReturnsExactlyTheRequestedBytes() throws IOException {
        PrimitiveReader reader = reader('A', 'B', 'C', 'D');

        assertThat(reader.readFully(3)).containsExactly('A', 'B', 'C');
        assertThat(reader.readFully(0)).isEmpty();
        assertThatThrownBy(() -> reader.readFully(2))
                .isInstanceOf(TruncatedInputException.class)
                .hasMessageContaining("input offset 4");
    }

    @Test
    void readReportsShortCountAtEndOfStream() throws IOException {
        PrimitiveReader reader = reader(1, 2);
        byte[] target = new byte[5];

        assertThat(reader.read(target, 1, 4)).isEqualTo(2);
        assertThat(target).containsExactly(0, 1, 2, 0, 0);
        assertThat(reader.position()).isEqualTo(2);
    }
}

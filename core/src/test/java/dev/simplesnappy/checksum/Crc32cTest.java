/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.checksum;

import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.zip.CRC32C;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Crc32cTest {

    @Test
    void checksumOfEmptyInputIsZero() {
        assertThat(Crc32c.crc32c(new byte[0])).isZero();
    }

    @Test
    void checksumOfStandardCheckString() {
        byte[] data = "123456789".getBytes(StandardCharsets.US_ASCII);

        assertThat(Crc32c.crc32c(data)).isEqualTo(0xE3069283);
    }

    @Test
    void matchesJdkImplementation() {
        Random random = new Random(1234);
        for (int length : new int[]{ 1, 3, 15, 64, 1000, 65536 }) {
            byte[] data = new byte[length];
            random.nextBytes(data);

            CRC32C expected = new CRC32C();
            expected.update(data);

            assertThat(Integer.toUnsignedLong(Crc32c.crc32c(data)))
                    .as("length %d", length)
                    .isEqualTo(expected.getValue());
        }
    }

    @Test
    void xorValueIsAppliedToFinalRegister() {
        byte[] data = "snappy".getBytes(StandardCharsets.US_ASCII);

        int standard = Crc32c.crc32c(data);

        assertThat(Crc32c.crc32c(data, 0)).isEqualTo(~standard);
        assertThat(Crc32c.crc32c(new byte[0], 0)).isEqualTo(0xFFFFFFFF);
    }

    @Test
    void checksumOfSlice() {
        byte[] data = "xx123456789yy".getBytes(StandardCharsets.US_ASCII);

        assertThat(Crc32c.crc32c(data, 2, 9, Crc32c.DEFAULT_XOR_VALUE)).isEqualTo(0xE3069283);
    }

    @Test
    void maskRotatesAndAddsConstant() {
        assertThat(Crc32c.mask(0)).isEqualTo(0xA282EAD8);
        for (int crc : new int[]{ 1, 0x8000, 0xE3069283, 0xFFFFFFFF, 0x12345678 }) {
            assertThat(Crc32c.mask(crc)).isEqualTo(Integer.rotateRight(crc, 15) + 0xA282EAD8);
        }
    }

    @Test
    void maskedChecksumMatchesOnlyExactData() {
        byte[] data = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.US_ASCII);
        int masked = Crc32c.mask(Crc32c.crc32c(data));

        assertThat(Crc32c.checkMaskedCrc(masked, data)).isTrue();
        assertThat(Crc32c.checkMaskedCrc(Crc32c.crc32c(data), data)).isFalse();

        // CRCs detect every single-bit error
        for (int bit = 0; bit < data.length * 8; bit++) {
            byte[] mutated = data.clone();
            mutated[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThat(Crc32c.checkMaskedCrc(masked, mutated)).as("bit %d flipped", bit).isFalse();
        }
    }

    @Test
    void maskedChecksumWithCustomXorValue() {
        byte[] data = { 1, 2, 3 };
        int masked = Crc32c.mask(Crc32c.crc32c(data, 0));

        assertThat(Crc32c.checkMaskedCrc(masked, data, 0)).isTrue();
        assertThat(Crc32c.checkMaskedCrc(masked, data)).isFalse();
    }
}

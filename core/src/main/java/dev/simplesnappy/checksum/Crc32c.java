/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.checksum;

/**
 * CRC32C (Castagnoli) checksums and the masking applied to them by the Snappy framing format.
 * <p>
 * The lookup table is computed once when the class is initialized and only read afterwards,
 * so all methods are safe to call concurrently.
 * </p>
 */
public final class Crc32c {

    /**
     * The Castagnoli polynomial in reversed bit order.
     */
    public static final int POLYNOMIAL = 0x82F63B78;

    /**
     * Value the running checksum is XOR-ed with at the end unless told otherwise.
     */
    public static final int DEFAULT_XOR_VALUE = 0xFFFFFFFF;

    private static final int MASK_DELTA = 0xA282EAD8;

    private static final int[] TABLE = createTable(POLYNOMIAL);

    private Crc32c() {
    }

    private static int[] createTable(int polynomial) {
        int[] table = new int[256];
        for (int i = 0; i < table.length; i++) {
            int crc = i;
            for (int bit = 0; bit < 8; bit++) {
                if ((crc & 1) != 0) {
                    crc = (crc >>> 1) ^ polynomial;
                }
                else {
                    crc >>>= 1;
                }
            }
            table[i] = crc;
        }
        return table;
    }

    public static int crc32c(byte[] data) {
        return crc32c(data, 0, data.length, DEFAULT_XOR_VALUE);
    }

    public static int crc32c(byte[] data, int xorValue) {
        return crc32c(data, 0, data.length, xorValue);
    }

    /**
     * Compute the CRC32C of {@code length} bytes of {@code data} starting at {@code offset}.
     *
     * @param xorValue value the final register is XOR-ed with; {@link #DEFAULT_XOR_VALUE} gives the standard CRC32C
     * @return the checksum as an unsigned 32-bit value held in an {@code int}
     */
    public static int crc32c(byte[] data, int offset, int length, int xorValue) {
        int crc = 0xFFFFFFFF;
        for (int i = offset; i < offset + length; i++) {
            crc = TABLE[(data[i] ^ crc) & 0xFF] ^ (crc >>> 8);
        }
        return crc ^ xorValue;
    }

    /**
     * Apply the Snappy checksum mask: rotate right by 15 bits, then add {@code 0xa282ead8}
     * with 32-bit wraparound.
     */
    public static int mask(int crc) {
        return ((crc >>> 15) | (crc << 17)) + MASK_DELTA;
    }

    /**
     * Whether {@code claimedCrc} is the masked CRC32C of {@code data}.
     */
    public static boolean checkMaskedCrc(int claimedCrc, byte[] data) {
        return checkMaskedCrc(claimedCrc, data, DEFAULT_XOR_VALUE);
    }

    public static boolean checkMaskedCrc(int claimedCrc, byte[] data, int xorValue) {
        return mask(crc32c(data, xorValue)) == claimedCrc;
    }
}

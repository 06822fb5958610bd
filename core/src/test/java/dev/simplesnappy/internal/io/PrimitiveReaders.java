/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.io;

import java.io.ByteArrayInputStream;

/**
 * Builds readers over literal byte values for tests.
 */
public final class PrimitiveReaders {

    private PrimitiveReaders() {
    }

    public static PrimitiveReader reader(int... bytes) {
        byte[] data = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            data[i] = (byte) bytes[i];
        }
        return new PrimitiveReader(new ByteArrayInputStream(data));
    }
}

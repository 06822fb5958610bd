/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy;

import java.io.IOException;

/**
 * Base type of all errors raised while decoding Snappy data.
 * <p>
 * Every subtype is unrecoverable for the decode call that raised it; no partial
 * output is ever handed out.
 * </p>
 */
public class SnappyException extends IOException {

    public SnappyException(String message) {
        super(message);
    }
}

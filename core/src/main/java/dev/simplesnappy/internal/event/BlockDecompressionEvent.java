/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.event;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;
import jdk.jfr.StackTrace;

/**
 * JFR event emitted when a raw Snappy block has been decompressed successfully.
 */
@Name("dev.simplesnappy.BlockDecompression")
@Label("Snappy Block Decompression")
@Category({"SimpleSnappy", "Decompression"})
@Description("Decompression of one raw Snappy block")
@StackTrace(false)
public class BlockDecompressionEvent extends Event {

    @Label("Compressed Size")
    @Description("Number of compressed bytes consumed, including the length preamble")
    @DataAmount
    public long compressedSize;

    @Label("Uncompressed Size")
    @Description("Number of bytes produced")
    @DataAmount
    public long uncompressedSize;
}

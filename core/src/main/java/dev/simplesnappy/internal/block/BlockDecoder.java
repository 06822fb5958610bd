/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.internal.block;

import java.io.IOException;
import java.io.InputStream;

import dev.simplesnappy.InvalidBackreferenceException;
import dev.simplesnappy.LengthMismatchException;
import dev.simplesnappy.TruncatedInputException;
import dev.simplesnappy.internal.event.BlockDecompressionEvent;
import dev.simplesnappy.internal.io.PrimitiveReader;
import dev.simplesnappy.internal.io.VarintReader;

/**
 * Decoder for raw (unframed) Snappy blocks.
 * <p>
 * A block is a varint holding the uncompressed length, followed by elements until the end of
 * the input. Each element either appends a literal run of bytes or copies bytes already
 * written to the output. The input must end exactly at an element boundary.
 * </p>
 * <p>
 * The decoder keeps no state between calls and may be used from any number of threads.
 * </p>
 */
public final class BlockDecoder {

    /**
     * Largest uncompressed length that fits into a Java array.
     */
    public static final int MAX_UNCOMPRESSED_LENGTH = Integer.MAX_VALUE - 8;

    private BlockDecoder() {
    }

    /**
     * Decompress the block making up the remainder of {@code input}.
     *
     * @param input the compressed block; read up to its end
     * @return the uncompressed data
     * @throws TruncatedInputException if the input ends inside a field or a literal
     * @throws InvalidBackreferenceException if a copy has offset 0 or reaches before the start of the output
     * @throws LengthMismatchException if the output length differs from the declared one, checked
     *         once the whole block has been read
     */
    public static byte[] decompress(InputStream input) throws IOException {
        return decompress(new PrimitiveReader(input), MAX_UNCOMPRESSED_LENGTH);
    }

    /**
     * Decompress the block making up the remainder of {@code input}, refusing blocks that
     * declare more than {@code maxUncompressedLength} bytes before decoding any element.
     *
     * @throws LengthMismatchException also if the declared length exceeds {@code maxUncompressedLength}
     */
    public static byte[] decompress(PrimitiveReader input, int maxUncompressedLength) throws IOException {
        BlockDecompressionEvent event = new BlockDecompressionEvent();
        event.begin();
        long startPosition = input.position();

        long declaredLength = VarintReader.readValue(input)
                .orElseThrow(() -> new TruncatedInputException("Missing uncompressed length at input offset "
                        + input.position()));
        if (declaredLength < 0 || declaredLength > maxUncompressedLength) {
            throw LengthMismatchException.exceedingLimit(declaredLength, maxUncompressedLength);
        }

        OutputBuffer output = new OutputBuffer((int) declaredLength);
        int tag;
        while ((tag = input.readByte()) != -1) {
            Element element = ElementReader.read(tag, input);
            if (element instanceof Element.Literal literal) {
                output.appendLiteral(input, literal.length());
            }
            else if (element instanceof Element.Copy copy) {
                output.copy(copy.offset(), copy.length());
            }
        }

        if (output.size() != declaredLength) {
            throw new LengthMismatchException(declaredLength, output.size());
        }

        event.compressedSize = input.position() - startPosition;
        event.uncompressedSize = declaredLength;
        event.commit();

        return output.toByteArray();
    }
}

/*
 * Varint.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of bluezoo-protobuf, a Protocol Buffers runtime for Java.
 *
 * bluezoo-protobuf is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * bluezoo-protobuf is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with bluezoo-protobuf.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.protobuf.wire;

import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.ResourceBundle;

import org.bluezoo.protobuf.MalformedVarintException;
import org.bluezoo.protobuf.TruncatedInputException;

/**
 * Base 128 varint encoding.
 *
 * <p>A varint stores an unsigned 64-bit value in groups of 7 bits, least
 * significant group first. Every byte except the last has its most
 * significant bit set. Java {@code long} values are treated as unsigned, so
 * negative values always take the full {@link #MAX_SIZE} bytes.
 *
 * <p>Signed types use ZigZag encoding on top of this, mapping
 * 0&rarr;0, -1&rarr;1, 1&rarr;2, -2&rarr;3 and so on.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://protobuf.dev/programming-guides/encoding/#varints">Varints</a>
 */
public final class Varint {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.protobuf.wire.L10N");

    /**
     * Maximum number of bytes in the encoding of a 64-bit value.
     */
    public static final int MAX_SIZE = 10;

    private Varint() {
    }

    /**
     * Encodes a value.
     *
     * @param value the value, treated as unsigned
     * @return the encoded bytes (1-10)
     */
    public static byte[] encode(long value) {
        byte[] data = new byte[size(value)];
        int i = 0;
        while ((value & ~0x7FL) != 0) {
            data[i++] = (byte) ((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        data[i] = (byte) value;
        return data;
    }

    /**
     * Encodes a value into the given buffer.
     *
     * @param value the value, treated as unsigned
     * @param buffer the buffer to write to, with at least {@link #size(long)}
     *        bytes remaining
     * @return the number of bytes written
     */
    public static int encode(long value, ByteBuffer buffer) {
        int count = 1;
        while ((value & ~0x7FL) != 0) {
            buffer.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
            count++;
        }
        buffer.put((byte) value);
        return count;
    }

    /**
     * Decodes a value from the buffer, advancing its position past the
     * encoded bytes.
     *
     * @param buffer the buffer to read from
     * @return the decoded value
     * @throws TruncatedInputException if the buffer ends before the final byte
     * @throws MalformedVarintException if no final byte appears within
     *         {@link #MAX_SIZE} bytes
     */
    public static long decode(ByteBuffer buffer)
            throws TruncatedInputException, MalformedVarintException {
        long result = 0;
        for (int i = 0; i < MAX_SIZE; i++) {
            if (!buffer.hasRemaining()) {
                throw new TruncatedInputException(L10N.getString("err.truncated_varint"));
            }
            byte b = buffer.get();
            result |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        String msg = MessageFormat.format(L10N.getString("err.varint_too_long"),
                Integer.toString(MAX_SIZE));
        throw new MalformedVarintException(msg);
    }

    /**
     * Returns the number of bytes needed to encode the value.
     *
     * @param value the value, treated as unsigned
     * @return the encoded size (1-10)
     */
    public static int size(long value) {
        if (value == 0) {
            return 1;
        }
        int bits = Long.SIZE - Long.numberOfLeadingZeros(value);
        return (bits + 6) / 7;
    }

    // -- ZigZag --

    /**
     * ZigZag-encodes a signed 64-bit value.
     *
     * @param value the signed value
     * @return the unsigned representation
     */
    public static long encodeZigZag(long value) {
        return (value << 1) ^ (value >> 63);
    }

    /**
     * Reverses {@link #encodeZigZag(long)}.
     *
     * @param value the unsigned representation
     * @return the signed value
     */
    public static long decodeZigZag(long value) {
        return (value >>> 1) ^ -(value & 1);
    }

    /**
     * ZigZag-encodes a signed 32-bit value.
     *
     * @param value the signed value
     * @return the unsigned representation as a 32-bit pattern
     */
    public static int encodeZigZag32(int value) {
        return (value << 1) ^ (value >> 31);
    }

    /**
     * Reverses {@link #encodeZigZag32(int)}.
     *
     * @param value the unsigned representation
     * @return the signed value
     */
    public static int decodeZigZag32(int value) {
        return (value >>> 1) ^ -(value & 1);
    }

}

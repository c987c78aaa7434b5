/*
 * ProtobufReader.java
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

import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.TruncatedInputException;

/**
 * Protobuf binary decoder over a {@link ByteBuffer}.
 *
 * <p>The reader consumes bytes from the buffer's position up to its limit.
 * Reads that would run past the limit throw
 * {@link TruncatedInputException} rather than
 * {@link java.nio.BufferUnderflowException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ProtobufReader {

    private final ByteBuffer buffer;

    /**
     * Creates a new ProtobufReader that reads from the given buffer.
     * The buffer should be in read mode (ready for get operations).
     *
     * @param buffer the buffer to read from
     */
    public ProtobufReader(ByteBuffer buffer) {
        this.buffer = buffer;
    }

    /**
     * Creates a new ProtobufReader over a byte array.
     *
     * @param data the bytes to read
     */
    public ProtobufReader(byte[] data) {
        this(ByteBuffer.wrap(data));
    }

    /**
     * Returns the underlying buffer.
     */
    public ByteBuffer getBuffer() {
        return buffer;
    }

    /**
     * Returns true if there are more bytes to read.
     */
    public boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    /**
     * Returns the number of bytes remaining.
     */
    public int remaining() {
        return buffer.remaining();
    }

    /**
     * Returns the current position in the underlying buffer.
     */
    public int position() {
        return buffer.position();
    }

    // -- Tags and varints --

    /**
     * Reads a field tag.
     *
     * @return the tag
     * @throws ProtobufException if there is not enough data or the tag is invalid
     */
    public Tag readTag() throws ProtobufException {
        return Tag.decode(this);
    }

    /**
     * Reads an unsigned varint.
     *
     * @return the decoded value
     * @throws ProtobufException if there is not enough data or the varint is malformed
     */
    public long readVarint() throws ProtobufException {
        return Varint.decode(buffer);
    }

    // -- Fixed-size types --

    /**
     * Reads a fixed 64-bit value in little-endian order.
     *
     * @return the value
     * @throws TruncatedInputException if there is not enough data
     */
    public long readFixed64() throws TruncatedInputException {
        require(8);
        long result = 0;
        for (int i = 0; i < 8; i++) {
            result |= ((long) (buffer.get() & 0xFF)) << (i * 8);
        }
        return result;
    }

    /**
     * Reads a fixed 32-bit value in little-endian order.
     *
     * @return the value
     * @throws TruncatedInputException if there is not enough data
     */
    public int readFixed32() throws TruncatedInputException {
        require(4);
        int result = 0;
        for (int i = 0; i < 4; i++) {
            result |= (buffer.get() & 0xFF) << (i * 8);
        }
        return result;
    }

    // -- Length-delimited types --

    /**
     * Reads a varint length prefix and checks that the bytes it announces
     * are available.
     *
     * @return the length
     * @throws ProtobufException if the prefix is malformed or exceeds the
     *         remaining data
     */
    public int readLength() throws ProtobufException {
        long length = readVarint();
        if (length < 0 || length > buffer.remaining()) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.truncated_length"),
                    Long.toUnsignedString(length), Integer.toString(buffer.remaining()));
            throw new TruncatedInputException(msg);
        }
        return (int) length;
    }

    /**
     * Reads a length-prefixed byte array.
     *
     * @return the content bytes, without the prefix
     * @throws ProtobufException if there is not enough data
     */
    public byte[] readLengthDelimited() throws ProtobufException {
        return readRawBytes(readLength());
    }

    /**
     * Reads the given number of bytes without interpretation.
     *
     * @param length the number of bytes
     * @return the bytes
     * @throws TruncatedInputException if there is not enough data
     */
    public byte[] readRawBytes(int length) throws TruncatedInputException {
        require(length);
        byte[] data = new byte[length];
        buffer.get(data);
        return data;
    }

    /**
     * Copies bytes between two absolute positions of the underlying buffer
     * without moving the reader. Used to capture the raw encoding of a value
     * that has just been read.
     *
     * @param start the first position, inclusive
     * @param end the last position, exclusive
     * @return the bytes
     */
    public byte[] copyBytes(int start, int end) {
        ByteBuffer range = buffer.duplicate();
        range.limit(end);
        range.position(start);
        byte[] data = new byte[end - start];
        range.get(data);
        return data;
    }

    // -- Skip and limit --

    /**
     * Skips the specified number of bytes.
     *
     * @param count number of bytes to skip
     * @throws TruncatedInputException if there are not enough bytes
     */
    public void skip(int count) throws TruncatedInputException {
        require(count);
        buffer.position(buffer.position() + count);
    }

    /**
     * Creates a limited reader that can only read the specified number of bytes,
     * and advances this reader past them.
     *
     * @param length the maximum number of bytes to read
     * @return a new reader limited to the specified bytes
     * @throws TruncatedInputException if there are not enough bytes
     */
    public ProtobufReader limit(int length) throws TruncatedInputException {
        require(length);
        ByteBuffer limited = buffer.slice();
        limited.limit(length);
        buffer.position(buffer.position() + length);
        return new ProtobufReader(limited);
    }

    private void require(int count) throws TruncatedInputException {
        if (count < 0 || buffer.remaining() < count) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.truncated"),
                    Integer.toString(count), Integer.toString(buffer.remaining()));
            throw new TruncatedInputException(msg);
        }
    }

}

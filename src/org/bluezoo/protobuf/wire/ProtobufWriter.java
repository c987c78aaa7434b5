/*
 * ProtobufWriter.java
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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.WritableByteChannel;

/**
 * Protobuf binary encoder.
 * Implements the wire format as per https://protobuf.dev/programming-guides/encoding/
 *
 * <p>This writer outputs to a {@link WritableByteChannel}, handling non-blocking
 * channels by retrying writes until all bytes are written. For writing to
 * memory, use {@link ByteBufferChannel}.
 *
 * <p>The writer deals only in framing: tags, varints, fixed-size values and
 * length-delimited runs. Interpretation of typed values is the job of the
 * field codecs in {@code org.bluezoo.protobuf.codec}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ProtobufWriter {

    private final WritableByteChannel channel;
    private final ByteBuffer scratch;
    private long bytesWritten;

    /**
     * Creates a new ProtobufWriter that writes to the given channel.
     *
     * @param channel the channel to write to
     */
    public ProtobufWriter(WritableByteChannel channel) {
        this.channel = channel;
        this.scratch = ByteBuffer.allocate(Varint.MAX_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Returns the number of bytes written so far.
     *
     * @return the byte count
     */
    public long getBytesWritten() {
        return bytesWritten;
    }

    // -- Tags and varints --

    /**
     * Writes a field tag.
     *
     * @param tag the tag
     * @throws IOException if an I/O error occurs
     */
    public void writeTag(Tag tag) throws IOException {
        writeVarint(tag.toVarint());
    }

    /**
     * Writes a field tag.
     *
     * @param fieldNumber the field number
     * @param wireType the wire type
     * @throws IOException if an I/O error occurs
     */
    public void writeTag(int fieldNumber, WireType wireType) throws IOException {
        writeTag(new Tag(fieldNumber, wireType));
    }

    /**
     * Writes an unsigned varint.
     *
     * @param value the value to write, treated as unsigned
     * @throws IOException if an I/O error occurs
     */
    public void writeVarint(long value) throws IOException {
        scratch.clear();
        Varint.encode(value, scratch);
        scratch.flip();
        writeToChannel(scratch);
    }

    // -- Fixed-size types --

    /**
     * Writes a fixed 64-bit value in little-endian order.
     *
     * @param value the value to write
     * @throws IOException if an I/O error occurs
     */
    public void writeFixed64(long value) throws IOException {
        scratch.clear();
        scratch.putLong(value);
        scratch.flip();
        writeToChannel(scratch);
    }

    /**
     * Writes a fixed 32-bit value in little-endian order.
     *
     * @param value the value to write
     * @throws IOException if an I/O error occurs
     */
    public void writeFixed32(int value) throws IOException {
        scratch.clear();
        scratch.putInt(value);
        scratch.flip();
        writeToChannel(scratch);
    }

    // -- Raw and length-delimited data --

    /**
     * Writes a varint length prefix followed by the given bytes.
     *
     * @param data the content bytes
     * @throws IOException if an I/O error occurs
     */
    public void writeLengthDelimited(byte[] data) throws IOException {
        writeVarint(data.length);
        writeRawBytes(data);
    }

    /**
     * Writes a varint length prefix followed by the remaining bytes of the
     * buffer.
     *
     * @param data the content
     * @throws IOException if an I/O error occurs
     */
    public void writeLengthDelimited(ByteBuffer data) throws IOException {
        writeVarint(data.remaining());
        writeToChannel(data);
    }

    /**
     * Writes bytes verbatim.
     *
     * @param data the bytes
     * @throws IOException if an I/O error occurs
     */
    public void writeRawBytes(byte[] data) throws IOException {
        writeToChannel(ByteBuffer.wrap(data));
    }

    /**
     * Writes the remaining bytes of the buffer verbatim.
     *
     * @param data the bytes
     * @throws IOException if an I/O error occurs
     */
    public void writeRawBytes(ByteBuffer data) throws IOException {
        writeToChannel(data);
    }

    /**
     * Writes a buffer to the channel, retrying if the channel is non-blocking.
     */
    private void writeToChannel(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            int written = channel.write(buffer);
            if (written > 0) {
                bytesWritten += written;
            } else if (written == 0) {
                // Non-blocking channel not ready
                Thread.yield();
            }
        }
    }

}

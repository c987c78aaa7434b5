/*
 * ByteBufferChannel.java
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
import java.nio.channels.ClosedChannelException;
import java.nio.channels.WritableByteChannel;
import java.util.Arrays;

/**
 * A {@link WritableByteChannel} that collects everything written to it in
 * a growable in-memory array.
 *
 * <p>Messages use this to serialize to byte arrays and to measure an
 * embedded message before its length prefix is written:
 * <pre>
 * ByteBufferChannel channel = new ByteBufferChannel(256);
 * message.encode(new ProtobufWriter(channel));
 * byte[] data = channel.toByteArray();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ByteBufferChannel implements WritableByteChannel {

    private byte[] data;
    private int count;
    private boolean open;

    /**
     * Creates a new ByteBufferChannel with the specified initial capacity.
     *
     * @param initialCapacity the initial capacity, at least 1
     */
    public ByteBufferChannel(int initialCapacity) {
        this.data = new byte[Math.max(1, initialCapacity)];
        this.open = true;
    }

    /**
     * Creates a new ByteBufferChannel with a default initial capacity of 1KB.
     */
    public ByteBufferChannel() {
        this(1024);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        if (!open) {
            throw new ClosedChannelException();
        }
        int length = src.remaining();
        if (length > data.length - count) {
            grow(count + length);
        }
        src.get(data, count, length);
        count += length;
        return length;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    /**
     * Returns the number of bytes written so far.
     *
     * @return the byte count
     */
    public int size() {
        return count;
    }

    /**
     * Returns a read-only view of the bytes written so far, positioned at
     * the first byte. The view is invalidated by further writes.
     *
     * @return the written data
     */
    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(data, 0, count).asReadOnlyBuffer();
    }

    /**
     * Returns a copy of the bytes written so far.
     *
     * @return the written data
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, count);
    }

    /**
     * Discards all written data. The capacity is retained.
     */
    public void reset() {
        count = 0;
    }

    private void grow(int required) {
        int capacity = data.length;
        while (capacity < required) {
            capacity = capacity * 2;
            if (capacity < 0) {
                capacity = Integer.MAX_VALUE;
            }
        }
        data = Arrays.copyOf(data, capacity);
    }

}

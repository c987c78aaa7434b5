/*
 * VarintCodec.java
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

package org.bluezoo.protobuf.codec;

import java.io.IOException;

import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.wire.ProtobufReader;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.Varint;
import org.bluezoo.protobuf.wire.WireType;

/**
 * Codec for types carried as a single varint.
 *
 * <p>Subclasses map between the Java value and the unsigned 64-bit varint
 * value.
 *
 * @param <T> the Java type of field values
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class VarintCodec<T> extends ScalarCodec<T> {

    protected VarintCodec(String name, T defaultValue) {
        super(name, WireType.VARINT, defaultValue);
    }

    /**
     * Converts a value to its varint representation.
     *
     * @param value the value
     * @return the unsigned varint value
     */
    protected abstract long toVarint(T value);

    /**
     * Converts a varint to a value.
     *
     * @param varint the unsigned varint value
     * @return the value
     */
    protected abstract T fromVarint(long varint);

    @Override
    protected void writeValue(T value, ProtobufWriter writer) throws IOException {
        writer.writeVarint(toVarint(value));
    }

    @Override
    protected T readValue(ProtobufReader reader) throws ProtobufException {
        return fromVarint(reader.readVarint());
    }

    @Override
    protected int getValueSize(T value) {
        return Varint.size(toVarint(value));
    }

}

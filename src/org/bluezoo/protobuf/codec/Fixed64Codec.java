/*
 * Fixed64Codec.java
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
import org.bluezoo.protobuf.wire.WireType;

/**
 * Codec for types carried as 8 little-endian bytes (fixed64, sfixed64,
 * double).
 *
 * @param <T> the Java type of field values
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Fixed64Codec<T> extends ScalarCodec<T> {

    protected Fixed64Codec(String name, T defaultValue) {
        super(name, WireType.I64, defaultValue);
    }

    protected abstract long toBits(T value);

    protected abstract T fromBits(long bits);

    @Override
    protected void writeValue(T value, ProtobufWriter writer) throws IOException {
        writer.writeFixed64(toBits(value));
    }

    @Override
    protected T readValue(ProtobufReader reader) throws ProtobufException {
        return fromBits(reader.readFixed64());
    }

    @Override
    protected int getValueSize(T value) {
        return 8;
    }

}

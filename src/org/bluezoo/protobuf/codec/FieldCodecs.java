/*
 * FieldCodecs.java
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
import java.nio.charset.StandardCharsets;

import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.wire.ProtobufReader;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.Varint;
import org.bluezoo.protobuf.wire.WireType;

/**
 * The codec for each protobuf scalar type.
 *
 * <p>Unsigned types are represented by the signed Java type of the same
 * width holding the same bit pattern: a {@code uint32} of 4294967295 is the
 * {@code Integer} -1. {@code int32} and {@code enum} values are
 * sign-extended on the wire, so negative values take 10 bytes, while
 * {@code sint32} and {@code sint64} use ZigZag encoding.
 *
 * <table>
 *   <caption>Scalar codecs</caption>
 *   <tr><th>Codec</th><th>Java type</th><th>Wire type</th></tr>
 *   <tr><td>UINT32, INT32, SINT32, ENUM</td><td>Integer</td><td>VARINT</td></tr>
 *   <tr><td>UINT64, INT64, SINT64</td><td>Long</td><td>VARINT</td></tr>
 *   <tr><td>BOOL</td><td>Boolean</td><td>VARINT</td></tr>
 *   <tr><td>FIXED32, SFIXED32</td><td>Integer</td><td>I32</td></tr>
 *   <tr><td>FLOAT</td><td>Float</td><td>I32</td></tr>
 *   <tr><td>FIXED64, SFIXED64</td><td>Long</td><td>I64</td></tr>
 *   <tr><td>DOUBLE</td><td>Double</td><td>I64</td></tr>
 *   <tr><td>STRING</td><td>String</td><td>LEN</td></tr>
 *   <tr><td>BYTES</td><td>byte[]</td><td>LEN</td></tr>
 * </table>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FieldCodecs {

    private FieldCodecs() {
    }

    // -- Varint types --

    public static final ScalarCodec<Integer> UINT32 = new VarintCodec<Integer>("uint32", 0) {
        @Override
        protected long toVarint(Integer value) {
            return value & 0xFFFFFFFFL;
        }

        @Override
        protected Integer fromVarint(long varint) {
            return (int) varint;
        }
    };

    public static final ScalarCodec<Integer> INT32 = new VarintCodec<Integer>("int32", 0) {
        @Override
        protected long toVarint(Integer value) {
            return value.longValue();
        }

        @Override
        protected Integer fromVarint(long varint) {
            return (int) varint;
        }
    };

    public static final ScalarCodec<Integer> SINT32 = new VarintCodec<Integer>("sint32", 0) {
        @Override
        protected long toVarint(Integer value) {
            return Varint.encodeZigZag32(value) & 0xFFFFFFFFL;
        }

        @Override
        protected Integer fromVarint(long varint) {
            return Varint.decodeZigZag32((int) varint);
        }
    };

    /**
     * Enum values are carried as their int32 number. Mapping to a Java enum
     * is left to the generated accessor, so unrecognised numbers survive.
     */
    public static final ScalarCodec<Integer> ENUM = new VarintCodec<Integer>("enum", 0) {
        @Override
        protected long toVarint(Integer value) {
            return value.longValue();
        }

        @Override
        protected Integer fromVarint(long varint) {
            return (int) varint;
        }
    };

    public static final ScalarCodec<Long> UINT64 = new VarintCodec<Long>("uint64", 0L) {
        @Override
        protected long toVarint(Long value) {
            return value;
        }

        @Override
        protected Long fromVarint(long varint) {
            return varint;
        }
    };

    public static final ScalarCodec<Long> INT64 = new VarintCodec<Long>("int64", 0L) {
        @Override
        protected long toVarint(Long value) {
            return value;
        }

        @Override
        protected Long fromVarint(long varint) {
            return varint;
        }
    };

    public static final ScalarCodec<Long> SINT64 = new VarintCodec<Long>("sint64", 0L) {
        @Override
        protected long toVarint(Long value) {
            return Varint.encodeZigZag(value);
        }

        @Override
        protected Long fromVarint(long varint) {
            return Varint.decodeZigZag(varint);
        }
    };

    public static final ScalarCodec<Boolean> BOOL = new VarintCodec<Boolean>("bool", Boolean.FALSE) {
        @Override
        protected long toVarint(Boolean value) {
            return value ? 1L : 0L;
        }

        @Override
        protected Boolean fromVarint(long varint) {
            return varint != 0;
        }
    };

    // -- Fixed-size types --

    public static final ScalarCodec<Integer> FIXED32 = new Fixed32Codec<Integer>("fixed32", 0) {
        @Override
        protected int toBits(Integer value) {
            return value;
        }

        @Override
        protected Integer fromBits(int bits) {
            return bits;
        }
    };

    public static final ScalarCodec<Integer> SFIXED32 = new Fixed32Codec<Integer>("sfixed32", 0) {
        @Override
        protected int toBits(Integer value) {
            return value;
        }

        @Override
        protected Integer fromBits(int bits) {
            return bits;
        }
    };

    public static final ScalarCodec<Float> FLOAT = new Fixed32Codec<Float>("float", 0.0f) {
        @Override
        protected int toBits(Float value) {
            return Float.floatToRawIntBits(value);
        }

        @Override
        protected Float fromBits(int bits) {
            return Float.intBitsToFloat(bits);
        }
    };

    public static final ScalarCodec<Long> FIXED64 = new Fixed64Codec<Long>("fixed64", 0L) {
        @Override
        protected long toBits(Long value) {
            return value;
        }

        @Override
        protected Long fromBits(long bits) {
            return bits;
        }
    };

    public static final ScalarCodec<Long> SFIXED64 = new Fixed64Codec<Long>("sfixed64", 0L) {
        @Override
        protected long toBits(Long value) {
            return value;
        }

        @Override
        protected Long fromBits(long bits) {
            return bits;
        }
    };

    public static final ScalarCodec<Double> DOUBLE = new Fixed64Codec<Double>("double", 0.0) {
        @Override
        protected long toBits(Double value) {
            return Double.doubleToRawLongBits(value);
        }

        @Override
        protected Double fromBits(long bits) {
            return Double.longBitsToDouble(bits);
        }
    };

    // -- Length-delimited types --

    /**
     * UTF-8 strings. Malformed UTF-8 on the wire decodes with replacement
     * characters.
     */
    public static final ScalarCodec<String> STRING = new ScalarCodec<String>("string", WireType.LEN, "") {
        @Override
        protected void writeValue(String value, ProtobufWriter writer) throws IOException {
            writer.writeLengthDelimited(value.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        protected String readValue(ProtobufReader reader) throws ProtobufException {
            return new String(reader.readLengthDelimited(), StandardCharsets.UTF_8);
        }
    };

    public static final ScalarCodec<byte[]> BYTES = new ScalarCodec<byte[]>("bytes", WireType.LEN, null) {
        @Override
        public byte[] defaultValue() {
            return new byte[0];
        }

        @Override
        public byte[] copyValue(byte[] value) {
            return value.clone();
        }

        @Override
        protected void writeValue(byte[] value, ProtobufWriter writer) throws IOException {
            writer.writeLengthDelimited(value);
        }

        @Override
        protected byte[] readValue(ProtobufReader reader) throws ProtobufException {
            return reader.readLengthDelimited();
        }
    };

}

/*
 * ScalarCodec.java
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
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;

import org.bluezoo.protobuf.InvalidWireTypeException;
import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufReader;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.WireType;

/**
 * Base class for codecs of scalar types.
 *
 * <p>Subclasses supply the payload conversion for a single value; this class
 * implements tagging, packing, last-value-wins and the packed/unpacked
 * decision for repeated fields. A type is packable unless its natural wire
 * type is {@link WireType#LEN}.
 *
 * @param <T> the Java type of field values
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class ScalarCodec<T> implements FieldCodec<T> {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.protobuf.codec.L10N");

    private final String name;
    private final WireType wireType;
    private final T defaultValue;

    /**
     * Creates a scalar codec.
     *
     * @param name the protobuf type name, for diagnostics
     * @param wireType the natural wire type
     * @param defaultValue the value of an absent field
     */
    protected ScalarCodec(String name, WireType wireType, T defaultValue) {
        this.name = name;
        this.wireType = wireType;
        this.defaultValue = defaultValue;
    }

    /**
     * Writes a value's payload, without tag.
     *
     * @param value the value
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    protected abstract void writeValue(T value, ProtobufWriter writer) throws IOException;

    /**
     * Reads a value's payload.
     *
     * @param reader the reader, positioned at the payload
     * @return the value
     * @throws ProtobufException if the payload is malformed or truncated
     */
    protected abstract T readValue(ProtobufReader reader) throws ProtobufException;

    /**
     * Returns the number of bytes {@link #writeValue} writes. This sizes the
     * content of a packed field, so only packable codecs override it.
     *
     * @param value the value
     * @return the payload size
     * @throws UnsupportedOperationException if this codec is not packable
     */
    protected int getValueSize(T value) {
        throw new UnsupportedOperationException(name + " is not packable");
    }

    /**
     * Returns the protobuf type name, such as {@code uint32}.
     *
     * @return the type name
     */
    public String getName() {
        return name;
    }

    @Override
    public T defaultValue() {
        return defaultValue;
    }

    @Override
    public WireType getWireType() {
        return wireType;
    }

    @Override
    public boolean isPackable() {
        return wireType != WireType.LEN;
    }

    @Override
    public T copyValue(T value) {
        return value;
    }

    @Override
    public void encodeField(int fieldNumber, T value, ProtobufWriter writer) throws IOException {
        if (value == null) {
            throw new NullPointerException(name + " field " + fieldNumber);
        }
        writer.writeTag(fieldNumber, wireType);
        writeValue(value, writer);
    }

    @Override
    public void encodeRepeatedField(int fieldNumber, List<? extends T> values, ProtobufWriter writer)
            throws IOException {
        if (values.isEmpty()) {
            return;
        }
        if (!isPackable()) {
            for (T value : values) {
                encodeField(fieldNumber, value, writer);
            }
            return;
        }
        long length = 0;
        for (T value : values) {
            length += getValueSize(value);
        }
        writer.writeTag(fieldNumber, WireType.LEN);
        writer.writeVarint(length);
        for (T value : values) {
            writeValue(value, writer);
        }
    }

    @Override
    public T decodeField(List<EncodedField> occurrences) throws ProtobufException {
        T result = defaultValue();
        for (EncodedField occurrence : occurrences) {
            checkWireType(occurrence, false);
            result = decodeOccurrence(occurrence);
        }
        return result;
    }

    @Override
    public void decodeRepeatedField(List<EncodedField> occurrences, List<? super T> dest)
            throws ProtobufException {
        for (EncodedField occurrence : occurrences) {
            if (checkWireType(occurrence, isPackable())) {
                ProtobufReader payload = occurrence.openPayload();
                ProtobufReader packed = payload.limit(payload.readLength());
                while (packed.hasRemaining()) {
                    dest.add(readValue(packed));
                }
            } else {
                dest.add(decodeOccurrence(occurrence));
            }
        }
    }

    /**
     * Checks that an occurrence can be decoded by this codec.
     *
     * @return true if the occurrence is a packed run, false if it is a
     *         single value in the natural wire type
     */
    private boolean checkWireType(EncodedField occurrence, boolean allowPacked)
            throws InvalidWireTypeException {
        WireType actual = occurrence.getWireType();
        if (actual == wireType) {
            return false;
        }
        if (allowPacked && actual == WireType.LEN) {
            return true;
        }
        String msg = MessageFormat.format(L10N.getString("err.wire_type_mismatch"),
                Integer.toString(occurrence.getFieldNumber()), actual, name, wireType);
        throw new InvalidWireTypeException(msg, actual.getCode());
    }

    private T decodeOccurrence(EncodedField occurrence) throws ProtobufException {
        ProtobufReader payload = occurrence.openPayload();
        T value = readValue(payload);
        if (payload.hasRemaining()) {
            String msg = MessageFormat.format(L10N.getString("err.trailing_bytes"),
                    Integer.toString(occurrence.getFieldNumber()),
                    Integer.toString(payload.remaining()), name);
            throw new ProtobufException(msg);
        }
        return value;
    }

    @Override
    public String toString() {
        return name;
    }

}

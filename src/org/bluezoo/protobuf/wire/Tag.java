/*
 * Tag.java
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
import java.text.MessageFormat;

import org.bluezoo.protobuf.ProtobufException;

/**
 * A field tag: field number and wire type.
 *
 * <p>On the wire a tag is the varint {@code (fieldNumber << 3) | wireType}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Tag {

    /**
     * Smallest valid field number.
     */
    public static final int MIN_FIELD_NUMBER = 1;

    /**
     * Largest valid field number (2<sup>29</sup> - 1).
     */
    public static final int MAX_FIELD_NUMBER = (1 << 29) - 1;

    private final int fieldNumber;
    private final WireType wireType;

    /**
     * Creates a tag.
     *
     * @param fieldNumber the field number
     * @param wireType the wire type
     * @throws IllegalArgumentException if the field number is out of range
     */
    public Tag(int fieldNumber, WireType wireType) {
        if (fieldNumber < MIN_FIELD_NUMBER || fieldNumber > MAX_FIELD_NUMBER) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.invalid_field_number"),
                    Integer.toString(fieldNumber));
            throw new IllegalArgumentException(msg);
        }
        if (wireType == null) {
            throw new NullPointerException("wireType");
        }
        this.fieldNumber = fieldNumber;
        this.wireType = wireType;
    }

    public int getFieldNumber() {
        return fieldNumber;
    }

    public WireType getWireType() {
        return wireType;
    }

    /**
     * Returns the packed tag value written on the wire.
     *
     * @return {@code (fieldNumber << 3) | wireType}
     */
    public long toVarint() {
        return ((long) fieldNumber << 3) | wireType.getCode();
    }

    /**
     * Unpacks a tag value.
     *
     * @param value the varint read from the wire
     * @return the tag
     * @throws ProtobufException if the value does not fit in 32 bits or the
     *         field number is 0
     * @throws org.bluezoo.protobuf.InvalidWireTypeException if the low 3 bits
     *         are not a supported wire type
     */
    public static Tag fromVarint(long value) throws ProtobufException {
        if ((value & ~0xFFFFFFFFL) != 0) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.tag_too_large"),
                    Long.toUnsignedString(value));
            throw new ProtobufException(msg);
        }
        int fieldNumber = (int) (value >>> 3);
        if (fieldNumber < MIN_FIELD_NUMBER) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.invalid_field_number"),
                    Integer.toString(fieldNumber));
            throw new ProtobufException(msg);
        }
        WireType wireType = WireType.fromCode((int) (value & 0x07));
        return new Tag(fieldNumber, wireType);
    }

    /**
     * Writes this tag.
     *
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public void encode(ProtobufWriter writer) throws IOException {
        writer.writeVarint(toVarint());
    }

    /**
     * Reads a tag.
     *
     * @param reader the reader
     * @return the tag
     * @throws ProtobufException if the input is truncated or the tag is invalid
     */
    public static Tag decode(ProtobufReader reader) throws ProtobufException {
        return fromVarint(reader.readVarint());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Tag)) {
            return false;
        }
        Tag tag = (Tag) other;
        return fieldNumber == tag.fieldNumber && wireType == tag.wireType;
    }

    @Override
    public int hashCode() {
        return (int) toVarint();
    }

    @Override
    public String toString() {
        return fieldNumber + ":" + wireType;
    }

}

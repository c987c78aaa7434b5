/*
 * WireType.java
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

import java.text.MessageFormat;

import org.bluezoo.protobuf.InvalidWireTypeException;

/**
 * Protobuf wire types.
 *
 * <p>The wire type occupies the low 3 bits of a field tag and determines
 * how the field's payload is framed. The deprecated group types (3 and 4)
 * are not supported.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum WireType {

    /**
     * Variable-length integer.
     * Used for int32, int64, uint32, uint64, sint32, sint64, bool and enum.
     */
    VARINT(0),

    /**
     * 64-bit little-endian value.
     * Used for fixed64, sfixed64 and double.
     */
    I64(1),

    /**
     * Varint length followed by that many bytes.
     * Used for string, bytes, embedded messages and packed repeated fields.
     */
    LEN(2),

    /**
     * 32-bit little-endian value.
     * Used for fixed32, sfixed32 and float.
     */
    I32(5);

    private final int code;

    WireType(int code) {
        this.code = code;
    }

    /**
     * Returns the 3-bit code for this wire type.
     *
     * @return the code
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the wire type for the given code.
     *
     * @param code the 3-bit code from a tag
     * @return the corresponding wire type
     * @throws InvalidWireTypeException if the code is not a supported wire type
     */
    public static WireType fromCode(int code) throws InvalidWireTypeException {
        switch (code) {
            case 0:
                return VARINT;
            case 1:
                return I64;
            case 2:
                return LEN;
            case 5:
                return I32;
            default:
                String msg = MessageFormat.format(Varint.L10N.getString("err.unknown_wire_type"),
                        Integer.toString(code));
                throw new InvalidWireTypeException(msg, code);
        }
    }

}

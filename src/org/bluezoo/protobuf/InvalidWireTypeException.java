/*
 * InvalidWireTypeException.java
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

package org.bluezoo.protobuf;

/**
 * Thrown when a tag carries a wire type code outside the defined set, or
 * when a field occurrence has a wire type that the field's codec cannot
 * decode.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class InvalidWireTypeException extends ProtobufException {

    private static final long serialVersionUID = 1L;

    private final int wireType;

    /**
     * Creates a new invalid wire type exception.
     *
     * @param message the error message
     * @param wireType the offending 3-bit wire type code
     */
    public InvalidWireTypeException(String message, int wireType) {
        super(message);
        this.wireType = wireType;
    }

    /**
     * Returns the wire type code that could not be handled.
     *
     * @return the wire type code (0-7)
     */
    public int getWireType() {
        return wireType;
    }

}

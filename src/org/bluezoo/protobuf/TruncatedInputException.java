/*
 * TruncatedInputException.java
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
 * Thrown when the input ends in the middle of a varint, a fixed-size value
 * or a length-delimited payload.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TruncatedInputException extends ProtobufException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new truncated input exception.
     *
     * @param message the error message
     */
    public TruncatedInputException(String message) {
        super(message);
    }

}

/*
 * SchemaMismatchException.java
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
 * Thrown when decoded bytes were evidently not produced by a compatible
 * message type.
 *
 * <p>This is reported when a delimited frame is larger than the configured
 * limit or ends in the middle of a field, and when the payload of an
 * embedded message field cannot be decoded as that message type. The
 * underlying wire-level failure, if any, is available as the cause.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SchemaMismatchException extends ProtobufException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new schema mismatch exception.
     *
     * @param message the error message
     */
    public SchemaMismatchException(String message) {
        super(message);
    }

    /**
     * Creates a new schema mismatch exception with a cause.
     *
     * @param message the error message
     * @param cause the wire-level failure
     */
    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }

}

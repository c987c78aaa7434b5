/*
 * ProtobufException.java
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
 * Exception thrown when protobuf wire data cannot be decoded.
 *
 * <p>Subclasses identify the specific failure: input that ends early
 * ({@link TruncatedInputException}), an unusable wire type
 * ({@link InvalidWireTypeException}), an over-long varint
 * ({@link MalformedVarintException}) or bytes that were not produced by a
 * compatible message type ({@link SchemaMismatchException}). Decoding is
 * never retried; the caller is expected to abandon the message.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ProtobufException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new protobuf exception with the given message.
     *
     * @param message the error message
     */
    public ProtobufException(String message) {
        super(message);
    }

    /**
     * Creates a new protobuf exception with the given message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public ProtobufException(String message, Throwable cause) {
        super(message, cause);
    }

}

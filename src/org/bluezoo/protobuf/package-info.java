/*
 * package-info.java
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

/**
 * Protocol Buffers message runtime.
 *
 * <p>Generated message classes extend {@link org.bluezoo.protobuf.Message}
 * and implement four hooks that write, claim, merge and clear their typed
 * fields. Everything else is handled here:
 * <ul>
 *   <li>{@link org.bluezoo.protobuf.Message} - encoding, decoding, delimited
 *       framing, merging and copying</li>
 *   <li>{@link org.bluezoo.protobuf.UnknownFieldStore} - decoded fields
 *       waiting to be claimed, and unknown fields preserved for re-encoding</li>
 *   <li>{@link org.bluezoo.protobuf.RepeatedField} - list of values bound to
 *       an element codec</li>
 *   <li>{@link org.bluezoo.protobuf.RawMessage} - message with no typed
 *       fields</li>
 * </ul>
 *
 * <h2>Errors</h2>
 *
 * <p>Malformed input is reported by subclasses of the checked
 * {@link org.bluezoo.protobuf.ProtobufException}. Encoding only fails if the
 * underlying channel does, with {@link java.io.IOException}.
 *
 * <h2>Configuration</h2>
 *
 * <ul>
 *   <li>{@code bluezoo.protobuf.maxDelimitedLength} - largest length prefix
 *       accepted when decoding a delimited message (default 64 MiB)</li>
 *   <li>{@code bluezoo.protobuf.maxDepth} - deepest nesting of embedded
 *       messages accepted when decoding (default 100)</li>
 *   <li>{@code bluezoo.protobuf.bufferSize} - initial capacity of in-memory
 *       encoding buffers (default 256)</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://protobuf.dev/programming-guides/encoding/">Protobuf Encoding</a>
 */
package org.bluezoo.protobuf;

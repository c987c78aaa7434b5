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
 * Protocol Buffers binary wire format.
 *
 * <p>{@link org.bluezoo.protobuf.wire.ProtobufReader} and
 * {@link org.bluezoo.protobuf.wire.ProtobufWriter} read and write varints,
 * tags, fixed-size values and length-delimited data.
 * {@link org.bluezoo.protobuf.wire.EncodedField} captures one field exactly
 * as it appeared on the wire, so it can be written back byte for byte.
 *
 * <p>Group wire types (3 and 4) are not supported.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.protobuf.wire;

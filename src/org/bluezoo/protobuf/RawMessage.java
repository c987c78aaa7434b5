/*
 * RawMessage.java
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

import org.bluezoo.protobuf.wire.ProtobufWriter;

/**
 * A message with no typed fields. Every field it decodes is kept as an
 * unknown field and written back unchanged, so it can carry or inspect
 * messages whose type is not known.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RawMessage extends Message<RawMessage> {

    @Override
    protected void writeFields(ProtobufWriter writer) {
    }

    @Override
    protected void readFields(UnknownFieldStore fields) {
    }

    @Override
    protected void mergeFields(RawMessage source) {
    }

    @Override
    protected void clearFields() {
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof RawMessage
                && getUnknownFields().equals(((RawMessage) other).getUnknownFields());
    }

    @Override
    public int hashCode() {
        return getUnknownFields().hashCode();
    }

    @Override
    public String toString() {
        return "RawMessage" + getUnknownFields().fieldNumbers();
    }

}

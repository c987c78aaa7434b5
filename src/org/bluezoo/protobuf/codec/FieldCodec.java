/*
 * FieldCodec.java
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
import java.util.List;

import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.WireType;

/**
 * Conversion between wire bytes and the Java values of one protobuf field
 * type.
 *
 * <p>Codecs are stateless and carry nothing specific to a message, so one
 * shared instance serves every field of its type. Generated message classes
 * pick the codec for each field statically, typically from
 * {@link FieldCodecs}, and pass it to the primitives of
 * {@link org.bluezoo.protobuf.UnknownFieldStore} and
 * {@link org.bluezoo.protobuf.RepeatedField}.
 *
 * <h3>Decoding rules</h3>
 * <ul>
 *   <li>A singular field decodes every occurrence and keeps the last value
 *       (embedded messages are merged instead, see {@link MessageCodec}).</li>
 *   <li>A repeated field accepts each occurrence in its natural wire type,
 *       or as a packed {@link WireType#LEN} run if the type is packable.
 *       Packed and unpacked occurrences may be mixed.</li>
 *   <li>Any other wire type is an
 *       {@link org.bluezoo.protobuf.InvalidWireTypeException}.</li>
 * </ul>
 *
 * @param <T> the Java type of field values
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface FieldCodec<T> {

    /**
     * Returns the value of an absent field: zero, false, the empty string or
     * empty bytes for scalars, {@code null} for embedded messages.
     *
     * @return the default value
     */
    T defaultValue();

    /**
     * Returns the wire type of a single unpacked occurrence.
     *
     * @return the natural wire type
     */
    WireType getWireType();

    /**
     * Returns true if repeated values of this type are written packed.
     * Only varint and fixed-size types are packable.
     *
     * @return whether this type is packable
     */
    boolean isPackable();

    /**
     * Returns a value that can be stored independently of the given one.
     * Immutable values are returned as they are.
     *
     * @param value the value
     * @return an independent copy
     */
    T copyValue(T value);

    /**
     * Writes one occurrence of a field: the tag followed by the payload.
     *
     * @param fieldNumber the field number
     * @param value the value
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    void encodeField(int fieldNumber, T value, ProtobufWriter writer) throws IOException;

    /**
     * Writes a repeated field. Packable types are written as one
     * length-delimited run of concatenated values; other types as one
     * occurrence per value. Nothing is written for an empty list.
     *
     * @param fieldNumber the field number
     * @param values the values in order
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    void encodeRepeatedField(int fieldNumber, List<? extends T> values, ProtobufWriter writer)
            throws IOException;

    /**
     * Decodes a singular field from all of its occurrences.
     *
     * @param occurrences the occurrences in wire order
     * @return the decoded value, or the default value if there are none
     * @throws ProtobufException if an occurrence cannot be decoded
     */
    T decodeField(List<EncodedField> occurrences) throws ProtobufException;

    /**
     * Decodes a repeated field, appending values in wire order.
     *
     * @param occurrences the occurrences in wire order
     * @param dest the list to append to
     * @throws ProtobufException if an occurrence cannot be decoded
     */
    void decodeRepeatedField(List<EncodedField> occurrences, List<? super T> dest)
            throws ProtobufException;

}

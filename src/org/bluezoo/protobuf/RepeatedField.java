/*
 * RepeatedField.java
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

import java.io.IOException;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.Supplier;

import org.bluezoo.protobuf.codec.FieldCodec;
import org.bluezoo.protobuf.codec.MessageCodec;
import org.bluezoo.protobuf.wire.ProtobufWriter;

/**
 * The values of a repeated field, in wire order.
 *
 * <p>The list is bound to the codec of its element type, which decides how
 * it is written: packable scalars as a single packed occurrence, strings,
 * bytes and messages as one occurrence per element. Decoding accepts both
 * packed and unpacked occurrences, mixed in any order.
 *
 * <p>Null elements are not permitted.
 *
 * @param <T> the element type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RepeatedField<T> extends AbstractList<T> implements RandomAccess {

    private final FieldCodec<T> codec;
    private final List<T> values = new ArrayList<>();

    public RepeatedField(FieldCodec<T> codec) {
        if (codec == null) {
            throw new NullPointerException("codec");
        }
        this.codec = codec;
    }

    /**
     * Creates an empty repeated field of a scalar type.
     *
     * @param codec the element codec, usually one of
     *        {@link org.bluezoo.protobuf.codec.FieldCodecs}
     * @param <T> the element type
     * @return the repeated field
     */
    public static <T> RepeatedField<T> of(FieldCodec<T> codec) {
        return new RepeatedField<T>(codec);
    }

    /**
     * Creates an empty repeated field of a message type.
     *
     * @param factory creates empty instances of the message type
     * @param <M> the message type
     * @return the repeated field
     */
    public static <M extends Message<M>> RepeatedField<M> ofMessages(Supplier<M> factory) {
        return new RepeatedField<M>(MessageCodec.of(factory));
    }

    public FieldCodec<T> getCodec() {
        return codec;
    }

    // -- List --

    @Override
    public T get(int index) {
        return values.get(index);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public T set(int index, T element) {
        return values.set(index, checkElement(element));
    }

    @Override
    public void add(int index, T element) {
        values.add(index, checkElement(element));
        modCount++;
    }

    @Override
    public T remove(int index) {
        modCount++;
        return values.remove(index);
    }

    @Override
    public void clear() {
        values.clear();
        modCount++;
    }

    private T checkElement(T element) {
        if (element == null) {
            throw new NullPointerException(Message.L10N.getString("err.null_element"));
        }
        return element;
    }

    // -- Wire format --

    /**
     * Writes the elements as the given field. An empty list writes nothing.
     *
     * @param fieldNumber the field number
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public void encodeTo(int fieldNumber, ProtobufWriter writer) throws IOException {
        codec.encodeRepeatedField(fieldNumber, values, writer);
    }

    /**
     * Replaces the elements with every occurrence of the given field, and
     * claims the field from the store.
     *
     * @param fields the decoded fields of the enclosing message
     * @param fieldNumber the field number
     * @throws ProtobufException if an occurrence cannot be decoded
     */
    public void decodeFrom(UnknownFieldStore fields, int fieldNumber) throws ProtobufException {
        clear();
        fields.decodeRepeatedField(fieldNumber, codec, values);
    }

    /**
     * Appends copies of the elements of another repeated field.
     *
     * @param source the repeated field to merge from
     */
    public void mergeFrom(RepeatedField<T> source) {
        if (source == this) {
            throw new IllegalArgumentException(Message.L10N.getString("err.merge_self"));
        }
        for (T value : source.values) {
            values.add(codec.copyValue(value));
        }
        modCount++;
    }

}

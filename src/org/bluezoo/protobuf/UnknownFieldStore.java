/*
 * UnknownFieldStore.java
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
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.protobuf.codec.FieldCodec;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufWriter;

/**
 * The fields of a message that have been decoded from the wire but not yet
 * claimed by a typed accessor.
 *
 * <p>Occurrences are grouped by field number, in ascending order, and kept in
 * wire order within each group so that repeated and merged fields retain
 * their multiplicity. A field number is present exactly while at least one
 * raw occurrence is waiting to be claimed.
 *
 * <p>Generated message classes claim their fields in
 * {@link Message#readFields(UnknownFieldStore)} through
 * {@link #decodeField(int, FieldCodec)} or
 * {@link RepeatedField#decodeFrom(UnknownFieldStore, int)}. Claiming removes
 * the field, so it is a one-shot operation: claiming the same field again
 * yields the default value. Whatever is never claimed is written back
 * verbatim by {@link #encode(ProtobufWriter)}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UnknownFieldStore {

    private static final Logger LOGGER = Logger.getLogger(UnknownFieldStore.class.getName());

    private final SortedMap<Integer, List<EncodedField>> fields = new TreeMap<>();

    /**
     * Appends an occurrence to the list for its field number.
     *
     * @param field the occurrence
     */
    public void add(EncodedField field) {
        List<EncodedField> occurrences = fields.get(field.getFieldNumber());
        if (occurrences == null) {
            occurrences = new ArrayList<>();
            fields.put(field.getFieldNumber(), occurrences);
        }
        occurrences.add(field);
    }

    /**
     * Returns true if occurrences of the field are waiting to be claimed.
     *
     * @param fieldNumber the field number
     * @return whether the field is present
     */
    public boolean hasField(int fieldNumber) {
        return fields.containsKey(fieldNumber);
    }

    /**
     * Returns the occurrences of a field without claiming them.
     *
     * @param fieldNumber the field number
     * @return unmodifiable list of occurrences, empty if the field is absent
     */
    public List<EncodedField> getFields(int fieldNumber) {
        List<EncodedField> occurrences = fields.get(fieldNumber);
        if (occurrences == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(occurrences);
    }

    /**
     * Removes and returns the occurrences of a field.
     *
     * @param fieldNumber the field number
     * @return the removed occurrences, empty if the field was absent
     */
    public List<EncodedField> remove(int fieldNumber) {
        List<EncodedField> occurrences = fields.remove(fieldNumber);
        if (occurrences == null) {
            return Collections.emptyList();
        }
        return occurrences;
    }

    /**
     * Returns the field numbers present, in ascending order.
     *
     * @return unmodifiable set of field numbers
     */
    public Set<Integer> fieldNumbers() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    /**
     * Returns the number of distinct field numbers present.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public void clear() {
        fields.clear();
    }

    // -- Claiming --

    /**
     * Claims a singular field, decoding it with the given codec. The field
     * is removed from the store once decoded.
     *
     * @param fieldNumber the field number
     * @param codec the codec for the field's type
     * @param <T> the value type
     * @return the decoded value, or the codec's default if the field is absent
     * @throws ProtobufException if the occurrences cannot be decoded
     */
    public <T> T decodeField(int fieldNumber, FieldCodec<T> codec) throws ProtobufException {
        List<EncodedField> occurrences = fields.get(fieldNumber);
        if (occurrences == null) {
            return codec.defaultValue();
        }
        T value = codec.decodeField(occurrences);
        fields.remove(fieldNumber);
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(Message.L10N.getString("debug.claimed"),
                    Integer.toString(fieldNumber), Integer.toString(occurrences.size()), codec);
            LOGGER.finest(msg);
        }
        return value;
    }

    /**
     * Claims a repeated field, appending its decoded values to the
     * destination in wire order. The field is removed from the store once
     * decoded.
     *
     * @param fieldNumber the field number
     * @param codec the codec for the element type
     * @param dest the list to append to
     * @param <T> the element type
     * @throws ProtobufException if the occurrences cannot be decoded
     */
    public <T> void decodeRepeatedField(int fieldNumber, FieldCodec<T> codec, List<? super T> dest)
            throws ProtobufException {
        List<EncodedField> occurrences = fields.get(fieldNumber);
        if (occurrences == null) {
            return;
        }
        codec.decodeRepeatedField(occurrences, dest);
        fields.remove(fieldNumber);
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(Message.L10N.getString("debug.claimed"),
                    Integer.toString(fieldNumber), Integer.toString(occurrences.size()), codec);
            LOGGER.finest(msg);
        }
    }

    // -- Copying --

    /**
     * Appends the occurrences of another store to this one.
     * Encoded fields are immutable, so they are shared rather than copied.
     *
     * @param source the store to merge from
     */
    public void mergeFrom(UnknownFieldStore source) {
        if (source == this) {
            throw new IllegalArgumentException(Message.L10N.getString("err.merge_self"));
        }
        for (Map.Entry<Integer, List<EncodedField>> entry : source.fields.entrySet()) {
            List<EncodedField> occurrences = fields.get(entry.getKey());
            if (occurrences == null) {
                occurrences = new ArrayList<>();
                fields.put(entry.getKey(), occurrences);
            }
            occurrences.addAll(entry.getValue());
        }
    }

    /**
     * Replaces the contents of this store with those of another.
     *
     * @param source the store to copy
     */
    public void copyFrom(UnknownFieldStore source) {
        if (source == this) {
            return;
        }
        fields.clear();
        mergeFrom(source);
    }

    // -- Encoding --

    /**
     * Writes every occurrence, in field number order and then wire order.
     *
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public void encode(ProtobufWriter writer) throws IOException {
        for (List<EncodedField> occurrences : fields.values()) {
            for (EncodedField field : occurrences) {
                field.encode(writer);
            }
        }
    }

    /**
     * Returns the number of bytes {@link #encode} writes.
     *
     * @return the encoded size
     */
    public int getSerializedSize() {
        int size = 0;
        for (List<EncodedField> occurrences : fields.values()) {
            for (EncodedField field : occurrences) {
                size += field.getSerializedSize();
            }
        }
        return size;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof UnknownFieldStore && fields.equals(((UnknownFieldStore) other).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "UnknownFieldStore" + fields;
    }

}

/*
 * MessageCodec.java
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
import java.text.MessageFormat;
import java.util.List;
import java.util.function.Supplier;

import org.bluezoo.protobuf.InvalidWireTypeException;
import org.bluezoo.protobuf.Message;
import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.SchemaMismatchException;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.WireType;

/**
 * Codec for embedded message fields.
 *
 * <p>An embedded message is written as a length-delimited field whose
 * content is the message's bare encoding. Messages are never packed.
 *
 * <p>A singular message field that occurs more than once is merged: the
 * contents of all occurrences are decoded as one concatenated encoding, so
 * later scalar values win, repeated fields accumulate and nested messages
 * merge recursively. The default value of an absent message field is
 * {@code null}.
 *
 * <p>Occurrences that are not length-delimited are rejected with
 * {@link InvalidWireTypeException}. Content that does not decode as the
 * message type is reported as {@link SchemaMismatchException}, as is
 * nesting deeper than {@link Message#MAX_DEPTH}.
 *
 * @param <M> the message type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MessageCodec<M extends Message<M>> implements FieldCodec<M> {

    /**
     * Nesting depth of the embedded message being decoded on each thread.
     */
    private static final ThreadLocal<int[]> DEPTH = new ThreadLocal<int[]>() {
        @Override
        protected int[] initialValue() {
            return new int[1];
        }
    };

    private final Supplier<M> factory;

    /**
     * Creates a codec for a message type.
     *
     * @param factory creates empty instances of the message type
     */
    public MessageCodec(Supplier<M> factory) {
        if (factory == null) {
            throw new NullPointerException("factory");
        }
        this.factory = factory;
    }

    /**
     * Creates a codec for a message type.
     *
     * @param factory creates empty instances of the message type
     * @param <M> the message type
     * @return the codec
     */
    public static <M extends Message<M>> MessageCodec<M> of(Supplier<M> factory) {
        return new MessageCodec<M>(factory);
    }

    /**
     * Returns a new empty instance of the message type.
     *
     * @return the new message
     */
    public M newInstance() {
        return factory.get();
    }

    @Override
    public M defaultValue() {
        return null;
    }

    @Override
    public WireType getWireType() {
        return WireType.LEN;
    }

    @Override
    public boolean isPackable() {
        return false;
    }

    /**
     * Returns a deep copy of the message.
     *
     * @param value the message, or null
     * @return a new instance holding the same fields, or null
     */
    @Override
    public M copyValue(M value) {
        if (value == null) {
            return null;
        }
        M copy = factory.get();
        copy.mergeFrom(value);
        return copy;
    }

    /**
     * Writes the message as an embedded field. A null message is absent and
     * writes nothing.
     */
    @Override
    public void encodeField(int fieldNumber, M value, ProtobufWriter writer) throws IOException {
        if (value != null) {
            value.encodeAsField(fieldNumber, writer);
        }
    }

    @Override
    public void encodeRepeatedField(int fieldNumber, List<? extends M> values, ProtobufWriter writer)
            throws IOException {
        for (M value : values) {
            if (value == null) {
                throw new NullPointerException("message element of field " + fieldNumber);
            }
            value.encodeAsField(fieldNumber, writer);
        }
    }

    @Override
    public M decodeField(List<EncodedField> occurrences) throws ProtobufException {
        if (occurrences.isEmpty()) {
            return null;
        }
        byte[] content;
        if (occurrences.size() == 1) {
            content = contentOf(occurrences.get(0));
        } else {
            byte[][] parts = new byte[occurrences.size()][];
            int length = 0;
            for (int i = 0; i < parts.length; i++) {
                parts[i] = contentOf(occurrences.get(i));
                length += parts[i].length;
            }
            content = new byte[length];
            int offset = 0;
            for (byte[] part : parts) {
                System.arraycopy(part, 0, content, offset, part.length);
                offset += part.length;
            }
        }
        return decodeContent(occurrences.get(0).getFieldNumber(), content);
    }

    @Override
    public void decodeRepeatedField(List<EncodedField> occurrences, List<? super M> dest)
            throws ProtobufException {
        for (EncodedField occurrence : occurrences) {
            dest.add(decodeContent(occurrence.getFieldNumber(), contentOf(occurrence)));
        }
    }

    private byte[] contentOf(EncodedField occurrence) throws ProtobufException {
        WireType actual = occurrence.getWireType();
        if (actual != WireType.LEN) {
            String msg = MessageFormat.format(ScalarCodec.L10N.getString("err.wire_type_mismatch"),
                    Integer.toString(occurrence.getFieldNumber()), actual, "message", WireType.LEN);
            throw new InvalidWireTypeException(msg, actual.getCode());
        }
        return occurrence.getContent();
    }

    private M decodeContent(int fieldNumber, byte[] content) throws ProtobufException {
        M message = factory.get();
        int[] depth = DEPTH.get();
        if (depth[0] >= Message.MAX_DEPTH) {
            String msg = MessageFormat.format(ScalarCodec.L10N.getString("err.too_deep"),
                    Integer.toString(fieldNumber), message.getClass().getSimpleName(),
                    Integer.toString(Message.MAX_DEPTH));
            throw new SchemaMismatchException(msg);
        }
        depth[0]++;
        try {
            message.decode(content);
        } catch (SchemaMismatchException e) {
            throw e;
        } catch (ProtobufException e) {
            String msg = MessageFormat.format(ScalarCodec.L10N.getString("err.embedded_mismatch"),
                    Integer.toString(fieldNumber), message.getClass().getSimpleName());
            throw new SchemaMismatchException(msg, e);
        } finally {
            depth[0]--;
        }
        return message;
    }

    @Override
    public String toString() {
        return "message";
    }

}

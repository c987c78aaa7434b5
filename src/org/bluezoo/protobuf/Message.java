/*
 * Message.java
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
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.protobuf.wire.ByteBufferChannel;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufReader;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.WireType;

/**
 * Base class of all message types.
 *
 * <p>A message holds typed fields, declared by its subclass, and an
 * {@link UnknownFieldStore} of raw fields the subclass did not recognise.
 * The lifecycle methods here are final and call the subclass hooks in a fixed
 * order:
 * <ul>
 * <li>{@link #encode(ProtobufWriter)} calls {@link #writeFields} and then
 * writes the unknown fields, so fields from newer schema versions survive a
 * decode and re-encode;</li>
 * <li>{@link #decode(ProtobufReader)} clears the message, reads every field
 * into the store and calls {@link #readFields}, where the subclass claims the
 * fields it knows;</li>
 * <li>{@link #mergeFrom} calls {@link #mergeFields} and then appends the
 * source's unknown fields;</li>
 * <li>{@link #clear} calls {@link #clearFields} and then empties the store.</li>
 * </ul>
 *
 * <p>A generated message class looks like this:
 * <pre>
 * public final class Person extends Message&lt;Person&gt; {
 *
 *     private String name = "";
 *     private final RepeatedField&lt;Integer&gt; ids = RepeatedField.of(FieldCodecs.INT32);
 *
 *     protected void writeFields(ProtobufWriter writer) throws IOException {
 *         if (!name.isEmpty()) {
 *             FieldCodecs.STRING.encodeField(1, name, writer);
 *         }
 *         ids.encodeTo(2, writer);
 *     }
 *
 *     protected void readFields(UnknownFieldStore fields) throws ProtobufException {
 *         name = fields.decodeField(1, FieldCodecs.STRING);
 *         ids.decodeFrom(fields, 2);
 *     }
 *     ...
 * }
 * </pre>
 *
 * <p>Messages are not thread-safe.
 *
 * @param <M> the concrete message type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Message<M extends Message<M>> {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.protobuf.L10N");

    private static final Logger LOGGER = Logger.getLogger(Message.class.getName());

    /**
     * The largest length prefix {@link #decodeDelimited(ProtobufReader)}
     * accepts.
     */
    public static final int MAX_DELIMITED_LENGTH =
            Integer.getInteger("bluezoo.protobuf.maxDelimitedLength", 64 * 1024 * 1024);

    /**
     * The deepest nesting of embedded messages that decoding accepts. The
     * outermost message is at depth 0.
     */
    public static final int MAX_DEPTH = Integer.getInteger("bluezoo.protobuf.maxDepth", 100);

    /**
     * Initial capacity of the buffers used to encode messages in memory.
     */
    static final int BUFFER_SIZE = Integer.getInteger("bluezoo.protobuf.bufferSize", 256);

    private final UnknownFieldStore unknownFields = new UnknownFieldStore();

    // -- Hooks --

    /**
     * Writes the typed fields of this message, in declaration order.
     * Fields holding their default value are normally omitted.
     *
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    protected abstract void writeFields(ProtobufWriter writer) throws IOException;

    /**
     * Claims the typed fields of this message from the decoded fields.
     * Anything left in the store after this call is retained as unknown.
     *
     * @param fields the decoded fields
     * @throws ProtobufException if a field cannot be decoded as its type
     */
    protected abstract void readFields(UnknownFieldStore fields) throws ProtobufException;

    /**
     * Merges the typed fields of another message into this one: set scalars
     * overwrite, repeated fields append, embedded messages merge.
     *
     * @param source the message to merge from, never this message
     */
    protected abstract void mergeFields(M source);

    /**
     * Resets the typed fields of this message to their defaults.
     */
    protected abstract void clearFields();

    // -- Lifecycle --

    /**
     * Resets every field, including unknown fields.
     */
    public final void clear() {
        clearFields();
        unknownFields.clear();
    }

    /**
     * Returns true if the given field was decoded but not claimed.
     *
     * @param fieldNumber the field number
     * @return whether the unknown field is present
     */
    public final boolean hasUnknownField(int fieldNumber) {
        return unknownFields.hasField(fieldNumber);
    }

    /**
     * Returns the store of unknown fields. The store is live: changes to it
     * change this message.
     *
     * @return the unknown fields
     */
    public final UnknownFieldStore getUnknownFields() {
        return unknownFields;
    }

    /**
     * Merges another message of the same type into this one.
     *
     * @param source the message to merge from
     * @throws IllegalArgumentException if the source is this message
     */
    public final void mergeFrom(M source) {
        if (source == this) {
            throw new IllegalArgumentException(L10N.getString("err.merge_self"));
        }
        mergeFields(source);
        unknownFields.mergeFrom(source.getUnknownFields());
        if (LOGGER.isLoggable(Level.FINER)) {
            String msg = MessageFormat.format(L10N.getString("debug.merged"),
                    getClass().getSimpleName(), Integer.toString(source.getUnknownFields().size()));
            LOGGER.finer(msg);
        }
    }

    /**
     * Replaces the contents of this message with a copy of another.
     *
     * @param source the message to copy
     */
    public final void copyFrom(M source) {
        if (source == this) {
            return;
        }
        clear();
        mergeFrom(source);
    }

    // -- Encoding --

    /**
     * Writes the bare encoding of this message: typed fields, then unknown
     * fields in ascending field number order.
     *
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public final void encode(ProtobufWriter writer) throws IOException {
        writeFields(writer);
        unknownFields.encode(writer);
    }

    /**
     * Writes the bare encoding of this message to a channel.
     *
     * @param channel the channel
     * @throws IOException if an I/O error occurs
     */
    public final void encode(WritableByteChannel channel) throws IOException {
        encode(new ProtobufWriter(channel));
    }

    /**
     * Returns the bare encoding of this message.
     *
     * @return the encoded bytes
     */
    public final byte[] toByteArray() {
        ByteBufferChannel buffer = new ByteBufferChannel(BUFFER_SIZE);
        try {
            encode(new ProtobufWriter(buffer));
        } catch (IOException e) {
            // ByteBufferChannel never fails
            throw new IllegalStateException(e);
        }
        return buffer.toByteArray();
    }

    /**
     * Returns the length of the bare encoding of this message.
     *
     * @return the encoded size in bytes
     */
    public final int getSerializedSize() {
        return toByteArray().length;
    }

    /**
     * Writes this message preceded by its varint byte length.
     *
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public final void encodeDelimited(ProtobufWriter writer) throws IOException {
        ByteBufferChannel buffer = new ByteBufferChannel(BUFFER_SIZE);
        encode(new ProtobufWriter(buffer));
        writer.writeLengthDelimited(buffer.toByteBuffer());
    }

    /**
     * Writes this message to a channel preceded by its varint byte length.
     *
     * @param channel the channel
     * @throws IOException if an I/O error occurs
     */
    public final void encodeDelimited(WritableByteChannel channel) throws IOException {
        encodeDelimited(new ProtobufWriter(channel));
    }

    /**
     * Writes this message as an embedded field of an enclosing message.
     *
     * @param fieldNumber the field number in the enclosing message
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public final void encodeAsField(int fieldNumber, ProtobufWriter writer) throws IOException {
        writer.writeTag(fieldNumber, WireType.LEN);
        encodeDelimited(writer);
    }

    // -- Decoding --

    /**
     * Replaces the contents of this message with the fields read from the
     * reader, which is consumed to its end.
     *
     * @param reader the reader
     * @throws ProtobufException if the data is not a valid encoding of this
     *         message type
     */
    public final void decode(ProtobufReader reader) throws ProtobufException {
        clear();
        int count = 0;
        while (reader.hasRemaining()) {
            unknownFields.add(EncodedField.decode(reader));
            count++;
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(L10N.getString("debug.decoded"),
                    getClass().getSimpleName(), Integer.toString(count),
                    Integer.toString(unknownFields.size()));
            LOGGER.finest(msg);
        }
        readFields(unknownFields);
    }

    /**
     * Replaces the contents of this message with the fields in the buffer's
     * remaining bytes.
     *
     * @param buffer the buffer
     * @throws ProtobufException if the data is not a valid encoding
     */
    public final void decode(ByteBuffer buffer) throws ProtobufException {
        decode(new ProtobufReader(buffer));
    }

    /**
     * Replaces the contents of this message with the fields in the array.
     *
     * @param data the encoded bytes
     * @throws ProtobufException if the data is not a valid encoding
     */
    public final void decode(byte[] data) throws ProtobufException {
        decode(new ProtobufReader(data));
    }

    /**
     * Reads one length-prefixed message. Once the length prefix has been
     * accepted the reader is left positioned after the frame, whether or
     * not its contents decode.
     *
     * @param reader the reader
     * @throws TruncatedInputException if the prefix is incomplete or
     *         announces more bytes than remain
     * @throws SchemaMismatchException if the prefix exceeds
     *         {@link #MAX_DELIMITED_LENGTH} or the framed bytes do not
     *         decode as this message type
     * @throws ProtobufException if the prefix is malformed
     */
    public final void decodeDelimited(ProtobufReader reader) throws ProtobufException {
        long length = reader.readVarint();
        if (length < 0 || length > MAX_DELIMITED_LENGTH) {
            String msg = MessageFormat.format(L10N.getString("err.delimited_too_long"),
                    Long.toUnsignedString(length), Integer.toString(MAX_DELIMITED_LENGTH));
            throw new SchemaMismatchException(msg);
        }
        if (length > reader.remaining()) {
            String msg = MessageFormat.format(L10N.getString("err.truncated_frame"),
                    Long.toString(length), Integer.toString(reader.remaining()));
            throw new TruncatedInputException(msg);
        }
        ProtobufReader frame = reader.limit((int) length);
        try {
            decode(frame);
        } catch (SchemaMismatchException e) {
            throw e;
        } catch (ProtobufException e) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_frame"),
                    getClass().getSimpleName(), Long.toString(length));
            throw new SchemaMismatchException(msg, e);
        }
    }

    /**
     * Reads one length-prefixed message from the buffer's remaining bytes,
     * advancing the buffer past it.
     *
     * @param buffer the buffer
     * @throws ProtobufException if the frame cannot be decoded
     */
    public final void decodeDelimited(ByteBuffer buffer) throws ProtobufException {
        decodeDelimited(new ProtobufReader(buffer));
    }

}

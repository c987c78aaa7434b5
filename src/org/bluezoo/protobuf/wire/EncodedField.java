/*
 * EncodedField.java
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

package org.bluezoo.protobuf.wire;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.Arrays;

import org.bluezoo.protobuf.ProtobufException;

/**
 * One occurrence of a field exactly as it was read from the wire.
 *
 * <p>An encoded field holds the tag and the raw payload bytes, not yet
 * interpreted as any particular type. The payload is framed according to
 * the wire type:
 * <ul>
 *   <li>VARINT: the varint bytes</li>
 *   <li>I64, I32: the 8 or 4 fixed bytes</li>
 *   <li>LEN: the varint length prefix followed by the content</li>
 * </ul>
 * <p>Because the payload is kept verbatim, {@link #encode} reproduces the
 * original bytes exactly. Instances are immutable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class EncodedField {

    private final Tag tag;
    private final byte[] payload;

    /**
     * Creates an encoded field from a tag and its framed payload.
     *
     * @param tag the tag
     * @param payload the payload bytes, framed as described above
     * @throws IllegalArgumentException if the payload is not exactly one
     *         value framed for the tag's wire type
     */
    public EncodedField(Tag tag, byte[] payload) {
        if (tag == null) {
            throw new NullPointerException("tag");
        }
        if (!isFramed(tag.getWireType(), payload)) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.bad_framing"),
                    tag, Integer.toString(payload.length));
            throw new IllegalArgumentException(msg);
        }
        this.tag = tag;
        this.payload = payload.clone();
    }

    private static boolean isFramed(WireType wireType, byte[] payload) {
        switch (wireType) {
            case VARINT:
                return varintSize(payload) == payload.length;
            case I32:
                return payload.length == 4;
            case I64:
                return payload.length == 8;
            case LEN:
                int size = varintSize(payload);
                if (size < 0) {
                    return false;
                }
                long length = 0;
                for (int i = 0; i < size; i++) {
                    length |= (long) (payload[i] & 0x7F) << (7 * i);
                }
                return length == payload.length - size;
            default:
                return false;
        }
    }

    /**
     * Returns the size of the varint at the start of the bytes, or -1 if
     * there is no complete varint within {@link Varint#MAX_SIZE} bytes.
     */
    private static int varintSize(byte[] bytes) {
        int max = Math.min(bytes.length, Varint.MAX_SIZE);
        for (int i = 0; i < max; i++) {
            if ((bytes[i] & 0x80) == 0) {
                return i + 1;
            }
        }
        return -1;
    }

    public Tag getTag() {
        return tag;
    }

    public int getFieldNumber() {
        return tag.getFieldNumber();
    }

    public WireType getWireType() {
        return tag.getWireType();
    }

    /**
     * Returns a copy of the payload bytes.
     *
     * @return the payload, including any length prefix
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Returns the length of the payload in bytes.
     *
     * @return the payload length
     */
    public int getPayloadLength() {
        return payload.length;
    }

    /**
     * Returns a reader over a read-only view of the payload.
     *
     * @return a new reader positioned at the start of the payload
     */
    public ProtobufReader openPayload() {
        return new ProtobufReader(ByteBuffer.wrap(payload).asReadOnlyBuffer());
    }

    /**
     * Returns the content of a length-delimited field, without its prefix.
     *
     * @return the content bytes
     * @throws ProtobufException if this is not a length-delimited field or
     *         the prefix does not match the payload
     */
    public byte[] getContent() throws ProtobufException {
        if (tag.getWireType() != WireType.LEN) {
            String msg = MessageFormat.format(Varint.L10N.getString("err.not_length_delimited"), tag);
            throw new ProtobufException(msg);
        }
        return openPayload().readLengthDelimited();
    }

    /**
     * Returns the number of bytes {@link #encode} writes.
     *
     * @return the tag size plus the payload length
     */
    public int getSerializedSize() {
        return Varint.size(tag.toVarint()) + payload.length;
    }

    /**
     * Writes the tag followed by the payload, verbatim.
     *
     * @param writer the writer
     * @throws IOException if an I/O error occurs
     */
    public void encode(ProtobufWriter writer) throws IOException {
        writer.writeTag(tag);
        writer.writeRawBytes(payload);
    }

    /**
     * Reads one field occurrence: a tag, then a payload sized according to
     * the tag's wire type.
     *
     * @param reader the reader
     * @return the encoded field
     * @throws ProtobufException if the input is truncated or the tag invalid
     */
    public static EncodedField decode(ProtobufReader reader) throws ProtobufException {
        Tag tag = reader.readTag();
        int start = reader.position();
        switch (tag.getWireType()) {
            case VARINT:
                reader.readVarint();
                break;
            case I64:
                reader.skip(8);
                break;
            case I32:
                reader.skip(4);
                break;
            case LEN:
                reader.skip(reader.readLength());
                break;
            default:
                throw new IllegalStateException(tag.getWireType().name());
        }
        return new EncodedField(tag, reader.copyBytes(start, reader.position()));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EncodedField)) {
            return false;
        }
        EncodedField field = (EncodedField) other;
        return tag.equals(field.tag) && Arrays.equals(payload, field.payload);
    }

    @Override
    public int hashCode() {
        return tag.hashCode() * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "EncodedField[" + tag + ", " + payload.length + " bytes]";
    }

}

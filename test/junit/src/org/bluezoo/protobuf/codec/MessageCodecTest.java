package org.bluezoo.protobuf.codec;

import org.junit.Test;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.bluezoo.protobuf.Address;
import org.bluezoo.protobuf.InvalidWireTypeException;
import org.bluezoo.protobuf.Message;
import org.bluezoo.protobuf.ProtobufException;
import org.bluezoo.protobuf.SchemaMismatchException;
import org.bluezoo.protobuf.UnknownFieldStore;
import org.bluezoo.protobuf.wire.ByteBufferChannel;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufReader;
import org.bluezoo.protobuf.wire.ProtobufWriter;
import org.bluezoo.protobuf.wire.Varint;
import org.bluezoo.protobuf.wire.WireType;

/**
 * JUnit 4 test class for MessageCodec.
 */
public class MessageCodecTest {

    /**
     * Message whose field 1 holds another of itself.
     */
    static final class Node extends Message<Node> {

        static final MessageCodec<Node> CODEC = MessageCodec.of(Node::new);

        Node child;

        @Override
        protected void writeFields(ProtobufWriter writer) throws IOException {
            CODEC.encodeField(1, child, writer);
        }

        @Override
        protected void readFields(UnknownFieldStore fields) throws ProtobufException {
            child = fields.decodeField(1, CODEC);
        }

        @Override
        protected void mergeFields(Node source) {
            if (source.child != null) {
                if (child == null) {
                    child = new Node();
                }
                child.mergeFrom(source.child);
            }
        }

        @Override
        protected void clearFields() {
            child = null;
        }

    }

    /**
     * Encodes a chain of nodes with the given number of embedded levels
     * below the outermost node. Built from the innermost level outwards.
     */
    private static byte[] nested(int levels) {
        byte[] buf = new byte[levels * 4];
        int pos = buf.length;
        for (int i = 0; i < levels; i++) {
            byte[] prefix = Varint.encode(buf.length - pos);
            pos -= prefix.length;
            System.arraycopy(prefix, 0, buf, pos, prefix.length);
            buf[--pos] = 0x0A;
        }
        return Arrays.copyOfRange(buf, pos, buf.length);
    }

    private static int depthOf(Node node) {
        int depth = 0;
        for (Node n = node.child; n != null; n = n.child) {
            depth++;
        }
        return depth;
    }

    private static List<EncodedField> fields(byte[] data) throws ProtobufException {
        List<EncodedField> fields = new ArrayList<>();
        ProtobufReader reader = new ProtobufReader(data);
        while (reader.hasRemaining()) {
            fields.add(EncodedField.decode(reader));
        }
        return fields;
    }

    private static byte[] encode(int fieldNumber, Address... values) throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        Address.CODEC.encodeRepeatedField(fieldNumber, Arrays.asList(values), new ProtobufWriter(channel));
        return channel.toByteArray();
    }

    @Test
    public void testEncodeEmbedded() throws Exception {
        // Field 3 holding { street: "x" } = 1a 03 0a 01 78
        assertArrayEquals(new byte[] { 0x1A, 0x03, 0x0A, 0x01, 'x' }, encode(3, new Address("x", 0)));
    }

    @Test
    public void testEncodeNullWritesNothing() throws Exception {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        Address.CODEC.encodeField(3, null, new ProtobufWriter(channel));
        assertEquals(0, channel.size());
    }

    @Test
    public void testEncodeEmptyMessage() throws Exception {
        assertArrayEquals(new byte[] { 0x1A, 0x00 }, encode(3, new Address()));
    }

    @Test
    public void testDefaultIsNull() throws Exception {
        assertNull(Address.CODEC.defaultValue());
        assertNull(Address.CODEC.decodeField(Collections.<EncodedField>emptyList()));
        assertFalse(Address.CODEC.isPackable());
        assertEquals(WireType.LEN, Address.CODEC.getWireType());
    }

    @Test
    public void testSingularOccurrencesMerge() throws Exception {
        // Two occurrences of a singular message field merge into one value
        byte[] data = encode(3, new Address("Main St", 0), new Address("", 4));

        Address merged = Address.CODEC.decodeField(fields(data));

        assertEquals("Main St", merged.getStreet());
        assertEquals(4, merged.getFloor());
    }

    @Test
    public void testLaterScalarWinsInMerge() throws Exception {
        byte[] data = encode(3, new Address("Old", 1), new Address("New", 0));

        Address merged = Address.CODEC.decodeField(fields(data));

        assertEquals("New", merged.getStreet());
        assertEquals(1, merged.getFloor());
    }

    @Test
    public void testRepeatedOccurrences() throws Exception {
        byte[] data = encode(6, new Address("a", 1), new Address("b", 2), new Address());
        List<Address> values = new ArrayList<>();

        Address.CODEC.decodeRepeatedField(fields(data), values);

        assertEquals(Arrays.asList(new Address("a", 1), new Address("b", 2), new Address()), values);
    }

    @Test(expected = InvalidWireTypeException.class)
    public void testVarintOccurrenceRejected() throws Exception {
        Address.CODEC.decodeField(fields(new byte[] { 0x18, 0x01 }));
    }

    @Test(expected = SchemaMismatchException.class)
    public void testContentNotAMessage() throws Exception {
        // Field 3 whose content is a lone tag byte with no payload
        Address.CODEC.decodeField(fields(new byte[] { 0x1A, 0x01, 0x08 }));
    }

    @Test(expected = SchemaMismatchException.class)
    public void testContentWithWrongFieldType() throws Exception {
        // street (field 1) carried as a varint
        Address.CODEC.decodeField(fields(new byte[] { 0x1A, 0x02, 0x08, 0x01 }));
    }

    // -- Nesting --

    @Test
    public void testNestingAtLimit() throws Exception {
        Node root = new Node();
        root.decode(nested(Message.MAX_DEPTH));
        assertEquals(Message.MAX_DEPTH, depthOf(root));
    }

    @Test(expected = SchemaMismatchException.class)
    public void testNestingBeyondLimit() throws Exception {
        new Node().decode(nested(Message.MAX_DEPTH + 1));
    }

    @Test
    public void testDeepNestingDoesNotOverflowStack() throws Exception {
        try {
            new Node().decode(nested(20000));
            fail("20000 nested levels accepted");
        } catch (SchemaMismatchException e) {
            assertNotNull(e.getMessage());
        }
        // The depth is released after a failure
        Node root = new Node();
        root.decode(nested(3));
        assertEquals(3, depthOf(root));
    }

    @Test(expected = NullPointerException.class)
    public void testNullElement() throws Exception {
        encode(6, new Address(), null);
    }

    @Test
    public void testCopyValue() {
        Address original = new Address("a", 1);
        Address copy = Address.CODEC.copyValue(original);
        assertNotSame(original, copy);
        assertEquals(original, copy);
        assertNull(Address.CODEC.copyValue(null));
    }

}

package org.bluezoo.protobuf;

import org.junit.Test;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.bluezoo.protobuf.codec.FieldCodecs;
import org.bluezoo.protobuf.wire.ByteBufferChannel;
import org.bluezoo.protobuf.wire.EncodedField;
import org.bluezoo.protobuf.wire.ProtobufReader;
import org.bluezoo.protobuf.wire.ProtobufWriter;

/**
 * JUnit 4 test class for RepeatedField.
 */
public class RepeatedFieldTest {

    private static byte[] encode(RepeatedField<?> field, int fieldNumber) throws Exception {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        field.encodeTo(fieldNumber, new ProtobufWriter(channel));
        return channel.toByteArray();
    }

    private static UnknownFieldStore store(byte[] data) throws ProtobufException {
        UnknownFieldStore store = new UnknownFieldStore();
        ProtobufReader reader = new ProtobufReader(data);
        while (reader.hasRemaining()) {
            store.add(EncodedField.decode(reader));
        }
        return store;
    }

    @Test
    public void testListOperations() {
        RepeatedField<Integer> field = RepeatedField.of(FieldCodecs.INT32);
        field.add(1);
        field.add(3);
        field.add(1, 2);
        field.set(2, 4);

        assertEquals(Arrays.asList(1, 2, 4), field);
        assertEquals(Integer.valueOf(2), field.remove(1));
        assertEquals(2, field.size());
        assertSame(FieldCodecs.INT32, field.getCodec());
    }

    @Test(expected = NullPointerException.class)
    public void testNullRejected() {
        RepeatedField.of(FieldCodecs.STRING).add(null);
    }

    @Test(expected = NullPointerException.class)
    public void testNullSetRejected() {
        RepeatedField<String> field = RepeatedField.of(FieldCodecs.STRING);
        field.add("a");
        field.set(0, null);
    }

    @Test
    public void testEncodePacked() throws Exception {
        RepeatedField<Integer> field = RepeatedField.of(FieldCodecs.UINT32);
        field.addAll(Arrays.asList(1, 2, 3));

        assertArrayEquals(new byte[] { 0x22, 0x03, 0x01, 0x02, 0x03 }, encode(field, 4));
    }

    @Test
    public void testEncodeEmpty() throws Exception {
        assertEquals(0, encode(RepeatedField.of(FieldCodecs.UINT32), 4).length);
    }

    @Test
    public void testEncodeMessagesNeverPacked() throws Exception {
        RepeatedField<Address> field = RepeatedField.ofMessages(Address::new);
        field.add(new Address("a", 0));
        field.add(new Address());

        assertArrayEquals(new byte[] { 0x32, 0x03, 0x0A, 0x01, 'a', 0x32, 0x00 }, encode(field, 6));
    }

    @Test
    public void testDecodeReplacesAndClaims() throws Exception {
        RepeatedField<Integer> field = RepeatedField.of(FieldCodecs.UINT32);
        field.add(99);
        UnknownFieldStore store = store(new byte[] { 0x22, 0x02, 0x05, 0x06, 0x20, 0x07, 0x08, 0x01 });

        field.decodeFrom(store, 4);

        assertEquals(Arrays.asList(5, 6, 7), field);
        assertFalse(store.hasField(4));
        assertTrue(store.hasField(1));
    }

    @Test
    public void testDecodeAbsentClears() throws Exception {
        RepeatedField<String> field = RepeatedField.of(FieldCodecs.STRING);
        field.add("stale");

        field.decodeFrom(new UnknownFieldStore(), 5);

        assertTrue(field.isEmpty());
    }

    @Test
    public void testMergeAppends() {
        RepeatedField<Integer> a = RepeatedField.of(FieldCodecs.UINT32);
        a.add(1);
        RepeatedField<Integer> b = RepeatedField.of(FieldCodecs.UINT32);
        b.addAll(Arrays.asList(2, 3));

        a.mergeFrom(b);

        assertEquals(Arrays.asList(1, 2, 3), a);
        assertEquals(Arrays.asList(2, 3), b);
    }

    @Test
    public void testMergeCopiesMessages() {
        RepeatedField<Address> a = RepeatedField.ofMessages(Address::new);
        RepeatedField<Address> b = RepeatedField.ofMessages(Address::new);
        b.add(new Address("a", 1));

        a.mergeFrom(b);
        b.get(0).setStreet("changed");

        assertEquals(1, a.size());
        assertNotSame(b.get(0), a.get(0));
        assertEquals("a", a.get(0).getStreet());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMergeSelf() {
        RepeatedField<Integer> field = RepeatedField.of(FieldCodecs.UINT32);
        field.mergeFrom(field);
    }

}

package org.bluezoo.protobuf.wire;

import org.junit.Test;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

import org.bluezoo.protobuf.InvalidWireTypeException;
import org.bluezoo.protobuf.ProtobufException;

/**
 * JUnit 4 test class for Tag and WireType.
 */
public class TagTest {

    @Test
    public void testToVarint() {
        assertEquals(0x08L, new Tag(1, WireType.VARINT).toVarint());
        assertEquals(0x22L, new Tag(4, WireType.LEN).toVarint());
        assertEquals(0x11L, new Tag(2, WireType.I64).toVarint());
        assertEquals(0x1DL, new Tag(3, WireType.I32).toVarint());
    }

    @Test
    public void testEncode() throws Exception {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        new Tag(16, WireType.LEN).encode(new ProtobufWriter(channel));
        // (16 << 3) | 2 = 130
        assertArrayEquals(new byte[] { (byte) 0x82, 0x01 }, channel.toByteArray());
    }

    @Test
    public void testRoundTrip() throws Exception {
        int[] fieldNumbers = { 1, 2, 15, 16, 2047, 2048, 100000, Tag.MAX_FIELD_NUMBER };
        for (int fieldNumber : fieldNumbers) {
            for (WireType wireType : WireType.values()) {
                Tag tag = new Tag(fieldNumber, wireType);
                ByteBufferChannel channel = new ByteBufferChannel(16);
                tag.encode(new ProtobufWriter(channel));
                ProtobufReader reader = new ProtobufReader(channel.toByteArray());
                assertEquals(tag, Tag.decode(reader));
                assertFalse(reader.hasRemaining());
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFieldNumberZero() {
        new Tag(0, WireType.VARINT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFieldNumberTooLarge() {
        new Tag(Tag.MAX_FIELD_NUMBER + 1, WireType.VARINT);
    }

    @Test
    public void testDecodeGroupWireType() throws Exception {
        // Field 1, wire type 3 (start group)
        try {
            Tag.fromVarint(0x0B);
            fail("group wire type accepted");
        } catch (InvalidWireTypeException e) {
            assertEquals(3, e.getWireType());
        }
    }

    @Test
    public void testDecodeUndefinedWireTypes() throws Exception {
        for (int code : new int[] { 3, 4, 6, 7 }) {
            try {
                Tag.fromVarint((1 << 3) | code);
                fail("wire type " + code + " accepted");
            } catch (InvalidWireTypeException e) {
                assertEquals(code, e.getWireType());
            }
        }
    }

    @Test(expected = ProtobufException.class)
    public void testDecodeFieldNumberZero() throws Exception {
        Tag.decode(new ProtobufReader(new byte[] { 0x00 }));
    }

    @Test(expected = ProtobufException.class)
    public void testDecodeTagTooLarge() throws Exception {
        Tag.fromVarint(1L << 32);
    }

    @Test
    public void testWireTypeCodes() throws Exception {
        assertEquals(WireType.VARINT, WireType.fromCode(0));
        assertEquals(WireType.I64, WireType.fromCode(1));
        assertEquals(WireType.LEN, WireType.fromCode(2));
        assertEquals(WireType.I32, WireType.fromCode(5));
        assertEquals(5, WireType.I32.getCode());
    }

    @Test
    public void testEquality() {
        Tag a = new Tag(4, WireType.LEN);
        Tag b = new Tag(4, WireType.LEN);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Tag(4, WireType.VARINT));
        assertNotEquals(a, new Tag(5, WireType.LEN));
        assertEquals("4:LEN", a.toString());
    }

}

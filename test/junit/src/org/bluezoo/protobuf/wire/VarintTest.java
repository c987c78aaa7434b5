package org.bluezoo.protobuf.wire;

import org.junit.Test;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.nio.ByteBuffer;

import org.bluezoo.protobuf.MalformedVarintException;
import org.bluezoo.protobuf.TruncatedInputException;

/**
 * JUnit 4 test class for Varint.
 */
public class VarintTest {

    private static final long[] VALUES = {
        0L, 1L, 127L, 128L, 150L, 300L, 16383L, 16384L,
        Integer.MAX_VALUE, 0xFFFFFFFFL, 1L << 35, 1L << 62,
        Long.MAX_VALUE, Long.MIN_VALUE, -1L, -300L
    };

    // -- Encoding --

    @Test
    public void testEncode300() {
        assertArrayEquals(new byte[] { (byte) 0xAC, 0x02 }, Varint.encode(300));
    }

    @Test
    public void testEncodeZero() {
        assertArrayEquals(new byte[] { 0x00 }, Varint.encode(0));
    }

    @Test
    public void testEncodeNegativeTakesTenBytes() {
        byte[] data = Varint.encode(-1L);
        assertEquals(10, data.length);
        for (int i = 0; i < 9; i++) {
            assertEquals((byte) 0xFF, data[i]);
        }
        assertEquals((byte) 0x01, data[9]);
    }

    @Test
    public void testEncodeIntoBuffer() {
        ByteBuffer buffer = ByteBuffer.allocate(16);
        assertEquals(2, Varint.encode(150, buffer));
        buffer.flip();
        assertEquals((byte) 0x96, buffer.get());
        assertEquals((byte) 0x01, buffer.get());
    }

    // -- Size --

    @Test
    public void testSizeMatchesBitLength() {
        for (long value : VALUES) {
            int bits = Math.max(1, Long.SIZE - Long.numberOfLeadingZeros(value));
            int expected = (bits + 6) / 7;
            assertEquals("size of " + value, expected, Varint.size(value));
            assertEquals("encoded length of " + value, expected, Varint.encode(value).length);
        }
    }

    @Test
    public void testSizeBoundaries() {
        assertEquals(1, Varint.size(127));
        assertEquals(2, Varint.size(128));
        assertEquals(2, Varint.size(16383));
        assertEquals(3, Varint.size(16384));
        assertEquals(9, Varint.size(Long.MAX_VALUE));
        assertEquals(10, Varint.size(Long.MIN_VALUE));
    }

    // -- Decoding --

    @Test
    public void testRoundTrip() throws Exception {
        for (long value : VALUES) {
            ByteBuffer buffer = ByteBuffer.wrap(Varint.encode(value));
            assertEquals(value, Varint.decode(buffer));
            assertEquals(0, buffer.remaining());
        }
    }

    @Test
    public void testDecodeAdvancesPosition() throws Exception {
        ByteBuffer buffer = ByteBuffer.wrap(new byte[] { (byte) 0xAC, 0x02, 0x05 });
        assertEquals(300L, Varint.decode(buffer));
        assertEquals(2, buffer.position());
        assertEquals(5L, Varint.decode(buffer));
    }

    @Test
    public void testDecodeNonMinimal() throws Exception {
        // Redundant continuation groups are accepted
        ByteBuffer buffer = ByteBuffer.wrap(new byte[] { (byte) 0x81, (byte) 0x80, 0x00 });
        assertEquals(1L, Varint.decode(buffer));
    }

    @Test(expected = TruncatedInputException.class)
    public void testDecodeEmpty() throws Exception {
        Varint.decode(ByteBuffer.allocate(0));
    }

    @Test(expected = TruncatedInputException.class)
    public void testDecodeTruncated() throws Exception {
        Varint.decode(ByteBuffer.wrap(new byte[] { (byte) 0x80, (byte) 0x80 }));
    }

    @Test(expected = MalformedVarintException.class)
    public void testDecodeTooLong() throws Exception {
        byte[] data = new byte[11];
        for (int i = 0; i < 10; i++) {
            data[i] = (byte) 0x80;
        }
        Varint.decode(ByteBuffer.wrap(data));
    }

    // -- ZigZag --

    @Test
    public void testZigZag() {
        assertEquals(0L, Varint.encodeZigZag(0));
        assertEquals(1L, Varint.encodeZigZag(-1));
        assertEquals(2L, Varint.encodeZigZag(1));
        assertEquals(3L, Varint.encodeZigZag(-2));
        assertEquals(-1L, Varint.encodeZigZag(Long.MIN_VALUE));
        assertEquals(-2L, Varint.encodeZigZag(Long.MAX_VALUE));
        for (long value : VALUES) {
            assertEquals(value, Varint.decodeZigZag(Varint.encodeZigZag(value)));
        }
    }

    @Test
    public void testZigZag32() {
        assertEquals(0, Varint.encodeZigZag32(0));
        assertEquals(1, Varint.encodeZigZag32(-1));
        assertEquals(2, Varint.encodeZigZag32(1));
        assertEquals(0xFFFFFFFE, Varint.encodeZigZag32(Integer.MAX_VALUE));
        assertEquals(0xFFFFFFFF, Varint.encodeZigZag32(Integer.MIN_VALUE));
        assertEquals(Integer.MIN_VALUE, Varint.decodeZigZag32(Varint.encodeZigZag32(Integer.MIN_VALUE)));
        assertEquals(-64, Varint.decodeZigZag32(Varint.encodeZigZag32(-64)));
    }

}

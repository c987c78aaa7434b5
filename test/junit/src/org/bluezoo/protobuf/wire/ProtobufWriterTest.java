package org.bluezoo.protobuf.wire;

import org.junit.Test;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;

/**
 * JUnit 4 test class for ProtobufWriter and ByteBufferChannel.
 * Expected bytes follow the examples in
 * https://protobuf.dev/programming-guides/encoding/
 */
public class ProtobufWriterTest {

    // -- Varints and tags --

    @Test
    public void testVarintValue150() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        writer.writeVarint(150);

        assertArrayEquals(new byte[] { (byte) 0x96, 0x01 }, channel.toByteArray());
        assertEquals(2L, writer.getBytesWritten());
    }

    @Test
    public void testUint32Field300() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        // Field 1, varint, value 300
        writer.writeTag(1, WireType.VARINT);
        writer.writeVarint(300);

        assertArrayEquals(new byte[] { 0x08, (byte) 0xAC, 0x02 }, channel.toByteArray());
    }

    @Test
    public void testNegativeVarint() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        writer.writeVarint(-2L);

        byte[] data = channel.toByteArray();
        assertEquals(10, data.length);
        assertEquals((byte) 0xFE, data[0]);
        assertEquals((byte) 0x01, data[9]);
    }

    // -- Fixed-size values --

    @Test
    public void testFixed32LittleEndian() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        writer.writeFixed32(0x01020304);

        assertArrayEquals(new byte[] { 0x04, 0x03, 0x02, 0x01 }, channel.toByteArray());
    }

    @Test
    public void testFixed64LittleEndian() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        writer.writeFixed64(0x0102030405060708L);

        assertArrayEquals(new byte[] { 0x08, 0x07, 0x06, 0x05, 0x04, 0x03, 0x02, 0x01 },
                channel.toByteArray());
    }

    @Test
    public void testDoubleBits() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        writer.writeFixed64(Double.doubleToRawLongBits(1.0));

        // 1.0 = 0x3FF0000000000000
        byte[] data = channel.toByteArray();
        assertEquals((byte) 0xF0, data[6]);
        assertEquals((byte) 0x3F, data[7]);
    }

    // -- Length-delimited --

    @Test
    public void testString() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);

        // Field 2, string "testing"
        writer.writeTag(2, WireType.LEN);
        writer.writeLengthDelimited("testing".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals(new byte[] { 0x12, 0x07, 0x74, 0x65, 0x73, 0x74, 0x69, 0x6e, 0x67 },
                channel.toByteArray());
    }

    @Test
    public void testLengthDelimitedBuffer() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);
        ByteBuffer data = ByteBuffer.wrap(new byte[] { 9, 8, 7, 6 });
        data.position(1);

        writer.writeLengthDelimited(data);

        assertArrayEquals(new byte[] { 3, 8, 7, 6 }, channel.toByteArray());
        assertFalse(data.hasRemaining());
    }

    // -- ByteBufferChannel --

    @Test
    public void testChannelGrows() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(2);
        ProtobufWriter writer = new ProtobufWriter(channel);
        byte[] data = new byte[1000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }

        writer.writeRawBytes(data);

        assertEquals(1000, channel.size());
        assertArrayEquals(data, channel.toByteArray());
        assertEquals(1000, channel.toByteBuffer().remaining());
    }

    @Test
    public void testChannelReset() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        ProtobufWriter writer = new ProtobufWriter(channel);
        writer.writeVarint(300);
        channel.reset();
        writer.writeVarint(1);

        assertArrayEquals(new byte[] { 0x01 }, channel.toByteArray());
    }

    @Test(expected = ClosedChannelException.class)
    public void testClosedChannel() throws IOException {
        ByteBufferChannel channel = new ByteBufferChannel(16);
        channel.close();
        assertFalse(channel.isOpen());
        new ProtobufWriter(channel).writeVarint(1);
    }

}

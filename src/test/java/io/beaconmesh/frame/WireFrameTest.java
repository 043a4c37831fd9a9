package io.beaconmesh.frame;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class WireFrameTest {

    @Test
    void toBytes() {
        var frame = WireFrame.builder()
                .senderId(new byte[]{'a', 'b', 0, 0})
                .channelHash(2280)
                .timestamp(1_700_000_000)
                .content("hi".getBytes(UTF_8))
                .build();

        var bytes = frame.toBytes();

        assertEquals("6162000008e86553f1006869", Hex.encodeHexString(bytes));
        assertEquals(12, frame.length());
    }

    @Test
    void channelHashKeepsFifteenBits() {
        var frame = WireFrame.builder()
                .senderId(new byte[4])
                .channelHash(0xFFFF)
                .timestamp(0)
                .content(new byte[0])
                .build();

        assertEquals("000000007fff00000000", Hex.encodeHexString(frame.toBytes()));
    }

    @Test
    void fromBytes() throws DecoderException {
        var frame = WireFrame.fromBytes(Hex.decodeHex("6162000008e86553f1006869"));

        assertArrayEquals(new byte[]{'a', 'b', 0, 0}, frame.getSenderId());
        assertEquals(2280, frame.getChannelHash());
        assertEquals(1_700_000_000_000L, frame.getTimestampMillis());
        assertEquals("hi", new String(frame.getContent(), UTF_8));
    }

    @Test
    void timestampIsUnsigned() throws DecoderException {
        var frame = WireFrame.fromBytes(Hex.decodeHex("000000000001ffffffff"));

        assertEquals(0xFFFFFFFFL * 1000, frame.getTimestampMillis());
        assertEquals(0, frame.getContent().length);
    }
}

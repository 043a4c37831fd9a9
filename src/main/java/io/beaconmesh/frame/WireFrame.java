package io.beaconmesh.frame;

import com.igormaznitsa.jbbp.io.JBBPBitInputStream;
import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import com.igormaznitsa.jbbp.io.JBBPByteOrder;
import com.igormaznitsa.jbbp.mapper.Bin;
import com.igormaznitsa.jbbp.mapper.BinType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.SneakyThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static io.beaconmesh.constant.MeshConstant.CHANNEL_HASH_MASK;
import static io.beaconmesh.constant.MeshConstant.HEADER_BYTES;
import static io.beaconmesh.constant.MeshConstant.SENDER_ID_BYTES;

/**
 * Bit exact beacon payload: {@code [senderId:4][channelHash:2][timestampSeconds:4][content:0..10]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WireFrame {

    @Bin(name = "sender_id", type = BinType.BYTE_ARRAY, byteOrder = JBBPByteOrder.BIG_ENDIAN, order = 0)
    private byte[] senderId;

    @Bin(name = "channel_hash", type = BinType.USHORT, byteOrder = JBBPByteOrder.BIG_ENDIAN, order = 1)
    private int channelHash;

    /**
     * Unsigned seconds since epoch
     */
    @Bin(name = "timestamp", type = BinType.INT, byteOrder = JBBPByteOrder.BIG_ENDIAN, order = 2)
    private int timestamp;

    @Bin(name = "content", type = BinType.BYTE_ARRAY, byteOrder = JBBPByteOrder.BIG_ENDIAN, order = 3)
    private byte[] content;

    public WireFrame read(final JBBPBitInputStream In) throws IOException {
        this.senderId = In.readByteArray(SENDER_ID_BYTES, JBBPByteOrder.BIG_ENDIAN);
        this.channelHash = In.readUnsignedShort(JBBPByteOrder.BIG_ENDIAN);
        this.timestamp = In.readInt(JBBPByteOrder.BIG_ENDIAN);
        this.content = In.readByteArray(-1, JBBPByteOrder.BIG_ENDIAN);

        return this;
    }

    public WireFrame write(final JBBPBitOutputStream Out) throws IOException {
        Out.writeBytes(this.senderId, SENDER_ID_BYTES, JBBPByteOrder.BIG_ENDIAN);
        Out.writeShort(this.channelHash & CHANNEL_HASH_MASK, JBBPByteOrder.BIG_ENDIAN);
        Out.writeInt(this.timestamp, JBBPByteOrder.BIG_ENDIAN);
        Out.writeBytes(this.content, this.content.length, JBBPByteOrder.BIG_ENDIAN);
        Out.flush();

        return this;
    }

    /**
     * Parse a received payload. Content is whatever follows the header.
     */
    @SneakyThrows
    public static WireFrame fromBytes(@NonNull byte[] payload) {
        try (var in = new JBBPBitInputStream(new ByteArrayInputStream(payload))) {
            return new WireFrame().read(in);
        }
    }

    @SneakyThrows
    public byte[] toBytes() {
        var out = new ByteArrayOutputStream(length());
        try (var bits = new JBBPBitOutputStream(out)) {
            write(bits);
        }

        return out.toByteArray();
    }

    public long getTimestampMillis() {
        return Integer.toUnsignedLong(timestamp) * 1000L;
    }

    public int length() {
        return HEADER_BYTES + content.length;
    }
}

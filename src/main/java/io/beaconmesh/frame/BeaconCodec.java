package io.beaconmesh.frame;

import io.beaconmesh.channel.ChannelRouter;
import io.beaconmesh.message.Message;
import io.beaconmesh.message.MessageOrigin;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

import static io.beaconmesh.constant.MeshConstant.ACK_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.ACK_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.ACK_FINGERPRINT_LENGTH;
import static io.beaconmesh.constant.MeshConstant.CHANNEL_HASH_MASK;
import static io.beaconmesh.constant.MeshConstant.DELETE_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.DELETE_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.HEADER_BYTES;
import static io.beaconmesh.constant.MeshConstant.INVITE_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.INVITE_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.INVITE_SEPARATOR;
import static io.beaconmesh.constant.MeshConstant.MAX_CONTENT_BYTES;
import static io.beaconmesh.constant.MeshConstant.SENDER_ID_BYTES;
import static io.beaconmesh.utils.HashUtils.fullHash;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.isNull;
import static org.apache.commons.codec.binary.Hex.encodeHexString;
import static org.apache.commons.lang3.ArrayUtils.subarray;
import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.apache.commons.lang3.StringUtils.substringAfter;
import static org.apache.commons.lang3.StringUtils.substringBefore;

/**
 * Encodes messages and control events into wire frames and back.
 * <p>
 * Encoding is lossy: the sender id is cut to 4 bytes, the timestamp to whole seconds and the content
 * to 10 bytes, which may split a multi-byte character. Decoding never throws; anything it can't make
 * sense of, including traffic for channels this device hasn't joined, decodes to {@code null}.
 */
@Slf4j
@RequiredArgsConstructor
public class BeaconCodec {
    private final ChannelRouter channelRouter;

    /**
     * Messages on the ack, invite and delete pseudo-channels are sent under their sentinel hash.
     */
    public byte[] encode(@NonNull Message message) {
        return encodeFrame(message.getSenderId(), channelHashOf(message.getChannelId()), message.getContent(), message.getTimestamp());
    }

    public static String inviteContent(String channelName, String channelId) {
        return channelName + INVITE_SEPARATOR + channelId;
    }

    public DecodedFrame decode(byte[] raw) {
        if (isNull(raw) || raw.length < HEADER_BYTES) {
            log.debug("Frame too short: {} bytes", isNull(raw) ? 0 : raw.length);
            return null;
        }

        WireFrame frame;
        try {
            frame = WireFrame.fromBytes(raw);
        } catch (Exception e) {
            log.debug("Malformed frame {}", encodeHexString(raw), e);
            return null;
        }

        var senderId = senderIdFromBytes(frame.getSenderId());
        var timestamp = frame.getTimestampMillis();
        var content = new String(frame.getContent(), UTF_8);
        var fingerprint = fingerprint(raw);

        switch (frame.getChannelHash()) {
            case INVITE_CHANNEL_HASH:
                return DecodedFrame.invite(parseInvite(content, senderId), fingerprint);
            case DELETE_CHANNEL_HASH:
                return DecodedFrame.deletion(new ChannelDeletion(content, senderId), fingerprint);
            case ACK_CHANNEL_HASH:
                return DecodedFrame.ack(receivedMessage(senderId, ACK_CHANNEL, frame, content), fingerprint);
            default:
                var channelId = channelRouter.resolve(frame.getChannelHash());
                if (isNull(channelId)) {
                    log.debug("Frame from {} for channel hash {} not joined", senderId, frame.getChannelHash());
                    return null;
                }

                return DecodedFrame.message(receivedMessage(senderId, channelId, frame, content), fingerprint);
        }
    }

    /**
     * Short identifier of a whole frame. Sender and receiver hold the same bytes, so they compute the same value,
     * and two messages sent within one second differ as long as their content does.
     *
     * @return {@value io.beaconmesh.constant.MeshConstant#ACK_FINGERPRINT_LENGTH} lower case hex characters
     */
    public static String fingerprint(@NonNull byte[] frame) {
        if (frame.length < HEADER_BYTES) {
            throw new IllegalArgumentException("Frame shorter than header: " + frame.length);
        }

        return encodeHexString(fullHash(frame)).substring(0, ACK_FINGERPRINT_LENGTH);
    }

    /**
     * Sender id from the first bytes of a raw frame, regardless of whether the rest parses.
     *
     * @return sender id, or null when the frame carries none
     */
    public static String extractSenderId(byte[] raw) {
        if (isNull(raw) || raw.length == 0) {
            return null;
        }
        var senderId = senderIdFromBytes(subarray(raw, 0, SENDER_ID_BYTES));

        return senderId.isEmpty() ? null : senderId;
    }

    private static int channelHashOf(String channelId) {
        switch (channelId) {
            case ACK_CHANNEL:
                return ACK_CHANNEL_HASH;
            case INVITE_CHANNEL:
                return INVITE_CHANNEL_HASH;
            case DELETE_CHANNEL:
                return DELETE_CHANNEL_HASH;
            default:
                return ChannelRouter.hash(channelId);
        }
    }

    private static byte[] encodeFrame(String senderId, int channelHash, String content, long timestampMs) {
        return WireFrame.builder()
                .senderId(senderIdToBytes(senderId))
                .channelHash(channelHash & CHANNEL_HASH_MASK)
                .timestamp((int) (timestampMs / 1000))
                .content(subarray(content.getBytes(UTF_8), 0, MAX_CONTENT_BYTES))
                .build()
                .toBytes();
    }

    private static byte[] senderIdToBytes(String senderId) {
        var bytes = new byte[SENDER_ID_BYTES];
        var source = senderId.getBytes(UTF_8);
        System.arraycopy(source, 0, bytes, 0, Math.min(source.length, SENDER_ID_BYTES));

        return bytes;
    }

    private static String senderIdFromBytes(byte[] bytes) {
        var end = bytes.length;
        while (end > 0 && bytes[end - 1] == 0) {
            end--;
        }

        return new String(bytes, 0, end, UTF_8);
    }

    private static ChannelInvite parseInvite(String content, String senderId) {
        var name = substringBefore(content, INVITE_SEPARATOR);
        var channelId = substringAfter(content, INVITE_SEPARATOR);
        if (isBlank(channelId)) {
            channelId = name.toLowerCase(Locale.ROOT).replace(' ', '-');
        }

        return new ChannelInvite(ChannelRouter.hash(channelId), name, channelId, senderId);
    }

    private static Message receivedMessage(String senderId, String channelId, WireFrame frame, String content) {
        return Message.builder()
                .id(senderId + "_" + frame.getTimestampMillis() + "_" + frame.getChannelHash())
                .channelId(channelId)
                .senderId(senderId)
                .senderName(senderId)
                .timestamp(frame.getTimestampMillis())
                .content(content)
                .origin(MessageOrigin.MESH)
                .build();
    }
}

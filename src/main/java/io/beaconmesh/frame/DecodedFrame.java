package io.beaconmesh.frame;

import io.beaconmesh.message.Message;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of decoding one received frame. Exactly one of message, invite and deletion is set,
 * according to {@link #getType()}. Acks carry a message on the ack pseudo-channel.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DecodedFrame {
    private final FrameType type;
    private final Message message;
    private final ChannelInvite invite;
    private final ChannelDeletion deletion;
    /**
     * Fingerprint of the frame header, what an ack for this frame refers to.
     */
    private final String fingerprint;

    public static DecodedFrame message(Message message, String fingerprint) {
        return new DecodedFrame(FrameType.MESSAGE, message, null, null, fingerprint);
    }

    public static DecodedFrame ack(Message message, String fingerprint) {
        return new DecodedFrame(FrameType.ACK, message, null, null, fingerprint);
    }

    public static DecodedFrame invite(ChannelInvite invite, String fingerprint) {
        return new DecodedFrame(FrameType.INVITE, null, invite, null, fingerprint);
    }

    public static DecodedFrame deletion(ChannelDeletion deletion, String fingerprint) {
        return new DecodedFrame(FrameType.DELETION, null, null, deletion, fingerprint);
    }
}

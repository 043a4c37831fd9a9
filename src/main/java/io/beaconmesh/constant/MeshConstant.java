package io.beaconmesh.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class MeshConstant {

    /**
     * Wire frame layout: [senderId:4][channelHash:2][timestampSeconds:4][content:0..10].
     * Multi-byte fields are big-endian.
     */
    public static final int SENDER_ID_BYTES = 4;
    public static final int CHANNEL_HASH_BYTES = 2;
    public static final int TIMESTAMP_BYTES = 4;
    public static final int MAX_CONTENT_BYTES = 10;
    public static final int HEADER_BYTES = SENDER_ID_BYTES + CHANNEL_HASH_BYTES + TIMESTAMP_BYTES;
    public static final int MAX_PAYLOAD_BYTES = HEADER_BYTES + MAX_CONTENT_BYTES;

    /**
     * Channel hashes live in a 15 bit space. The three highest values are reserved for control frames.
     */
    public static final int CHANNEL_HASH_MASK = 0x7FFF;
    public static final int INVITE_CHANNEL_HASH = 0x7FFF;
    public static final int DELETE_CHANNEL_HASH = 0x7FFE;
    public static final int ACK_CHANNEL_HASH = 0x7FFD;

    public static final String PRESENCE_CHANNEL = "_presence";
    public static final String ACK_CHANNEL = "_ack";
    /**
     * Pseudo-channels of outbound control messages, sent under the invite and delete sentinels.
     */
    public static final String INVITE_CHANNEL = "_invite";
    public static final String DELETE_CHANNEL = "_delete";
    public static final String DEFAULT_CHANNEL = "general";

    public static final String HEARTBEAT_CONTENT = "[heartbeat]";
    public static final String PING_CONTENT = "[ping]";

    public static final String ACK_PREFIX = "[ACK:";
    public static final String ACK_SUFFIX = "]";
    /**
     * Hex characters of the frame fingerprint carried by an ack. "[ACK:" + 4 + "]" is exactly 10 bytes.
     */
    public static final int ACK_FINGERPRINT_LENGTH = 4;

    public static final String INVITE_SEPARATOR = "|";

    /**
     * Outbound text longer than this many characters is cut so that it ends in an ellipsis and fits.
     */
    public static final int MAX_MESH_TEXT_CHARS = 10;
    public static final String ELLIPSIS = "...";

    public static final long SCAN_IDLE_TIMEOUT = 300_000; //ms
    public static final long ADVERTISE_DURATION = 10_000; //ms
    public static final long SCAN_RETRY_DELAY = 5_000; //ms
    public static final long ADVERTISE_RETRY_DELAY = 2_000; //ms
    public static final long ACK_RETRY_INTERVAL = 1_750; //ms
    public static final long HEARTBEAT_INTERVAL = 36_000; //ms

    public static final int ACK_MAX_ATTEMPTS = 3;
    /**
     * A message whose payload was refused this many times is dropped from the outbound queue.
     */
    public static final int MAX_PAYLOAD_REFUSALS = 3;
    public static final int OUTBOUND_QUEUE_CAPACITY = 50;
    public static final int DEDUP_CAPACITY = 100;
    public static final int ACK_CACHE_CAPACITY = 50;

    public static final String SERVICE_UUID = "0000F00D-0000-1000-8000-00805F9B34FB";

    public static final String CONFIG_FILE_NAME = "config.yml";
    public static final String DEFAULT_CONFIG_RESOURCE = "beaconmesh.default.yml";
}

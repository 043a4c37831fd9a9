package io.beaconmesh.message;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.util.UUID;

import static io.beaconmesh.constant.MeshConstant.DEFAULT_CHANNEL;

/**
 * A text message as the application sees it. The mesh engine only borrows it for transmission.
 */
@Data
@Builder(toBuilder = true)
public class Message {
    @NonNull
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @NonNull
    @Builder.Default
    private String channelId = DEFAULT_CHANNEL;

    @NonNull
    private String senderId;

    private String senderName;

    /**
     * Milliseconds since epoch
     */
    @Builder.Default
    private long timestamp = System.currentTimeMillis();

    @NonNull
    @Builder.Default
    private String content = "";

    @NonNull
    @Builder.Default
    private MessageOrigin origin = MessageOrigin.BRIDGE;

    public boolean isMeshOrigin() {
        return origin == MessageOrigin.MESH;
    }
}

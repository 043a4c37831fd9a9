package io.beaconmesh.upstream;

import io.beaconmesh.message.Message;

/**
 * Application side receiver of everything the mesh decodes.
 */
public interface MessageRouter {

    void onMeshMessageReceived(Message message, int rssi);

    void onChannelInviteReceived(int channelHash, String channelName, String senderId);

    void onChannelDeletionReceived(String channelName, String senderId);

    /**
     * Membership lookup for channels joined outside the engine.
     *
     * @return joined channel id for the hash, or null
     */
    default String resolveChannelByHash(int channelHash) {
        return null;
    }
}

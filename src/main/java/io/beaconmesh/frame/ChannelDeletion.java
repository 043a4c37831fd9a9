package io.beaconmesh.frame;

import lombok.Value;

/**
 * Tombstone for a channel its owner removed.
 */
@Value
public class ChannelDeletion {
    String channelName;
    String senderId;
}

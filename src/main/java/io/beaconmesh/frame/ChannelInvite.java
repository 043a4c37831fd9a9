package io.beaconmesh.frame;

import lombok.Value;

@Value
public class ChannelInvite {
    int channelHash;
    String channelName;
    String channelId;
    String senderId;
}

package io.beaconmesh.frame;

public enum FrameType {
    MESSAGE,
    INVITE,
    DELETION,
    ACK,
}
